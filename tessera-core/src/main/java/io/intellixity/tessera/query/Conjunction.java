package io.intellixity.tessera.query;

import java.util.Locale;

public enum Conjunction {
  AND, OR;

  public static Conjunction parse(String s) {
    String t = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    if ("and".equals(t)) return AND;
    if ("or".equals(t)) return OR;
    throw new QueryValidationException("Unknown conjunction '" + s + "'; expected and/or");
  }
}
