package io.intellixity.tessera.schema;

import java.math.BigDecimal;
import java.util.Locale;

/** Type of a level's key column; decides how cut members are rendered as literals. */
public enum KeyType {
  TEXT, INTEGER, FLOAT;

  public static KeyType parse(String s) {
    if (s == null || s.isBlank()) return TEXT;
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "text", "string", "str" -> TEXT;
      case "integer", "int", "long" -> INTEGER;
      case "float", "double", "decimal" -> FLOAT;
      default -> throw new SchemaException("Unknown key type '" + s + "'");
    };
  }

  /** True when {@code member} is a valid literal for this key type. */
  public boolean accepts(String member) {
    if (this == TEXT) return true;
    try {
      if (this == INTEGER) Long.parseLong(member.trim());
      else new BigDecimal(member.trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
