package io.intellixity.tessera.names;

/** Bare measure identifier; no path structure. */
public record MeasureName(String name) {
  public MeasureName {
    if (name == null || name.isBlank()) throw new NameParseException("Measure name is blank");
  }

  public static MeasureName parse(String s) {
    return new MeasureName(s == null ? null : s.trim());
  }

  @Override
  public String toString() {
    return name;
  }
}
