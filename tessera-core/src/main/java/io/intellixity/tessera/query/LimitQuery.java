package io.intellixity.tessera.query;

/** Row limit with optional offset. Form: {@code n} or {@code offset,n}. */
public record LimitQuery(long offset, long n) {
  public LimitQuery {
    if (offset < 0) throw new QueryValidationException("limit offset must be >= 0");
    if (n < 0) throw new QueryValidationException("limit must be >= 0");
  }

  public static LimitQuery parse(String s) {
    String[] parts = s == null ? new String[0] : s.split(",");
    try {
      if (parts.length == 1) return new LimitQuery(0, Long.parseLong(parts[0].trim()));
      if (parts.length == 2) return new LimitQuery(Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()));
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Could not parse limit '" + s + "': not an integer", e);
    }
    throw new QueryValidationException("Could not parse limit '" + s + "': expected n or offset,n");
  }
}
