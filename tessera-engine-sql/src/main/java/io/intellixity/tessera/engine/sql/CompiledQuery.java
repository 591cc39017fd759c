package io.intellixity.tessera.engine.sql;

import java.util.List;

/** SQL text plus the output headers, in column order. */
public record CompiledQuery(String sql, List<String> headers) {
  public CompiledQuery {
    headers = List.copyOf(headers);
  }
}
