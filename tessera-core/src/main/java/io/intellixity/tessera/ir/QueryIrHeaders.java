package io.intellixity.tessera.ir;

import java.util.List;

public record QueryIrHeaders(QueryIr queryIr, List<String> headers) {
  public QueryIrHeaders {
    headers = List.copyOf(headers);
  }
}
