package io.intellixity.tessera.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Descriptive summary of a cube for metadata listings. */
public record CubeSourceData(String name, Table table, List<String> measures, Map<String, String> annotations) {
  public CubeSourceData {
    measures = List.copyOf(measures);
    annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
  }
}
