package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CubeConfig(@JsonProperty("name") String name,
                         @JsonProperty("table") TableConfig table,
                         @JsonProperty("min_auth_level") Integer minAuthLevel,
                         @JsonProperty("dimensions") List<DimensionConfig> dimensions,
                         @JsonProperty("measures") List<MeasureConfig> measures,
                         @JsonProperty("annotations") Map<String, String> annotations) {}
