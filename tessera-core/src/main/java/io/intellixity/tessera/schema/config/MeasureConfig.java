package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MeasureConfig(@JsonProperty("name") String name,
                            @JsonProperty("column") String column,
                            @JsonProperty("aggregator") String aggregator) {}
