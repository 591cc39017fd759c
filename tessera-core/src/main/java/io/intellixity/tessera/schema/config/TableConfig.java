package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TableConfig(@JsonProperty("name") String name,
                          @JsonProperty("schema") String schema,
                          @JsonProperty("primary_key") String primaryKey) {}
