package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Root of the schema document. Keys are snake_case; unknown keys are ignored. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaConfig(@JsonProperty("name") String name,
                           @JsonProperty("cubes") List<CubeConfig> cubes) {}
