package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HierarchyConfig(@JsonProperty("name") String name,
                              @JsonProperty("table") TableConfig table,
                              @JsonProperty("primary_key") String primaryKey,
                              @JsonProperty("levels") List<LevelConfig> levels) {}
