package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DimensionConfig(@JsonProperty("name") String name,
                              @JsonProperty("foreign_key") String foreignKey,
                              @JsonProperty("hierarchies") List<HierarchyConfig> hierarchies,
                              @JsonProperty("default_hierarchy") String defaultHierarchy) {}
