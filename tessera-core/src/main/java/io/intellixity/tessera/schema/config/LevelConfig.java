package io.intellixity.tessera.schema.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LevelConfig(@JsonProperty("name") String name,
                          @JsonProperty("key_column") String keyColumn,
                          @JsonProperty("name_column") String nameColumn,
                          @JsonProperty("key_type") String keyType,
                          @JsonProperty("properties") List<PropertyConfig> properties,
                          @JsonProperty("default_members") List<String> defaultMembers) {}
