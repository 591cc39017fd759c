package io.intellixity.tessera.ir;

import io.intellixity.tessera.schema.Aggregator;

public record MeasureSql(String name, String column, Aggregator aggregator) {}
