package io.intellixity.tessera.ir;

public record PropertyColumn(String propertyName, String column) {}
