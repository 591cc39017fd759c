package io.intellixity.tessera.ir;

import io.intellixity.tessera.query.SortDirection;

public record SortSql(String alias, SortDirection direction) {}
