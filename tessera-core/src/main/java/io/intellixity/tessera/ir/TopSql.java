package io.intellixity.tessera.ir;

import io.intellixity.tessera.query.SortDirection;

/** Keep {@code n} rows per value of drilldown {@code drillIndex}, ranked by measure {@code measureIndex}. */
public record TopSql(int n, int drillIndex, int measureIndex, SortDirection direction) {}
