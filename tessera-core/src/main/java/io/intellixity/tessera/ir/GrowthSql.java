package io.intellixity.tessera.ir;

/** Growth (or rate) of measure {@code measureIndex} along drilldown {@code timeDrillIndex}. */
public record GrowthSql(int timeDrillIndex, int measureIndex) {}
