package io.intellixity.tessera.ir;

public record RcaSql(int drillIndex1, int drillIndex2, int measureIndex) {}
