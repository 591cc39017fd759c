package io.intellixity.tessera.ir;

public record LimitSql(long offset, long n) {}
