package io.intellixity.tessera.ir;

/** One output column: the alias used inside generated SQL and the header exposed to callers. */
public record ProjectedColumn(String alias, String header) {}
