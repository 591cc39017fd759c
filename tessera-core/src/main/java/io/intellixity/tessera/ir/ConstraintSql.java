package io.intellixity.tessera.ir;

import io.intellixity.tessera.query.Conjunction;
import io.intellixity.tessera.query.Constraint;

/**
 * Predicate on an aggregated column, addressed by its internal alias.
 * {@code conjunction}/{@code second} are null for single-constraint predicates.
 */
public record ConstraintSql(String alias, Constraint first, Conjunction conjunction, Constraint second) {
  public ConstraintSql(String alias, Constraint only) {
    this(alias, only, null, null);
  }
}
