package io.intellixity.tessera.ir;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.schema.KeyType;

import java.util.List;

/**
 * A cut bound to its physical column.
 * <p>
 * {@code table} is null when the hierarchy lives in the fact table; otherwise the cut needs the join
 * {@code fact.foreignKey = table.primaryKey}.
 */
public record CutSql(LevelName levelName, TableSql table, String foreignKey, String primaryKey,
                     String column, KeyType keyType, List<String> members, boolean exclude) {
  public CutSql {
    members = List.copyOf(members);
  }

  public boolean inline() { return table == null; }
}
