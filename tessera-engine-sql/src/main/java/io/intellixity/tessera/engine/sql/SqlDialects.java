package io.intellixity.tessera.engine.sql;

import io.intellixity.tessera.schema.NotFoundException;
import io.intellixity.tessera.util.TesseraFactoriesLoader;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dialects discovered via {@code META-INF/tessera.factories}, keyed by {@link SqlDialect#id()}.
 * When two dialects share an id the first one on the classpath wins.
 */
public final class SqlDialects {
  private final Map<String, SqlDialect> byId;

  public SqlDialects() {
    this(TesseraFactoriesLoader.load(SqlDialect.class));
  }

  public SqlDialects(List<SqlDialect> dialects) {
    Map<String, SqlDialect> m = new LinkedHashMap<>();
    for (SqlDialect d : dialects) {
      if (d == null) continue;
      m.putIfAbsent(Objects.requireNonNull(d.id(), "dialect id"), d);
    }
    this.byId = Map.copyOf(m);
  }

  public SqlDialect get(String id) {
    SqlDialect d = byId.get(id);
    if (d == null) throw new NotFoundException("No SQL dialect registered for id=" + id + "; known=" + byId.keySet());
    return d;
  }

  public Set<String> ids() {
    return byId.keySet();
  }
}
