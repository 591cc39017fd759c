package io.intellixity.tessera.engine.sql;

import io.intellixity.tessera.ir.QueryIrHeaders;
import io.intellixity.tessera.query.Query;
import io.intellixity.tessera.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles a {@link Query} against the current schema snapshot into dialect SQL and headers.
 * Validation happens before any SQL is produced.
 */
public final class SqlQueryCompiler {
  private static final Logger log = LoggerFactory.getLogger(SqlQueryCompiler.class);

  private final SchemaRegistry schemas;
  private final SqlDialects dialects;

  public SqlQueryCompiler(SchemaRegistry schemas, SqlDialects dialects) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialects = Objects.requireNonNull(dialects, "dialects");
  }

  public CompiledQuery sqlQuery(String cubeName, Query query, String dialectId) {
    SqlDialect dialect = dialects.get(dialectId);
    QueryIrHeaders resolved = schemas.current().sqlQuery(cubeName, query);
    String sql = dialect.render(resolved.queryIr());
    if (query.debug()) {
      log.info("tessera.sql cube={} dialect={} sql={}", cubeName, dialectId, sql);
    } else if (log.isDebugEnabled()) {
      log.debug("tessera.sql cube={} dialect={} headers={} sql={}", cubeName, dialectId, resolved.headers(), sql);
    }
    return new CompiledQuery(sql, resolved.headers());
  }
}
