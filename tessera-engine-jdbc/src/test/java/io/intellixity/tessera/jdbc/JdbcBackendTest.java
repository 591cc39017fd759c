package io.intellixity.tessera.jdbc;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.intellixity.tessera.dataframe.ColumnType;
import io.intellixity.tessera.dataframe.DataFrame;
import io.intellixity.tessera.dataframe.TypeConversionException;
import io.intellixity.tessera.engine.sql.AnsiSqlDialect;
import io.intellixity.tessera.exec.ConnectionException;
import io.intellixity.tessera.exec.FrameStream;
import io.intellixity.tessera.exec.SqlExecutionException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcBackendTest {
  private static final String DB = "tessera_backend";
  private static JdbcBackend backend;

  @BeforeAll
  static void setUp() throws Exception {
    H2Fixture.createShop(DB);
    backend = H2Fixture.backend(DB, 3);
  }

  @AfterAll
  static void tearDown() {
    backend.close();
  }

  private static int active() {
    return backend.dataSource().getHikariPoolMXBean().getActiveConnections();
  }

  @Test
  void execSqlReturnsAllRowsAndColumns() {
    DataFrame df = backend.execSql("SELECT n, label FROM numbers ORDER BY n");
    assertEquals(10, df.rowCount());
    assertEquals(List.of("N", "LABEL"), df.columnNames());
    assertEquals(ColumnType.INT32, df.columns().get(0).data().type());
    assertEquals(1, df.value(0, 0));
    assertEquals(10, df.value(9, 0));
    assertNull(df.value(0, 1));
    assertEquals("even", df.value(1, 1));
    assertEquals(0, active());
  }

  @Test
  void execSqlMapsColumnTypes() {
    DataFrame df = backend.execSql("SELECT CAST(1 AS INTEGER) AS i, CAST(2 AS BIGINT) AS l, CAST(1.5 AS REAL) AS r, "
        + "CAST(2.5 AS DOUBLE PRECISION) AS d, TRUE AS b, 'x' AS s, CAST(NULL AS INTEGER) AS z");
    List<ColumnType> types = new ArrayList<>();
    df.columns().forEach(c -> types.add(c.data().type()));
    assertEquals(List.of(ColumnType.INT32, ColumnType.INT64, ColumnType.FLOAT32, ColumnType.FLOAT64,
        ColumnType.BOOL, ColumnType.TEXT, ColumnType.INT32), types);
    assertEquals(2L, df.value(0, 1));
    assertEquals(1.5f, df.value(0, 2));
    assertEquals(2.5d, df.value(0, 3));
    assertEquals(Boolean.TRUE, df.value(0, 4));
    assertEquals("x", df.value(0, 5));
    assertNull(df.value(0, 6));
  }

  @Test
  void unsupportedColumnTypeIsNamed() {
    TypeConversionException e = assertThrows(TypeConversionException.class,
        () -> backend.execSql("SELECT CAST(X'0102' AS VARBINARY) AS payload"));
    assertTrue(e.getMessage().contains("PAYLOAD"), e.getMessage());
    assertEquals(0, active());
  }

  @Test
  void badSqlFailsWithDatabaseMessage() {
    SqlExecutionException e = assertThrows(SqlExecutionException.class,
        () -> backend.execSql("SELECT * FROM no_such_table"));
    assertNotNull(e.getCause());
    assertEquals(e.getCause().getMessage(), e.getMessage());
    assertEquals(0, active());
  }

  @Test
  void streamYieldsBlocksInOrder() {
    List<Integer> sizes = new ArrayList<>();
    List<Object> firsts = new ArrayList<>();
    try (FrameStream s = backend.execSqlStream("SELECT n FROM numbers ORDER BY n")) {
      while (s.hasNext()) {
        DataFrame df = s.next();
        sizes.add(df.rowCount());
        firsts.add(df.value(0, 0));
      }
    }
    assertEquals(List.of(3, 3, 3, 1), sizes);
    assertEquals(List.of(1, 4, 7, 10), firsts);
    assertEquals(0, active());
  }

  @Test
  void closingStreamEarlyReturnsConnection() {
    FrameStream s = backend.execSqlStream("SELECT n FROM numbers ORDER BY n");
    assertTrue(s.hasNext());
    assertEquals(3, s.next().rowCount());
    assertEquals(1, active());
    s.close();
    s.close();
    assertEquals(0, active());
    assertFalse(s.hasNext());
  }

  @Test
  void badStreamingSqlReleasesConnection() {
    assertThrows(SqlExecutionException.class, () -> backend.execSqlStream("SELECT FROM WHERE"));
    assertEquals(0, active());
  }

  @Test
  void checkUserWarnsOnWritableConnection() {
    Logger logger = (Logger) LoggerFactory.getLogger(JdbcBackend.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      backend.checkUser();
    } finally {
      logger.detachAppender(appender);
    }
    assertTrue(appender.list.stream().anyMatch(e ->
        e.getLevel() == Level.WARN && e.getFormattedMessage().contains("write access")));
  }

  @Test
  void checkUserLogsUnexpectedFailuresInsteadOfThrowing() {
    JdbcBackendConfig cfg = new JdbcBackendConfig();
    cfg.setJdbcUrl(H2Fixture.url(DB));
    cfg.setUsername("sa");
    cfg.setPassword("");
    cfg.setMaximumPoolSize(1);
    Logger logger = (Logger) LoggerFactory.getLogger(JdbcBackend.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try (JdbcBackend b = new JdbcBackend(cfg, new AnsiSqlDialect()) {
      @Override
      protected boolean hasWriteAccess(Connection c) {
        throw new IllegalStateException("privileges unavailable");
      }
    }) {
      assertDoesNotThrow(b::checkUser);
      assertEquals(0, b.dataSource().getHikariPoolMXBean().getActiveConnections());
    } finally {
      logger.detachAppender(appender);
    }
    assertTrue(appender.list.stream().anyMatch(e ->
        e.getLevel() == Level.WARN && e.getFormattedMessage().contains("privileges unavailable")));
  }

  @Test
  void unreachableDatabaseFailsWithConnectionError() {
    JdbcBackendConfig cfg = new JdbcBackendConfig();
    cfg.setJdbcUrl("jdbc:h2:tcp://localhost:1/unreachable");
    cfg.setUsername("sa");
    cfg.setPassword("");
    cfg.setConnectionTimeoutMs(250);
    try (JdbcBackend b = new JdbcBackend(cfg, new AnsiSqlDialect())) {
      assertThrows(ConnectionException.class, () -> b.execSql("SELECT 1"));
      assertThrows(ConnectionException.class, () -> b.execSqlStream("SELECT 1"));
      assertDoesNotThrow(b::checkUser);
    }
  }

  @Test
  void backendIdFollowsDialect() {
    assertEquals(AnsiSqlDialect.ID, backend.id());
  }
}
