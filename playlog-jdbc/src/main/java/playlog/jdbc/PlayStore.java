package playlog.jdbc;

import playlog.jdbc.dialect.Dialects;
import playlog.jdbc.spi.Dialect;
import playlog.jdbc.tx.JdbcTransactionManager;
import playlog.jdbc.tx.ThreadLocalTxContext;
import playlog.jdbc.tx.TransactionCallback;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent store for play history and aggregate statistics.
 *
 * <p>Must be {@linkplain #initialize() initialized} before use; every operation invoked
 * earlier, or after {@link #close()}, throws {@link IllegalStateException}. Statements issued
 * on a thread that is inside {@link #transaction(TransactionCallback)} run on that
 * transaction's connection; all others borrow an auto-commit connection from the
 * {@link DataSource} for the duration of the call.
 *
 * <p>The {@code DataSource} is owned by the caller and is not closed by this store.
 */
public final class PlayStore implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PlayStore.class.getName());
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final DataSource dataSource;
  private final boolean applyMigrations;
  private final ThreadLocalTxContext txContext = new ThreadLocalTxContext();
  private final JdbcTransactionManager txManager;

  private volatile Dialect dialect;
  private volatile boolean ready;
  private volatile boolean closed;

  public PlayStore(DataSource dataSource) {
    this(dataSource, null, true);
  }

  /**
   * @param dataSource      connection source, owned by the caller
   * @param dialect         dialect to use, or {@code null} to detect it from the JDBC URL
   * @param applyMigrations whether {@link #initialize()} applies pending schema migrations;
   *                        when {@code false} the tables must already exist
   */
  public PlayStore(DataSource dataSource, Dialect dialect, boolean applyMigrations) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = dialect;
    this.applyMigrations = applyMigrations;
    this.txManager = new JdbcTransactionManager(dataSource, txContext);
  }

  /**
   * Verifies connectivity, resolves the dialect, applies pending migrations and marks the
   * store ready. Calling it again on a ready store does nothing.
   *
   * @return this store
   * @throws PlayStoreException if the database is unreachable, a migration fails, or required
   *                            tables are missing while migrations are disabled
   */
  public synchronized PlayStore initialize() {
    if (closed) {
      throw new IllegalStateException("PlayStore is closed");
    }
    if (ready) {
      return this;
    }
    logger.info("Initializing play store...");
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new PlayStoreException("Database connection is not valid", null);
      }
    } catch (SQLException e) {
      throw new PlayStoreException("Failed to connect to database", e);
    }
    if (dialect == null) {
      dialect = Dialects.detect(dataSource);
    }
    if (applyMigrations) {
      new SchemaMigrator(dataSource, dialect).migrate();
    } else {
      List<String> missing = withConnection(this::missingTables);
      if (!missing.isEmpty()) {
        throw new PlayStoreException("Required tables missing: " + missing, null);
      }
    }
    ready = true;
    logger.log(Level.INFO, "Play store initialized (dialect={0})", dialect.name());
    return this;
  }

  public boolean isReady() {
    return ready && !closed;
  }

  /**
   * @return the resolved dialect
   * @throws IllegalStateException if not initialized
   */
  public Dialect dialect() {
    checkReady();
    return dialect;
  }

  public <T> List<T> query(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    checkReady();
    return withConnection(conn -> JdbcTemplate.query(conn, sql, mapper, params));
  }

  /** Returns the first mapped row, or {@code null} when the query yields none. */
  public <T> T queryOne(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    checkReady();
    return withConnection(conn -> JdbcTemplate.queryOne(conn, sql, mapper, params));
  }

  /** Executes a data-modifying statement and returns the number of rows changed. */
  public int execute(String sql, Object... params) {
    checkReady();
    return withConnection(conn -> JdbcTemplate.update(conn, sql, params));
  }

  /**
   * Runs {@code callback} in a transaction, committing if it returns and rolling back if it
   * throws. A call made while this thread already runs a transaction becomes a savepoint that
   * is released on success and rolled back on failure, leaving the outer transaction usable.
   *
   * @throws PlayStoreException wrapping any {@link SQLException}; runtime exceptions thrown by
   *                            the callback propagate unchanged
   */
  public <T> T transaction(TransactionCallback<T> callback) {
    checkReady();
    Objects.requireNonNull(callback, "callback");
    try {
      return txManager.execute(callback);
    } catch (SQLException e) {
      throw new PlayStoreException("Transaction failed: " + e.getMessage(), e);
    }
  }

  /** Whether the calling thread is inside {@link #transaction(TransactionCallback)}. */
  public boolean inTransaction() {
    return txContext.isTransactionActive();
  }

  /**
   * Checks connection validity, the presence of every required table, counter sanity and the
   * dialect's own integrity check.
   */
  public IntegrityReport checkIntegrity() {
    checkReady();
    List<String> issues = new ArrayList<>();
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        issues.add("Database connection is not valid");
      }
      List<String> missing = missingTables(conn);
      for (String table : missing) {
        issues.add("Missing table: " + table);
      }
      if (missing.isEmpty()) {
        long negative = JdbcTemplate.queryOne(conn,
            "SELECT COUNT(*) AS cnt FROM " + TableNames.GUILD_STATISTICS +
                " WHERE tracks_played < 0 OR listening_time_ms < 0",
            rs -> rs.getLong("cnt"));
        if (negative > 0) {
          issues.add(negative + " guild aggregate row(s) with negative counters");
        }
        issues.addAll(dialect.integrityIssues(conn, TableNames.REQUIRED));
      }
    } catch (SQLException | PlayStoreException e) {
      issues.add("Integrity check failed: " + e.getMessage());
    }
    IntegrityReport report = IntegrityReport.of(issues);
    if (report.healthy()) {
      logger.fine("Integrity check passed");
    } else {
      logger.log(Level.WARNING, "Integrity check found issues: {0}", report.issues());
    }
    return report;
  }

  public boolean isHealthy() {
    return checkIntegrity().healthy();
  }

  /** Row count per playlog table, in table creation order. */
  public Map<String, Long> tableRowCounts() {
    checkReady();
    return withConnection(conn -> {
      Map<String, Long> counts = new LinkedHashMap<>();
      for (String table : TableNames.REQUIRED) {
        counts.put(table, JdbcTemplate.queryOne(conn,
            "SELECT COUNT(*) AS cnt FROM " + table, rs -> rs.getLong("cnt")));
      }
      return counts;
    });
  }

  /** Marks the store unusable. Idempotent; the DataSource is left open. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    ready = false;
    logger.info("Play store closed");
  }

  private List<String> missingTables(Connection conn) {
    List<String> missing = new ArrayList<>();
    for (String table : TableNames.REQUIRED) {
      if (!tableExists(conn, table)) {
        missing.add(table);
      }
    }
    return missing;
  }

  // Probing with a query works regardless of how the database folds identifier case.
  private boolean tableExists(Connection conn, String table) {
    try {
      JdbcTemplate.query(conn, "SELECT 1 FROM " + table + " WHERE 1 = 0", rs -> 1);
      return true;
    } catch (PlayStoreException e) {
      logger.log(Level.FINE, "Table probe failed for " + table, e);
      return false;
    }
  }

  private <T> T withConnection(ConnectionFunction<T> fn) {
    if (txContext.isTransactionActive()) {
      return fn.apply(txContext.currentConnection());
    }
    try (Connection conn = dataSource.getConnection()) {
      return fn.apply(conn);
    } catch (SQLException e) {
      throw new PlayStoreException("Failed to obtain connection", e);
    }
  }

  private void checkReady() {
    if (closed) {
      throw new IllegalStateException("PlayStore is closed");
    }
    if (!ready) {
      throw new IllegalStateException("PlayStore not initialized. Call initialize() first.");
    }
  }

  @FunctionalInterface
  private interface ConnectionFunction<T> {
    T apply(Connection conn);
  }
}
