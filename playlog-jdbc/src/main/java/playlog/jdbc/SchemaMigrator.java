package playlog.jdbc;

import playlog.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the ordered SQL scripts found under the dialect's
 * {@link Dialect#migrationLocation() migration location}, each exactly once.
 *
 * <p>Applied versions are recorded in {@value TableNames#SCHEMA_MIGRATIONS}. Each script runs
 * in its own transaction together with its bookkeeping row. MySQL commits DDL implicitly, so
 * a script failing there may leave part of its changes behind.
 */
public final class SchemaMigrator {
  private static final Logger logger = Logger.getLogger(SchemaMigrator.class.getName());

  /** Scripts in application order. */
  static final List<Migration> MIGRATIONS = List.of(
      new Migration("001", "history"),
      new Migration("002", "aggregates"),
      new Migration("003", "indexes"));

  private final DataSource dataSource;
  private final Dialect dialect;
  private final Clock clock;

  public SchemaMigrator(DataSource dataSource, Dialect dialect) {
    this(dataSource, dialect, Clock.systemUTC());
  }

  public SchemaMigrator(DataSource dataSource, Dialect dialect, Clock clock) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Applies every pending migration.
   *
   * @return number of migrations applied by this call
   * @throws PlayStoreException if a script is missing or fails
   */
  public int migrate() {
    try (Connection conn = dataSource.getConnection()) {
      ensureMigrationsTable(conn);
      Set<String> applied = new HashSet<>(appliedVersions(conn));
      int count = 0;
      for (Migration migration : MIGRATIONS) {
        if (applied.contains(migration.version())) {
          continue;
        }
        apply(conn, migration);
        count++;
      }
      if (count > 0) {
        logger.log(Level.INFO, "Applied {0} migration(s) for dialect {1}",
            new Object[]{count, dialect.name()});
      }
      return count;
    } catch (SQLException e) {
      throw new PlayStoreException("Schema migration failed", e);
    }
  }

  /** Versions already recorded, in ascending order. */
  public List<String> appliedVersions() {
    try (Connection conn = dataSource.getConnection()) {
      ensureMigrationsTable(conn);
      return appliedVersions(conn);
    } catch (SQLException e) {
      throw new PlayStoreException("Failed to read applied migrations", e);
    }
  }

  private void ensureMigrationsTable(Connection conn) {
    JdbcTemplate.update(conn, "CREATE TABLE IF NOT EXISTS " + TableNames.SCHEMA_MIGRATIONS + " (" +
        "version VARCHAR(16) NOT NULL PRIMARY KEY, " +
        "name VARCHAR(128) NOT NULL, " +
        "applied_at TIMESTAMP NOT NULL)");
  }

  private static List<String> appliedVersions(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT version FROM " + TableNames.SCHEMA_MIGRATIONS + " ORDER BY version",
        rs -> rs.getString("version"));
  }

  private void apply(Connection conn, Migration migration) throws SQLException {
    String resource = dialect.migrationLocation() + "/" + migration.fileName();
    List<String> statements = splitStatements(load(resource));
    logger.log(Level.INFO, "Applying migration {0} ({1} statement(s))",
        new Object[]{resource, statements.size()});

    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
      JdbcTemplate.update(conn,
          "INSERT INTO " + TableNames.SCHEMA_MIGRATIONS + " (version, name, applied_at) VALUES (?,?,?)",
          migration.version(), migration.name(), Instant.now(clock));
      conn.commit();
    } catch (SQLException | RuntimeException e) {
      try {
        conn.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw new PlayStoreException("Migration " + resource + " failed", e);
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  private static String load(String resource) {
    ClassLoader loader = SchemaMigrator.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new PlayStoreException("Migration script not found on classpath: " + resource, null);
      }
      StringBuilder sb = new StringBuilder();
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          sb.append(line).append('\n');
        }
      }
      return sb.toString();
    } catch (IOException e) {
      throw new PlayStoreException("Failed to read migration script " + resource, e);
    }
  }

  /** Splits a script on statement-terminating semicolons, dropping {@code --} comment lines. */
  static List<String> splitStatements(String script) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : script.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line).append('\n');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().trim();
        statements.add(sql.substring(0, sql.length() - 1).trim());
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      statements.add(current.toString().trim());
    }
    return statements;
  }

  record Migration(String version, String name) {
    String fileName() {
      return version + "_" + name + ".sql";
    }
  }
}
