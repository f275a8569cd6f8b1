package playlog.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import playlog.jdbc.dialect.H2Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayStoreTest {

  private JdbcDataSource dataSource;
  private PlayStore store;

  @BeforeEach
  void setUp() {
    dataSource = TestDataSources.h2("store");
    store = new PlayStore(dataSource);
  }

  // ── Lifecycle ──

  @Test
  void operationsBeforeInitializeFailFast() {
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> store.query("SELECT 1", rs -> 1));
    assertTrue(e.getMessage().contains("not initialized"));
    assertThrows(IllegalStateException.class, () -> store.execute("DELETE FROM history"));
    assertThrows(IllegalStateException.class, () -> store.transaction(conn -> null));
    assertThrows(IllegalStateException.class, () -> store.checkIntegrity());
    assertFalse(store.isReady());
  }

  @Test
  void initializeDetectsDialectAndIsIdempotent() {
    assertSame(store, store.initialize());
    assertSame(store, store.initialize());
    assertTrue(store.isReady());
    assertInstanceOf(H2Dialect.class, store.dialect());
    assertEquals(List.of("001", "002", "003"),
      new SchemaMigrator(dataSource, store.dialect()).appliedVersions());
  }

  @Test
  void operationsAfterCloseFail() {
    store.initialize();
    store.close();
    store.close();
    assertFalse(store.isReady());
    assertThrows(IllegalStateException.class, () -> store.query("SELECT 1", rs -> 1));
    assertThrows(IllegalStateException.class, () -> store.initialize());
  }

  @Test
  void initializeWithoutMigrationsRequiresTables() {
    PlayStore unmigrated = new PlayStore(dataSource, new H2Dialect(), false);
    PlayStoreException e = assertThrows(PlayStoreException.class, unmigrated::initialize);
    assertTrue(e.getMessage().contains("history"));
    assertFalse(unmigrated.isReady());

    new SchemaMigrator(dataSource, new H2Dialect()).migrate();
    assertTrue(unmigrated.initialize().isReady());
  }

  // ── Statements ──

  @Test
  void executeQueryAndQueryOne() {
    store.initialize();
    int changes = store.execute(
      "INSERT INTO history (guild_id, user_id, track_title, track_duration) VALUES (?,?,?,?)",
      "g1", "u1", "Song", 1000L);
    assertEquals(1, changes);

    List<String> titles = store.query("SELECT track_title FROM history WHERE guild_id = ?",
      rs -> rs.getString("track_title"), "g1");
    assertEquals(List.of("Song"), titles);

    Long duration = store.queryOne("SELECT track_duration FROM history WHERE user_id = ?",
      rs -> rs.getLong("track_duration"), "u1");
    assertEquals(1000L, duration);

    assertNull(store.queryOne("SELECT track_title FROM history WHERE guild_id = ?",
      rs -> rs.getString(1), "missing"));
  }

  @Test
  void sqlErrorsSurfaceAsPlayStoreException() {
    store.initialize();
    assertThrows(PlayStoreException.class, () -> store.execute("INSERT INTO no_such_table VALUES (1)"));
  }

  // ── Transactions ──

  @Test
  void statementsInsideTransactionShareItsConnection() {
    store.initialize();
    assertThrows(IllegalStateException.class, () -> store.transaction(conn -> {
      store.execute("INSERT INTO guild_statistics (guild_id, tracks_played) VALUES (?, ?)", "g1", 1L);
      assertTrue(store.inTransaction());
      long inside = store.queryOne("SELECT COUNT(*) FROM guild_statistics", rs -> rs.getLong(1));
      assertEquals(1L, inside);
      throw new IllegalStateException("rollback");
    }));
    assertFalse(store.inTransaction());
    long after = store.queryOne("SELECT COUNT(*) FROM guild_statistics", rs -> rs.getLong(1));
    assertEquals(0L, after);
  }

  @Test
  void nestedTransactionFailureRollsBackOnlyInnerWork() {
    store.initialize();
    store.transaction(conn -> {
      store.execute("INSERT INTO guild_statistics (guild_id, tracks_played) VALUES (?, ?)", "outer", 1L);
      assertThrows(PlayStoreException.class, () -> store.transaction(inner -> {
        store.execute("INSERT INTO guild_statistics (guild_id, tracks_played) VALUES (?, ?)", "inner", 1L);
        store.execute("INSERT INTO guild_statistics (guild_id, tracks_played) VALUES (?, ?)", "outer", 1L);
        return null;
      }));
      return null;
    });
    List<String> guilds = store.query("SELECT guild_id FROM guild_statistics ORDER BY guild_id",
      rs -> rs.getString(1));
    assertEquals(List.of("outer"), guilds);
  }

  @Test
  void transactionReturnsCallbackResult() {
    store.initialize();
    Integer result = store.transaction(conn ->
      store.execute("INSERT INTO guild_statistics (guild_id) VALUES (?)", "g1"));
    assertEquals(1, result);
  }

  // ── Health ──

  @Test
  void integrityCheckPassesOnFreshSchema() {
    store.initialize();
    IntegrityReport report = store.checkIntegrity();
    assertTrue(report.healthy(), report.issues().toString());
    assertTrue(report.issues().isEmpty());
    assertTrue(store.isHealthy());
  }

  @Test
  void integrityCheckReportsMissingTable() throws SQLException {
    store.initialize();
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DROP TABLE track_statistics");
    }
    IntegrityReport report = store.checkIntegrity();
    assertFalse(report.healthy());
    assertEquals(List.of("Missing table: track_statistics"), report.issues());
  }

  @Test
  void integrityCheckReportsNegativeCounters() {
    store.initialize();
    store.execute("INSERT INTO guild_statistics (guild_id, tracks_played) VALUES (?, ?)", "g1", -1L);
    IntegrityReport report = store.checkIntegrity();
    assertFalse(report.healthy());
    assertTrue(report.issues().get(0).contains("negative"));
  }

  @Test
  void tableRowCountsCoverEveryTable() {
    store.initialize();
    store.execute("INSERT INTO history (guild_id, user_id, track_title) VALUES (?,?,?)", "g", "u", "t");
    Map<String, Long> counts = store.tableRowCounts();
    assertEquals(List.of("history", "guild_statistics", "user_statistics", "track_statistics"),
      List.copyOf(counts.keySet()));
    assertEquals(1L, counts.get("history"));
    assertEquals(0L, counts.get("guild_statistics"));
  }
}
