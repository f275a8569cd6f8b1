package playlog.jdbc.spi;

import java.sql.Connection;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for history inserts, aggregate upserts and
 * retention purges. Register custom dialects via
 * {@code META-INF/services/playlog.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, MySQL, PostgreSQL.
 *
 * @see playlog.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Classpath directory holding this dialect's migration scripts.
   */
  default String migrationLocation() {
    return "playlog/migration/" + name();
  }

  /**
   * SQL for inserting one history row. {@code played_at} is assigned by the database.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>guild_id (String)</li>
   *   <li>user_id (String)</li>
   *   <li>track_title (String)</li>
   *   <li>track_author (String)</li>
   *   <li>track_url (String, nullable)</li>
   *   <li>track_duration (long)</li>
   * </ol>
   */
  String insertHistorySql();

  /**
   * SQL that creates the guild aggregate row or adds one play to it.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>guild_id (String)</li>
   *   <li>listening time to add, ms (long)</li>
   *   <li>last_activity_at (Timestamp)</li>
   *   <li>created_at (Timestamp, used on insert only)</li>
   *   <li>updated_at (Timestamp)</li>
   * </ol>
   */
  String upsertGuildSql();

  /**
   * SQL that creates the (user, guild) aggregate row or adds one play to it.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>user_id (String)</li>
   *   <li>guild_id (String)</li>
   *   <li>listening time to add, ms (long)</li>
   *   <li>first_played_at (Timestamp, used on insert only)</li>
   *   <li>last_played_at (Timestamp)</li>
   *   <li>updated_at (Timestamp)</li>
   * </ol>
   */
  String upsertUserSql();

  /**
   * SQL that creates the track aggregate row or adds one play to it. Title, author and
   * duration are only written when the row is created.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>track_url (String)</li>
   *   <li>track_title (String)</li>
   *   <li>track_author (String)</li>
   *   <li>track_duration (long)</li>
   *   <li>last_played_at (Timestamp)</li>
   *   <li>updated_at (Timestamp)</li>
   * </ol>
   */
  String upsertTrackSql();

  /**
   * SQL for deleting at most {@code limit} history rows played before a cutoff, oldest first.
   *
   * <p>Parameters: cutoff (Timestamp), limit (int)
   */
  String purgeHistorySql();

  /**
   * Runs the database's own integrity check over the given tables, if it has one.
   *
   * <p>Default implementation performs no check.
   *
   * @param conn   JDBC connection
   * @param tables tables to check
   * @return human-readable problems, empty when none were found
   */
  default List<String> integrityIssues(Connection conn, List<String> tables) {
    return List.of();
  }
}
