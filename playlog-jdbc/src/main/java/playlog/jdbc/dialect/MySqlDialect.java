package playlog.jdbc.dialect;

import playlog.jdbc.JdbcTemplate;
import playlog.jdbc.TableNames;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * MySQL dialect (also MariaDB). Upserts use {@code ON DUPLICATE KEY UPDATE}; integrity is
 * checked with {@code CHECK TABLE}.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public String upsertGuildSql() {
    return "INSERT INTO " + TableNames.GUILD_STATISTICS + " (" +
        "guild_id, tracks_played, listening_time_ms, last_activity_at, created_at, updated_at" +
        ") VALUES (?,1,?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE tracks_played = tracks_played + 1," +
        " listening_time_ms = listening_time_ms + VALUES(listening_time_ms)," +
        " last_activity_at = VALUES(last_activity_at), updated_at = VALUES(updated_at)";
  }

  @Override
  public String upsertUserSql() {
    return "INSERT INTO " + TableNames.USER_STATISTICS + " (" +
        "user_id, guild_id, tracks_played, listening_time_ms, first_played_at, last_played_at, updated_at" +
        ") VALUES (?,?,1,?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE tracks_played = tracks_played + 1," +
        " listening_time_ms = listening_time_ms + VALUES(listening_time_ms)," +
        " last_played_at = VALUES(last_played_at), updated_at = VALUES(updated_at)";
  }

  @Override
  public String upsertTrackSql() {
    return "INSERT INTO " + TableNames.TRACK_STATISTICS + " (" +
        "track_url, track_title, track_author, track_duration, total_plays, last_played_at, updated_at" +
        ") VALUES (?,?,?,?,1,?,?)" +
        " ON DUPLICATE KEY UPDATE total_plays = total_plays + 1," +
        " last_played_at = VALUES(last_played_at), updated_at = VALUES(updated_at)";
  }

  /** MySQL allows ORDER BY and LIMIT directly on DELETE but not on a subquery of the same table. */
  @Override
  public String purgeHistorySql() {
    return "DELETE FROM " + TableNames.HISTORY + " WHERE played_at < ? ORDER BY id LIMIT ?";
  }

  @Override
  public List<String> integrityIssues(Connection conn, List<String> tables) {
    if (tables.isEmpty()) {
      return List.of();
    }
    return JdbcTemplate.query(conn, "CHECK TABLE " + String.join(", ", tables), rs -> {
      String msgType = rs.getString("Msg_type");
      if (!"error".equalsIgnoreCase(msgType)) {
        return null;
      }
      return rs.getString("Table") + ": " + rs.getString("Msg_text");
    }).stream().filter(Objects::nonNull).toList();
  }
}
