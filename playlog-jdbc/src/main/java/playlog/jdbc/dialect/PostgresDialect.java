package playlog.jdbc.dialect;

import playlog.jdbc.TableNames;

import java.util.List;

/**
 * PostgreSQL dialect. Upserts use {@code ON CONFLICT ... DO UPDATE}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String upsertGuildSql() {
    String table = TableNames.GUILD_STATISTICS;
    return "INSERT INTO " + table + " (" +
        "guild_id, tracks_played, listening_time_ms, last_activity_at, created_at, updated_at" +
        ") VALUES (?,1,?,?,?,?)" +
        " ON CONFLICT (guild_id) DO UPDATE SET tracks_played = " + table + ".tracks_played + 1," +
        " listening_time_ms = " + table + ".listening_time_ms + EXCLUDED.listening_time_ms," +
        " last_activity_at = EXCLUDED.last_activity_at, updated_at = EXCLUDED.updated_at";
  }

  @Override
  public String upsertUserSql() {
    String table = TableNames.USER_STATISTICS;
    return "INSERT INTO " + table + " (" +
        "user_id, guild_id, tracks_played, listening_time_ms, first_played_at, last_played_at, updated_at" +
        ") VALUES (?,?,1,?,?,?,?)" +
        " ON CONFLICT (user_id, guild_id) DO UPDATE SET tracks_played = " + table + ".tracks_played + 1," +
        " listening_time_ms = " + table + ".listening_time_ms + EXCLUDED.listening_time_ms," +
        " last_played_at = EXCLUDED.last_played_at, updated_at = EXCLUDED.updated_at";
  }

  @Override
  public String upsertTrackSql() {
    String table = TableNames.TRACK_STATISTICS;
    return "INSERT INTO " + table + " (" +
        "track_url, track_title, track_author, track_duration, total_plays, last_played_at, updated_at" +
        ") VALUES (?,?,?,?,1,?,?)" +
        " ON CONFLICT (track_url) DO UPDATE SET total_plays = " + table + ".total_plays + 1," +
        " last_played_at = EXCLUDED.last_played_at, updated_at = EXCLUDED.updated_at";
  }
}
