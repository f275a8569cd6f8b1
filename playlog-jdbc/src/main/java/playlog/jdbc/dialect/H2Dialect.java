package playlog.jdbc.dialect;

import playlog.jdbc.TableNames;

import java.util.List;

/**
 * H2 dialect. Upserts use {@code MERGE INTO ... USING}, the increments reading the target row.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String upsertGuildSql() {
    return "MERGE INTO " + TableNames.GUILD_STATISTICS + " t USING (SELECT" +
        " CAST(? AS VARCHAR) AS guild_id, CAST(? AS BIGINT) AS listening_time_ms," +
        " CAST(? AS TIMESTAMP) AS last_activity_at, CAST(? AS TIMESTAMP) AS created_at," +
        " CAST(? AS TIMESTAMP) AS updated_at) s" +
        " ON t.guild_id = s.guild_id" +
        " WHEN MATCHED THEN UPDATE SET tracks_played = t.tracks_played + 1," +
        " listening_time_ms = t.listening_time_ms + s.listening_time_ms," +
        " last_activity_at = s.last_activity_at, updated_at = s.updated_at" +
        " WHEN NOT MATCHED THEN INSERT (guild_id, tracks_played, listening_time_ms," +
        " last_activity_at, created_at, updated_at)" +
        " VALUES (s.guild_id, 1, s.listening_time_ms, s.last_activity_at, s.created_at, s.updated_at)";
  }

  @Override
  public String upsertUserSql() {
    return "MERGE INTO " + TableNames.USER_STATISTICS + " t USING (SELECT" +
        " CAST(? AS VARCHAR) AS user_id, CAST(? AS VARCHAR) AS guild_id," +
        " CAST(? AS BIGINT) AS listening_time_ms, CAST(? AS TIMESTAMP) AS first_played_at," +
        " CAST(? AS TIMESTAMP) AS last_played_at, CAST(? AS TIMESTAMP) AS updated_at) s" +
        " ON t.user_id = s.user_id AND t.guild_id = s.guild_id" +
        " WHEN MATCHED THEN UPDATE SET tracks_played = t.tracks_played + 1," +
        " listening_time_ms = t.listening_time_ms + s.listening_time_ms," +
        " last_played_at = s.last_played_at, updated_at = s.updated_at" +
        " WHEN NOT MATCHED THEN INSERT (user_id, guild_id, tracks_played, listening_time_ms," +
        " first_played_at, last_played_at, updated_at)" +
        " VALUES (s.user_id, s.guild_id, 1, s.listening_time_ms, s.first_played_at," +
        " s.last_played_at, s.updated_at)";
  }

  @Override
  public String upsertTrackSql() {
    return "MERGE INTO " + TableNames.TRACK_STATISTICS + " t USING (SELECT" +
        " CAST(? AS VARCHAR) AS track_url, CAST(? AS VARCHAR) AS track_title," +
        " CAST(? AS VARCHAR) AS track_author, CAST(? AS BIGINT) AS track_duration," +
        " CAST(? AS TIMESTAMP) AS last_played_at, CAST(? AS TIMESTAMP) AS updated_at) s" +
        " ON t.track_url = s.track_url" +
        " WHEN MATCHED THEN UPDATE SET total_plays = t.total_plays + 1," +
        " last_played_at = s.last_played_at, updated_at = s.updated_at" +
        " WHEN NOT MATCHED THEN INSERT (track_url, track_title, track_author, track_duration," +
        " total_plays, last_played_at, updated_at)" +
        " VALUES (s.track_url, s.track_title, s.track_author, s.track_duration, 1," +
        " s.last_played_at, s.updated_at)";
  }
}
