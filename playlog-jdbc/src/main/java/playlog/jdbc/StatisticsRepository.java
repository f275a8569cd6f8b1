package playlog.jdbc;

import playlog.model.GuildAggregate;
import playlog.model.TrackAggregate;
import playlog.model.UserAggregate;
import playlog.model.UserTotals;

import java.util.List;
import java.util.Objects;

/**
 * Read access to the aggregate tables and history counts.
 */
public final class StatisticsRepository {

  private static final JdbcTemplate.RowMapper<GuildAggregate> GUILD_MAPPER = rs -> new GuildAggregate(
      rs.getString("guild_id"),
      rs.getLong("tracks_played"),
      rs.getLong("listening_time_ms"),
      JdbcTemplate.instant(rs, "last_activity_at"),
      JdbcTemplate.instant(rs, "created_at"));

  private static final JdbcTemplate.RowMapper<UserAggregate> USER_MAPPER = rs -> new UserAggregate(
      rs.getString("user_id"),
      rs.getString("guild_id"),
      rs.getLong("tracks_played"),
      rs.getLong("listening_time_ms"),
      JdbcTemplate.instant(rs, "first_played_at"),
      JdbcTemplate.instant(rs, "last_played_at"));

  private static final JdbcTemplate.RowMapper<TrackAggregate> TRACK_MAPPER = rs -> new TrackAggregate(
      rs.getString("track_url"),
      rs.getString("track_title"),
      rs.getString("track_author"),
      rs.getLong("track_duration"),
      rs.getLong("total_plays"),
      JdbcTemplate.instant(rs, "last_played_at"));

  private static final String GUILD_COLUMNS =
      "guild_id, tracks_played, listening_time_ms, last_activity_at, created_at";
  private static final String USER_COLUMNS =
      "user_id, guild_id, tracks_played, listening_time_ms, first_played_at, last_played_at";
  private static final String TRACK_COLUMNS =
      "track_url, track_title, track_author, track_duration, total_plays, last_played_at";

  private final PlayStore store;

  public StatisticsRepository(PlayStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /** @return the guild's counters, or {@code null} if nothing was recorded for it */
  public GuildAggregate guild(String guildId) {
    return store.queryOne("SELECT " + GUILD_COLUMNS + " FROM " + TableNames.GUILD_STATISTICS +
        " WHERE guild_id = ?", GUILD_MAPPER, guildId);
  }

  /** @return the user's counters within one guild, or {@code null} */
  public UserAggregate user(String userId, String guildId) {
    return store.queryOne("SELECT " + USER_COLUMNS + " FROM " + TableNames.USER_STATISTICS +
        " WHERE user_id = ? AND guild_id = ?", USER_MAPPER, userId, guildId);
  }

  /** @return the track's counters, or {@code null} */
  public TrackAggregate track(String trackUrl) {
    return store.queryOne("SELECT " + TRACK_COLUMNS + " FROM " + TableNames.TRACK_STATISTICS +
        " WHERE track_url = ?", TRACK_MAPPER, trackUrl);
  }

  public List<GuildAggregate> topGuilds(int limit) {
    return store.query("SELECT " + GUILD_COLUMNS + " FROM " + TableNames.GUILD_STATISTICS +
        " ORDER BY tracks_played DESC, guild_id LIMIT ?", GUILD_MAPPER, positive(limit));
  }

  public List<UserAggregate> topUsersInGuild(String guildId, int limit) {
    return store.query("SELECT " + USER_COLUMNS + " FROM " + TableNames.USER_STATISTICS +
        " WHERE guild_id = ? ORDER BY tracks_played DESC, user_id LIMIT ?",
        USER_MAPPER, guildId, positive(limit));
  }

  /** Counters summed over every guild the user played in; zeros when there are none. */
  public UserTotals userTotals(String userId) {
    return store.queryOne("SELECT COUNT(*) AS guild_count," +
            " COALESCE(SUM(tracks_played), 0) AS tracks_played," +
            " COALESCE(SUM(listening_time_ms), 0) AS listening_time_ms," +
            " MIN(first_played_at) AS first_played_at, MAX(last_played_at) AS last_played_at" +
            " FROM " + TableNames.USER_STATISTICS + " WHERE user_id = ?",
        rs -> new UserTotals(
            userId,
            rs.getInt("guild_count"),
            rs.getLong("tracks_played"),
            rs.getLong("listening_time_ms"),
            JdbcTemplate.instant(rs, "first_played_at"),
            JdbcTemplate.instant(rs, "last_played_at")),
        userId);
  }

  public List<TrackAggregate> mostPlayedTracks(int limit) {
    return store.query("SELECT " + TRACK_COLUMNS + " FROM " + TableNames.TRACK_STATISTICS +
        " ORDER BY total_plays DESC, track_url LIMIT ?", TRACK_MAPPER, positive(limit));
  }

  public List<TrackAggregate> recentlyPlayedTracks(int limit) {
    return store.query("SELECT " + TRACK_COLUMNS + " FROM " + TableNames.TRACK_STATISTICS +
        " ORDER BY last_played_at DESC, track_url LIMIT ?", TRACK_MAPPER, positive(limit));
  }

  /** Number of history rows currently stored for the guild. */
  public long historyCount(String guildId) {
    return store.queryOne("SELECT COUNT(*) AS cnt FROM " + TableNames.HISTORY + " WHERE guild_id = ?",
        rs -> rs.getLong("cnt"), guildId);
  }

  private static int positive(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return limit;
  }
}
