package playlog.jdbc;

import playlog.PlayEvent;
import playlog.TrackInfo;
import playlog.jdbc.spi.Dialect;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maintains the guild, user and track counters for each play.
 *
 * <p>The three upserts of one play run in a single store transaction, or in a savepoint when
 * the caller already has one open, so either all counters move or none do. Plays without a
 * track URL update the guild and user counters only.
 */
public final class AggregateRecorder {
  private static final Logger logger = Logger.getLogger(AggregateRecorder.class.getName());

  private final PlayStore store;
  private final Clock clock;

  public AggregateRecorder(PlayStore store) {
    this(store, Clock.systemUTC());
  }

  public AggregateRecorder(PlayStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records one play. Failures are logged and reported through the return value.
   *
   * @return {@code true} if all counters were updated, {@code false} if the transaction was
   *     rolled back
   */
  public boolean recordPlay(String guildId, String userId, TrackInfo track) {
    try {
      record(guildId, userId, track);
      return true;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record play statistics for guild " + guildId +
          ", user " + userId, e);
      return false;
    }
  }

  /**
   * Records the play described by {@code event}.
   *
   * @throws PlayStoreException if any upsert fails; nothing is written in that case
   */
  public void record(PlayEvent event) {
    Objects.requireNonNull(event, "event");
    record(event.guildId(), event.userId(), event.track());
  }

  private void record(String guildId, String userId, TrackInfo track) {
    Objects.requireNonNull(guildId, "guildId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(track, "track");
    Instant now = clock.instant();
    store.transaction(conn -> {
      Dialect dialect = store.dialect();
      JdbcTemplate.update(conn, dialect.upsertGuildSql(),
          guildId, track.durationMs(), now, now, now);
      JdbcTemplate.update(conn, dialect.upsertUserSql(),
          userId, guildId, track.durationMs(), now, now, now);
      if (track.url() != null) {
        JdbcTemplate.update(conn, dialect.upsertTrackSql(),
            track.url(), track.title(), track.author(), track.durationMs(), now, now);
      }
      return null;
    });
    logger.log(Level.FINE, "Recorded play for guild {0}, user {1}", new Object[]{guildId, userId});
  }
}
