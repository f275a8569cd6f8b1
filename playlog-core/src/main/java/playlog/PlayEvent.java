package playlog;

import java.time.Clock;
import java.util.Objects;

/**
 * One "a track was played" fact waiting to be written to the store.
 *
 * <p>Events have no identity beyond their position in the buffer. They are
 * discarded after a successful batch write and re-inserted at the head of the
 * buffer when a batch exhausts its retries.
 *
 * @param guildId         guild the track was played in
 * @param userId          user who requested the track
 * @param trackTitle      track title
 * @param trackAuthor     track author
 * @param trackUrl        track URL, may be {@code null}
 * @param trackDurationMs track length in milliseconds
 * @param queuedAtEpochMs wall-clock time the event was enqueued
 */
public record PlayEvent(
    String guildId,
    String userId,
    String trackTitle,
    String trackAuthor,
    String trackUrl,
    long trackDurationMs,
    long queuedAtEpochMs) {

  public PlayEvent {
    Objects.requireNonNull(guildId, "guildId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(trackTitle, "trackTitle");
  }

  /**
   * Creates an event for {@code track}, stamped with the current time of {@code clock}.
   */
  public static PlayEvent of(String guildId, String userId, TrackInfo track, Clock clock) {
    Objects.requireNonNull(track, "track");
    return new PlayEvent(guildId, userId, track.title(), track.author(), track.url(),
        track.durationMs(), clock.millis());
  }

  public static PlayEvent of(String guildId, String userId, TrackInfo track) {
    return of(guildId, userId, track, Clock.systemUTC());
  }

  /** Returns the track portion of this event. */
  public TrackInfo track() {
    return new TrackInfo(trackTitle, trackAuthor, trackUrl, trackDurationMs);
  }
}
