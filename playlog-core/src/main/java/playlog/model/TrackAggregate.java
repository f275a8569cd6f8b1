package playlog.model;

import java.time.Instant;

/**
 * Play count for one track URL across all guilds and users.
 *
 * @param trackUrl     track URL
 * @param trackTitle   title recorded on the first play
 * @param trackAuthor  author recorded on the first play
 * @param durationMs   duration recorded on the first play
 * @param totalPlays   plays recorded
 * @param lastPlayedAt time of the most recent play
 */
public record TrackAggregate(
    String trackUrl,
    String trackTitle,
    String trackAuthor,
    long durationMs,
    long totalPlays,
    Instant lastPlayedAt) {
}
