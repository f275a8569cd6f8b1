package playlog.model;

import java.time.Instant;

/**
 * One user's totals summed over every guild they played in.
 *
 * @param userId          user id
 * @param guildCount      guilds with at least one play
 * @param tracksPlayed    plays across all guilds
 * @param listeningTimeMs summed durations across all guilds
 * @param firstPlayedAt   earliest first play, or {@code null}
 * @param lastPlayedAt    latest play, or {@code null}
 */
public record UserTotals(
    String userId,
    int guildCount,
    long tracksPlayed,
    long listeningTimeMs,
    Instant firstPlayedAt,
    Instant lastPlayedAt) {
}
