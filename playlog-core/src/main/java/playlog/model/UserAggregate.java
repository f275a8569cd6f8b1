package playlog.model;

import java.time.Instant;

/**
 * Running totals for one user within one guild.
 *
 * @param userId          user id
 * @param guildId         guild id
 * @param tracksPlayed    plays recorded for the user in the guild
 * @param listeningTimeMs summed track durations in milliseconds
 * @param firstPlayedAt   time of the first play
 * @param lastPlayedAt    time of the most recent play
 */
public record UserAggregate(
    String userId,
    String guildId,
    long tracksPlayed,
    long listeningTimeMs,
    Instant firstPlayedAt,
    Instant lastPlayedAt) {
}
