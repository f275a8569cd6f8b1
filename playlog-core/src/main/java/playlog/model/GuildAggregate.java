package playlog.model;

import java.time.Instant;

/**
 * Running totals for one guild.
 *
 * @param guildId         guild id
 * @param tracksPlayed    plays recorded in the guild
 * @param listeningTimeMs summed track durations in milliseconds
 * @param lastActivityAt  time of the most recent play
 * @param createdAt       time the row was first written
 */
public record GuildAggregate(
    String guildId,
    long tracksPlayed,
    long listeningTimeMs,
    Instant lastActivityAt,
    Instant createdAt) {
}
