package playlog;

import java.time.Instant;

/**
 * Point-in-time counters of a {@link HistoryBatcher}.
 *
 * @param totalQueued      events accepted by {@code enqueue}
 * @param totalRejected    events refused after shutdown or for missing ids
 * @param totalDropped     events dropped because the buffer hit its hard cap
 * @param totalFlushed     rows written
 * @param totalFailedRows  rows that failed individually
 * @param totalBatches     batches written
 * @param failedBatches    batches that exhausted their retries
 * @param lastFlushAt      completion time of the last written batch, or {@code null}
 * @param lastFlushCount   rows written by the last batch
 * @param avgBatchSize     rounded average rows written per batch
 * @param currentQueueSize events pending right now
 * @param running          whether the flush timer is armed
 * @param flushing         whether a batch write is in flight
 */
public record BatcherStats(
    long totalQueued,
    long totalRejected,
    long totalDropped,
    long totalFlushed,
    long totalFailedRows,
    long totalBatches,
    long failedBatches,
    Instant lastFlushAt,
    int lastFlushCount,
    long avgBatchSize,
    int currentQueueSize,
    boolean running,
    boolean flushing) {
}
