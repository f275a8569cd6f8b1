/**
 * Flush scheduling and retry.
 *
 * <p>{@link playlog.flush.FlushScheduler} drains the buffer on a timer or on demand and
 * passes each batch to {@link playlog.flush.RetryController}, which retries whole-batch
 * failures with a {@link playlog.flush.RetryPolicy} and re-queues the batch when attempts
 * run out.
 */
package playlog.flush;
