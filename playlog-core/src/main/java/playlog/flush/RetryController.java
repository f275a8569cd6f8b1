package playlog.flush;

import playlog.FlushResult;
import playlog.PlayEvent;
import playlog.buffer.EventBuffer;
import playlog.spi.BatchWriter;
import playlog.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link BatchWriter} with a bounded number of attempts.
 *
 * <p>Only transaction-level failures (the writer throwing) are retried; rows the writer
 * reports as failed are final. Between attempts the controller sleeps for the delay
 * given by its {@link RetryPolicy}. When every attempt has failed, or the thread is
 * interrupted while waiting, the whole batch is put back at the head of the
 * {@link EventBuffer} and a {@link BatchWriteException} is thrown. An {@link Error} from
 * the writer is not retried: the batch is re-queued and the error rethrown.
 */
public final class RetryController {
  private static final Logger logger = Logger.getLogger(RetryController.class.getName());

  private final BatchWriter writer;
  private final EventBuffer buffer;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final MetricsExporter metrics;

  public RetryController(BatchWriter writer, EventBuffer buffer, RetryPolicy retryPolicy,
      int maxRetries, MetricsExporter metrics) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    this.maxRetries = maxRetries;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Writes {@code batch}, retrying whole-batch failures.
   *
   * @param batch events drained from the buffer
   * @return the writer's result from the first successful attempt
   * @throws BatchWriteException if all attempts failed; the batch has been re-queued
   * @throws Error if the writer threw one; the batch has been re-queued
   */
  public FlushResult execute(List<PlayEvent> batch) {
    if (batch.isEmpty()) {
      return FlushResult.empty();
    }
    RuntimeException lastFailure = null;
    int attempt = 0;
    while (attempt < maxRetries) {
      attempt++;
      try {
        FlushResult result = writer.write(batch);
        if (result == null) {
          throw new IllegalStateException("BatchWriter returned null");
        }
        if (attempt > 1) {
          logger.log(Level.INFO, "Batch of {0} events written on attempt {1}",
              new Object[]{batch.size(), attempt});
        }
        return result;
      } catch (RuntimeException e) {
        lastFailure = e;
        logger.log(Level.WARNING, "Batch write attempt " + attempt + "/" + maxRetries
            + " failed for " + batch.size() + " events", e);
      } catch (Error e) {
        buffer.requeue(batch);
        metrics.incrementFlushFailure();
        throw e;
      }
      if (attempt < maxRetries) {
        metrics.incrementRetry();
        if (!pause(retryPolicy.computeDelayMs(attempt))) {
          logger.warning("Interrupted while waiting to retry; re-queueing batch");
          break;
        }
      }
    }
    buffer.requeue(batch);
    metrics.incrementFlushFailure();
    throw new BatchWriteException(batch.size(), attempt, lastFailure);
  }

  public int maxRetries() {
    return maxRetries;
  }

  private static boolean pause(long delayMs) {
    if (delayMs <= 0) {
      return !Thread.currentThread().isInterrupted();
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
