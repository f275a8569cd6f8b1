package playlog.spi;

/**
 * Observability hook for exporting batcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events accepted into the buffer.
   */
  void incrementEnqueued();

  /**
   * Increments the count of events refused because the batcher was shut down.
   */
  void incrementRejected();

  /**
   * Adds to the count of events dropped because the buffer hit its hard cap.
   *
   * @param count dropped events
   */
  void incrementDropped(int count);

  /**
   * Records the outcome of a completed batch write.
   *
   * @param flushed    rows written
   * @param failed     rows that failed individually
   * @param durationMs time spent writing, retries included
   */
  void recordFlush(int flushed, int failed, long durationMs);

  /**
   * Increments the count of batch attempts that failed and will be retried.
   */
  void incrementRetry();

  /**
   * Increments the count of batches that exhausted their retries and were re-queued.
   */
  void incrementFlushFailure();

  /**
   * Records the current number of pending events.
   *
   * @param depth pending events
   */
  void recordBufferDepth(int depth);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementDropped(int count) {
    }

    @Override
    public void recordFlush(int flushed, int failed, long durationMs) {
    }

    @Override
    public void incrementRetry() {
    }

    @Override
    public void incrementFlushFailure() {
    }

    @Override
    public void recordBufferDepth(int depth) {
    }
  }
}
