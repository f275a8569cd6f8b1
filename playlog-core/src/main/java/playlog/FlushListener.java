package playlog;

/**
 * Receives flush notifications from a {@link HistoryBatcher}.
 *
 * <p>Callbacks run on the thread that performed the flush (the scheduler thread or
 * the caller of {@link HistoryBatcher#flush()}). Exceptions thrown by a listener are
 * logged and otherwise ignored.
 */
public interface FlushListener {

  /**
   * Called after a batch was written.
   *
   * @param result counts of written and failed rows
   */
  default void onFlush(FlushResult result) {
  }

  /**
   * Called when a batch exhausted its retries and was put back into the buffer.
   *
   * @param error       the last failure
   * @param failedCount number of events in the failed batch
   */
  default void onError(Throwable error, int failedCount) {
  }
}
