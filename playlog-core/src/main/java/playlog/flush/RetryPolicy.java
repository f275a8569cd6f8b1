package playlog.flush;

/**
 * Strategy for computing the pause before re-attempting a failed batch write.
 *
 * @see LinearBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds after a failed attempt.
   *
   * @param attempt the attempt that just failed (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempt);
}
