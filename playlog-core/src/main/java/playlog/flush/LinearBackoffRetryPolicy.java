package playlog.flush;

/**
 * Retry policy whose delay grows linearly with the attempt number.
 *
 * <p>Delay formula: {@code baseDelay * attempt}, capped at {@code maxDelay}.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public LinearBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public LinearBackoffRetryPolicy(long baseDelayMs) {
    this(baseDelayMs, Long.MAX_VALUE);
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    if (attempt > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return baseDelayMs * attempt;
  }
}
