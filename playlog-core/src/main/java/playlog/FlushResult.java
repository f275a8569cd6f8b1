package playlog;

/**
 * Outcome of one flush cycle or one batch write.
 *
 * @param flushed rows written successfully
 * @param failed  rows that could not be written
 * @param skipped {@code true} when the flush did not run because another flush was in flight
 */
public record FlushResult(int flushed, int failed, boolean skipped) {

  private static final FlushResult EMPTY = new FlushResult(0, 0, false);
  private static final FlushResult SKIPPED = new FlushResult(0, 0, true);

  public FlushResult {
    if (flushed < 0 || failed < 0) {
      throw new IllegalArgumentException("counts must be >= 0");
    }
  }

  public static FlushResult of(int flushed, int failed) {
    return new FlushResult(flushed, failed, false);
  }

  /** No work was pending. */
  public static FlushResult empty() {
    return EMPTY;
  }

  /** Another flush was already in progress. */
  public static FlushResult skippedResult() {
    return SKIPPED;
  }

  public int total() {
    return flushed + failed;
  }
}
