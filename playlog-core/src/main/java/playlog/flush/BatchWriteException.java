package playlog.flush;

/**
 * Thrown when a batch could not be written within the allowed number of attempts.
 * The batch has already been returned to the buffer when this is thrown.
 */
public final class BatchWriteException extends RuntimeException {
  private final int batchSize;
  private final int attempts;

  public BatchWriteException(int batchSize, int attempts, Throwable cause) {
    super("Batch of " + batchSize + " events failed after " + attempts + " attempt(s)", cause);
    this.batchSize = batchSize;
    this.attempts = attempts;
  }

  public int batchSize() {
    return batchSize;
  }

  public int attempts() {
    return attempts;
  }
}
