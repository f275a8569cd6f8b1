package playlog.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the play store and its helpers.
 */
public final class PlayStoreException extends RuntimeException {
  public PlayStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
