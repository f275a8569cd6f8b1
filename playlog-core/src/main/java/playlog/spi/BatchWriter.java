package playlog.spi;

import playlog.FlushResult;
import playlog.PlayEvent;

import java.util.List;

/**
 * Writes a batch of buffered play events to durable storage.
 *
 * <p>Implementations open one transaction per call. A failure of a single event must be
 * absorbed and reported in {@link FlushResult#failed()}; the transaction still commits.
 * A failure of the transaction as a whole must be thrown, in which case the caller treats
 * the entire batch as unwritten and may retry it.
 *
 * @see playlog.flush.RetryController
 */
@FunctionalInterface
public interface BatchWriter {

  /**
   * Writes {@code events} in insertion order.
   *
   * @param events non-empty batch
   * @return written and failed row counts
   * @throws RuntimeException if the transaction could not be opened or committed
   */
  FlushResult write(List<PlayEvent> events);
}
