package playlog.buffer;

import playlog.PlayEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Insertion-ordered list of play events waiting to be flushed.
 *
 * <p>Two limits apply:
 * <ul>
 *   <li><b>capacity</b>: the flush threshold. {@link #add} reports
 *       {@link Append#AT_CAPACITY} once the pending count reaches it so the caller can
 *       trigger an immediate flush. Producers are never blocked.</li>
 *   <li><b>maxPending</b>: the hard cap, counted together with re-queued batches. When
 *       an append or re-queue would exceed it, the oldest events are dropped and
 *       reported to the drop callback.</li>
 * </ul>
 *
 * <p>All access goes through this class; every method is synchronized on the buffer.
 */
public final class EventBuffer {
  private static final Logger logger = Logger.getLogger(EventBuffer.class.getName());

  /** Result of {@link #add(PlayEvent)}. */
  public enum Append {
    ACCEPTED,
    AT_CAPACITY,
    CLOSED
  }

  private final int capacity;
  private final int maxPending;
  private final IntConsumer dropCallback;

  private List<PlayEvent> pending = new ArrayList<>();
  private boolean closed;

  /**
   * @param capacity     pending count at which {@link Append#AT_CAPACITY} is reported
   * @param maxPending   hard cap on pending events, re-queued ones included
   * @param dropCallback receives the number of events dropped on overflow
   */
  public EventBuffer(int capacity, int maxPending, IntConsumer dropCallback) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (maxPending < capacity) {
      throw new IllegalArgumentException("maxPending must be >= capacity");
    }
    this.capacity = capacity;
    this.maxPending = maxPending;
    this.dropCallback = Objects.requireNonNull(dropCallback, "dropCallback");
  }

  public EventBuffer(int capacity, int maxPending) {
    this(capacity, maxPending, count -> { });
  }

  /**
   * Appends {@code event} unless the buffer is closed.
   */
  public Append add(PlayEvent event) {
    Objects.requireNonNull(event, "event");
    int dropped;
    Append result;
    synchronized (this) {
      if (closed) {
        return Append.CLOSED;
      }
      pending.add(event);
      dropped = trimOverflow();
      result = pending.size() >= capacity ? Append.AT_CAPACITY : Append.ACCEPTED;
    }
    reportDropped(dropped);
    return result;
  }

  /**
   * Swaps the pending list for a new empty one and returns the old list in insertion order.
   */
  public synchronized List<PlayEvent> drain() {
    if (pending.isEmpty()) {
      return List.of();
    }
    List<PlayEvent> drained = pending;
    pending = new ArrayList<>();
    return drained;
  }

  /**
   * Puts a failed batch back in front of anything enqueued since it was drained, so it is
   * written first on the next flush. Allowed after {@link #close()}.
   */
  public void requeue(List<PlayEvent> batch) {
    if (batch.isEmpty()) {
      return;
    }
    int dropped;
    synchronized (this) {
      List<PlayEvent> merged = new ArrayList<>(batch.size() + pending.size());
      merged.addAll(batch);
      merged.addAll(pending);
      pending = merged;
      dropped = trimOverflow();
    }
    reportDropped(dropped);
  }

  public synchronized int size() {
    return pending.size();
  }

  public synchronized boolean isEmpty() {
    return pending.isEmpty();
  }

  /** Returns a copy of the pending events in flush order. */
  public synchronized List<PlayEvent> snapshot() {
    return List.copyOf(pending);
  }

  /** Refuses further {@link #add} calls. Pending events are kept. */
  public synchronized void close() {
    closed = true;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public int capacity() {
    return capacity;
  }

  public int maxPending() {
    return maxPending;
  }

  private int trimOverflow() {
    int overflow = pending.size() - maxPending;
    if (overflow <= 0) {
      return 0;
    }
    pending.subList(0, overflow).clear();
    return overflow;
  }

  private void reportDropped(int dropped) {
    if (dropped == 0) {
      return;
    }
    logger.log(Level.SEVERE, "Buffer exceeded {0} pending events; dropped {1} oldest",
        new Object[]{maxPending, dropped});
    try {
      dropCallback.accept(dropped);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Drop callback failed", e);
    }
  }
}
