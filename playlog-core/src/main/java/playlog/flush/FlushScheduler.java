package playlog.flush;

import playlog.FlushListener;
import playlog.FlushResult;
import playlog.PlayEvent;
import playlog.buffer.EventBuffer;
import playlog.spi.MetricsExporter;
import playlog.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves buffered events to the {@link RetryController}, one batch at a time.
 *
 * <p>Two triggers feed the same flush: a fixed-delay timer armed by {@link #start()}, and
 * {@link #requestFlush()} which the batcher calls when the buffer reaches capacity. Both
 * run on a single daemon thread. {@link #flush()} may also be called directly from any
 * thread.
 *
 * <p>A flush lock admits one batch write at a time. A flush that finds the lock held
 * returns {@link FlushResult#skippedResult()} immediately instead of waiting. Each flush
 * atomically drains the whole buffer, so events enqueued during a write wait for the
 * next cycle.
 */
public final class FlushScheduler {
  private static final Logger logger = Logger.getLogger(FlushScheduler.class.getName());

  private final EventBuffer buffer;
  private final RetryController retryController;
  private final MetricsExporter metrics;
  private final long intervalMs;
  private final long drainTimeoutMs;
  private final List<FlushListener> listeners = new CopyOnWriteArrayList<>();
  private final ReentrantLock flushLock = new ReentrantLock();
  private final AtomicBoolean flushRequested = new AtomicBoolean();

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> timerTask;
  private volatile boolean stopped;

  /**
   * @param buffer          source of pending events
   * @param retryController writes drained batches
   * @param metrics         metrics sink, or {@code null} for none
   * @param intervalMs      timer period in milliseconds
   * @param drainTimeoutMs  how long {@link #stop()} waits for a running flush
   */
  public FlushScheduler(EventBuffer buffer, RetryController retryController,
      MetricsExporter metrics, long intervalMs, long drainTimeoutMs) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.retryController = Objects.requireNonNull(retryController, "retryController");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (drainTimeoutMs < 0L) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.intervalMs = intervalMs;
    this.drainTimeoutMs = drainTimeoutMs;
  }

  public void addListener(FlushListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(FlushListener listener) {
    listeners.remove(listener);
  }

  /**
   * Arms the periodic timer. Subsequent calls are no-ops while armed.
   */
  public synchronized void start() {
    if (stopped) {
      throw new IllegalStateException("FlushScheduler has been stopped");
    }
    if (timerTask != null) {
      return;
    }
    timerTask = executor().scheduleWithFixedDelay(
        this::onTimer, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  public boolean isStarted() {
    return timerTask != null;
  }

  /**
   * Schedules an asynchronous flush on the scheduler thread and returns at once. Requests
   * made while one is already queued are coalesced.
   */
  public void requestFlush() {
    if (stopped || !flushRequested.compareAndSet(false, true)) {
      return;
    }
    try {
      executor().execute(() -> {
        flushRequested.set(false);
        flushQuietly();
      });
    } catch (RejectedExecutionException e) {
      flushRequested.set(false);
      logger.log(Level.FINE, "Flush request rejected; scheduler is stopping", e);
    }
  }

  /**
   * Flushes the buffer on the calling thread.
   *
   * @return the batch result, {@link FlushResult#empty()} if nothing was pending, or
   *     {@link FlushResult#skippedResult()} if another flush is in progress
   */
  public FlushResult flush() {
    if (!flushLock.tryLock()) {
      logger.fine("Flush already in progress, skipping");
      return FlushResult.skippedResult();
    }
    try {
      return flushLocked();
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * Waits for any in-progress flush to finish, then flushes on the calling thread.
   */
  public FlushResult flushAwaiting() {
    flushLock.lock();
    try {
      return flushLocked();
    } finally {
      flushLock.unlock();
    }
  }

  public boolean isFlushing() {
    return flushLock.isLocked();
  }

  /**
   * Disarms the timer and shuts down the scheduler thread, waiting up to the drain timeout
   * for a flush that is already running. Queued flush requests are discarded.
   */
  public synchronized void stop() {
    stopped = true;
    if (timerTask != null) {
      timerTask.cancel(false);
      timerTask = null;
    }
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Flush still running after " + drainTimeoutMs + " ms; interrupting");
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private synchronized ScheduledExecutorService executor() {
    if (executor == null) {
      executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("playlog-flush-"));
    }
    return executor;
  }

  private void onTimer() {
    if (buffer.isEmpty()) {
      return;
    }
    flushQuietly();
  }

  private void flushQuietly() {
    try {
      flush();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Flush cycle failed", t);
    }
  }

  private FlushResult flushLocked() {
    List<PlayEvent> batch = buffer.drain();
    if (batch.isEmpty()) {
      return FlushResult.empty();
    }
    long start = System.nanoTime();
    try {
      FlushResult result = retryController.execute(batch);
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      metrics.recordFlush(result.flushed(), result.failed(), durationMs);
      logger.log(Level.INFO, "History batch flushed: flushed={0}, failed={1}, durationMs={2}",
          new Object[]{result.flushed(), result.failed(), durationMs});
      notifyFlush(result);
      return result;
    } catch (BatchWriteException e) {
      logger.log(Level.SEVERE, "Batch flush failed; " + batch.size() + " events re-queued", e);
      notifyError(e, batch.size());
      return FlushResult.of(0, batch.size());
    } catch (Error e) {
      logger.log(Level.SEVERE, "Batch flush aborted; " + batch.size() + " events re-queued", e);
      notifyError(e, batch.size());
      throw e;
    } finally {
      metrics.recordBufferDepth(buffer.size());
    }
  }

  private void notifyFlush(FlushResult result) {
    for (FlushListener listener : listeners) {
      try {
        listener.onFlush(result);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "FlushListener.onFlush failed", e);
      }
    }
  }

  private void notifyError(Throwable error, int failedCount) {
    for (FlushListener listener : listeners) {
      try {
        listener.onError(error, failedCount);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "FlushListener.onError failed", e);
      }
    }
  }
}
