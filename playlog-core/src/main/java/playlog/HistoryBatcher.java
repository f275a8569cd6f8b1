package playlog;

import playlog.buffer.EventBuffer;
import playlog.flush.FlushScheduler;
import playlog.flush.LinearBackoffRetryPolicy;
import playlog.flush.RetryController;
import playlog.flush.RetryPolicy;
import playlog.spi.BatchWriter;
import playlog.spi.MetricsExporter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers play events in memory and writes them to storage in batches.
 *
 * <p>Producers call {@link #enqueue(String, String, TrackInfo)}, which never blocks and
 * never throws for capacity reasons. A batch is written when the flush timer fires
 * ({@code flushIntervalMs}, default 5 s) or as soon as {@code maxQueueSize} events
 * (default 100) are pending, whichever comes first. Whole-batch failures are retried
 * {@code maxRetries} times (default 3) with a linearly growing delay
 * ({@code retryDelayMs * attempt}, default 1 s base); a batch that still fails goes back to
 * the head of the buffer and is reported to {@link FlushListener#onError}.
 *
 * <p>{@link #shutdown()} stops the timer, refuses new events and performs one final
 * synchronous flush. Tie it to the owning process's teardown so buffered events are not
 * silently lost.
 *
 * <pre>{@code
 * HistoryBatcher batcher = HistoryBatcher.builder()
 *     .batchWriter(new JdbcHistoryWriter(store, recorder))
 *     .build();
 * batcher.start();
 *
 * batcher.enqueue(guildId, userId, TrackInfo.of("Song", "Artist", url, 215_000));
 *
 * batcher.shutdown();
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see HistoryBatcher.Builder
 */
public final class HistoryBatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HistoryBatcher.class.getName());

  private final EventBuffer buffer;
  private final FlushScheduler scheduler;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final AtomicLong totalQueued = new AtomicLong();
  private final AtomicLong totalRejected = new AtomicLong();
  private final AtomicLong totalDropped = new AtomicLong();
  private final AtomicLong totalFlushed = new AtomicLong();
  private final AtomicLong totalFailedRows = new AtomicLong();
  private final AtomicLong totalBatches = new AtomicLong();
  private final AtomicLong failedBatches = new AtomicLong();
  private final AtomicReference<Instant> lastFlushAt = new AtomicReference<>();
  private volatile int lastFlushCount;

  private volatile boolean shutdown;

  private HistoryBatcher(Builder builder) {
    BatchWriter writer = Objects.requireNonNull(builder.batchWriter, "batchWriter");
    if (builder.maxQueueSize <= 0) {
      throw new IllegalArgumentException("maxQueueSize must be > 0");
    }
    if (builder.flushIntervalMs <= 0L) {
      throw new IllegalArgumentException("flushIntervalMs must be > 0");
    }
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    if (builder.retryDelayMs < 0L) {
      throw new IllegalArgumentException("retryDelayMs must be >= 0");
    }
    int maxPending = builder.maxPendingEvents > 0
        ? builder.maxPendingEvents : (int) Math.min(Integer.MAX_VALUE, 100L * builder.maxQueueSize);
    if (maxPending < builder.maxQueueSize) {
      throw new IllegalArgumentException("maxPendingEvents must be >= maxQueueSize");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.buffer = new EventBuffer(builder.maxQueueSize, maxPending, this::onDropped);

    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new LinearBackoffRetryPolicy(builder.retryDelayMs);
    RetryController retryController =
        new RetryController(writer, buffer, retryPolicy, builder.maxRetries, metrics);
    this.scheduler = new FlushScheduler(buffer, retryController, metrics,
        builder.flushIntervalMs, builder.drainTimeoutMs);
    this.scheduler.addListener(new StatsListener());
    builder.listeners.forEach(scheduler::addListener);

    logger.log(Level.INFO, "HistoryBatcher initialized: maxQueueSize={0}, maxPendingEvents={1}, "
            + "flushIntervalMs={2}, maxRetries={3}",
        new Object[]{builder.maxQueueSize, maxPending, builder.flushIntervalMs, builder.maxRetries});
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Arms the periodic flush timer. Calling it again while running is a no-op.
   *
   * @throws IllegalStateException if the batcher has been shut down
   */
  public synchronized void start() {
    if (shutdown) {
      throw new IllegalStateException("HistoryBatcher has been shut down");
    }
    if (scheduler.isStarted()) {
      logger.warning("HistoryBatcher already started");
      return;
    }
    scheduler.start();
    logger.info("HistoryBatcher started");
  }

  /**
   * Buffers a play of {@code track} by {@code userId} in {@code guildId}.
   *
   * @return {@code true} if accepted, {@code false} if the batcher is shutting down or an
   *     argument is {@code null}
   */
  public boolean enqueue(String guildId, String userId, TrackInfo track) {
    if (shutdown) {
      return reject("HistoryBatcher is shutting down");
    }
    if (guildId == null || userId == null || track == null) {
      return reject("guildId, userId and track are required (guild=" + guildId
          + ", user=" + userId + ")");
    }
    return enqueue(PlayEvent.of(guildId, userId, track, clock));
  }

  /**
   * Buffers {@code event}. Triggers an asynchronous flush when the buffer reaches
   * {@code maxQueueSize}; the caller never waits for it.
   *
   * @return {@code true} if accepted, {@code false} if the batcher is shutting down
   */
  public boolean enqueue(PlayEvent event) {
    if (event == null) {
      return reject("event is null");
    }
    EventBuffer.Append outcome = buffer.add(event);
    if (outcome == EventBuffer.Append.CLOSED) {
      return reject("HistoryBatcher is shutting down");
    }
    totalQueued.incrementAndGet();
    metrics.incrementEnqueued();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Play event queued: guild=" + event.guildId() + ", track=" + event.trackTitle()
          + ", queueSize=" + buffer.size());
    }
    if (outcome == EventBuffer.Append.AT_CAPACITY) {
      logger.log(Level.FINE, "Queue at capacity, requesting flush");
      scheduler.requestFlush();
    }
    return true;
  }

  private boolean reject(String reason) {
    totalRejected.incrementAndGet();
    metrics.incrementRejected();
    logger.warning("Cannot enqueue play event: " + reason);
    return false;
  }

  /**
   * Flushes pending events on the calling thread.
   *
   * @return the batch result; {@link FlushResult#skippedResult()} if a flush is already running
   */
  public FlushResult flush() {
    return scheduler.flush();
  }

  /**
   * Stops the timer, refuses new events, waits for an in-flight flush and writes whatever
   * is still pending. Later calls return {@link FlushResult#empty()}.
   *
   * @return the result of the final flush
   */
  public FlushResult shutdown() {
    synchronized (this) {
      if (shutdown) {
        return FlushResult.empty();
      }
      shutdown = true;
    }
    logger.info("HistoryBatcher shutting down...");
    buffer.close();
    scheduler.stop();
    FlushResult result = scheduler.flushAwaiting();
    int remaining = buffer.size();
    if (remaining > 0) {
      logger.severe("HistoryBatcher shut down with " + remaining + " unflushed events");
    }
    logger.log(Level.INFO, "HistoryBatcher shutdown complete: {0}", stats());
    return result;
  }

  /** Same as {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  public void addListener(FlushListener listener) {
    scheduler.addListener(listener);
  }

  public void removeListener(FlushListener listener) {
    scheduler.removeListener(listener);
  }

  /** Number of events waiting to be flushed. */
  public int size() {
    return buffer.size();
  }

  /** Same as {@link #size()}. */
  public int pendingCount() {
    return buffer.size();
  }

  /** Copy of the pending events in the order they will be written. */
  public List<PlayEvent> pendingEvents() {
    return buffer.snapshot();
  }

  public boolean isRunning() {
    return scheduler.isStarted() && !shutdown;
  }

  public boolean isShutdown() {
    return shutdown;
  }

  public BatcherStats stats() {
    long batches = totalBatches.get();
    long flushed = totalFlushed.get();
    return new BatcherStats(
        totalQueued.get(),
        totalRejected.get(),
        totalDropped.get(),
        flushed,
        totalFailedRows.get(),
        batches,
        failedBatches.get(),
        lastFlushAt.get(),
        lastFlushCount,
        batches == 0 ? 0 : Math.round((double) flushed / batches),
        buffer.size(),
        isRunning(),
        scheduler.isFlushing());
  }

  private void onDropped(int count) {
    totalDropped.addAndGet(count);
    metrics.incrementDropped(count);
  }

  private final class StatsListener implements FlushListener {
    @Override
    public void onFlush(FlushResult result) {
      totalFlushed.addAndGet(result.flushed());
      totalFailedRows.addAndGet(result.failed());
      totalBatches.incrementAndGet();
      lastFlushAt.set(clock.instant());
      lastFlushCount = result.flushed();
    }

    @Override
    public void onError(Throwable error, int failedCount) {
      failedBatches.incrementAndGet();
    }
  }

  /**
   * Builder for {@link HistoryBatcher}.
   */
  public static final class Builder {
    private BatchWriter batchWriter;
    private int maxQueueSize = 100;
    private long flushIntervalMs = 5000;
    private int maxRetries = 3;
    private long retryDelayMs = 1000;
    private RetryPolicy retryPolicy;
    private int maxPendingEvents;
    private long drainTimeoutMs = 30_000;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<FlushListener> listeners = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the writer that persists each batch.
     *
     * <p><b>Required.</b>
     *
     * @param batchWriter the batch writer
     * @return this builder
     */
    public Builder batchWriter(BatchWriter batchWriter) {
      this.batchWriter = batchWriter;
      return this;
    }

    /**
     * Sets the pending count that triggers an immediate flush.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param maxQueueSize flush threshold
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    /**
     * Sets the flush timer period in milliseconds.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param flushIntervalMs timer period
     * @return this builder
     */
    public Builder flushIntervalMs(long flushIntervalMs) {
      this.flushIntervalMs = flushIntervalMs;
      return this;
    }

    /**
     * Sets how many times a batch is attempted before it is re-queued.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxRetries attempts per flush
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the base retry delay; the n-th retry waits {@code retryDelayMs * n}.
     * Ignored when {@link #retryPolicy(RetryPolicy)} is set.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &ge; 0.
     *
     * @param retryDelayMs base delay in milliseconds
     * @return this builder
     */
    public Builder retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    /**
     * Replaces the linear backoff with a custom policy.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the hard cap on pending events, re-queued batches included. Beyond it the oldest
     * events are dropped.
     *
     * <p>Optional. Defaults to {@code maxQueueSize * 100}. Must be &ge; {@code maxQueueSize}.
     *
     * @param maxPendingEvents hard cap
     * @return this builder
     */
    public Builder maxPendingEvents(int maxPendingEvents) {
      this.maxPendingEvents = maxPendingEvents;
      return this;
    }

    /**
     * Sets how long shutdown waits for a flush already running on the scheduler thread.
     *
     * <p>Optional. Defaults to {@code 30000} ms.
     *
     * @param drainTimeoutMs wait in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to stamp events.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Registers a flush listener.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(FlushListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Builds the batcher. Call {@link HistoryBatcher#start()} to arm the flush timer.
     *
     * @return a new {@link HistoryBatcher}
     * @throws NullPointerException     if {@code batchWriter} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public HistoryBatcher build() {
      return new HistoryBatcher(this);
    }
  }
}
