package playlog.jdbc.purge;

import playlog.jdbc.PlayStore;
import playlog.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes history rows older than a retention period.
 *
 * <p>Each purge cycle deletes in batches (default 500) until fewer than {@code batchSize} rows
 * are deleted. Every batch is a single auto-committed statement, which keeps lock durations
 * short. Aggregate rows are never touched, so after a purge a guild's {@code tracks_played}
 * exceeds its remaining history count.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see HistoryPurgeScheduler.Builder
 */
public final class HistoryPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HistoryPurgeScheduler.class.getName());

  private final PlayStore store;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private HistoryPurgeScheduler(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.clock = Objects.requireNonNull(builder.clock, "clock");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(30);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HistoryPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("playlog-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    logger.log(Level.INFO, "History purge scheduled every {0}s (retention {1})",
        new Object[]{intervalSeconds, retention});
  }

  /**
   * Executes a single purge cycle. May be invoked directly for one-off purges.
   *
   * @return number of history rows deleted; {@code 0} when closed or when the cycle failed
   */
  public long runOnce() {
    if (closed) {
      return 0L;
    }
    Instant cutoff = clock.instant().minus(retention);
    long totalDeleted = 0;
    try {
      String sql = store.dialect().purgeHistorySql();
      int deleted;
      do {
        deleted = store.execute(sql, cutoff, batchSize);
        totalDeleted += deleted;
      } while (deleted >= batchSize && !closed);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Purged {0} history rows older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "History purge cycle failed after deleting " + totalDeleted + " rows", t);
    }
    return totalDeleted;
  }

  public Duration retention() {
    return retention;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  /** Builder for {@link HistoryPurgeScheduler}. */
  public static final class Builder {
    private PlayStore store;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the store whose history table is purged.
     *
     * <p><b>Required.</b> Must be initialized before the first cycle runs.
     *
     * @param store the play store
     * @return this builder
     */
    public Builder store(PlayStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the retention period. History rows played longer ago than this are deleted.
     *
     * <p>Optional. Defaults to {@code 30 days}. Must be &ge; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum number of rows deleted per statement.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the interval in seconds between purge cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds purge interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Sets the clock used to compute the purge cutoff.
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
     * Builds the purge scheduler. Call {@link HistoryPurgeScheduler#start()} to begin.
     *
     * @return a new {@link HistoryPurgeScheduler}
     * @throws NullPointerException if {@code store} is null
     * @throws IllegalArgumentException if {@code retention} is negative,
     *     {@code batchSize <= 0}, or {@code intervalSeconds <= 0}
     */
    public HistoryPurgeScheduler build() {
      return new HistoryPurgeScheduler(this);
    }
  }
}
