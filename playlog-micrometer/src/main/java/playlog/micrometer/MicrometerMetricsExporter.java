package playlog.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import playlog.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code playlog.enqueued}: events accepted into the buffer</li>
 *   <li>{@code playlog.enqueue.rejected}: events refused after shutdown</li>
 *   <li>{@code playlog.dropped}: events dropped at the buffer's hard cap</li>
 *   <li>{@code playlog.flush.rows.flushed}: history rows written</li>
 *   <li>{@code playlog.flush.rows.failed}: rows that failed individually</li>
 *   <li>{@code playlog.flush.retries}: batch attempts that were retried</li>
 *   <li>{@code playlog.flush.failures}: batches re-queued after exhausting retries</li>
 * </ul>
 *
 * <h3>Timer and gauge</h3>
 * <ul>
 *   <li>{@code playlog.flush.duration}: time per completed batch write, retries included</li>
 *   <li>{@code playlog.buffer.depth}: pending events after the last flush</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter rejected;
  private final Counter dropped;
  private final Counter rowsFlushed;
  private final Counter rowsFailed;
  private final Counter retries;
  private final Counter flushFailures;
  private final Timer flushDuration;
  private final Gauge bufferDepthGauge;

  private final AtomicInteger bufferDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "playlog"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "playlog");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "music.playlog"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = Counter.builder(namePrefix + ".enqueued")
        .description("Play events accepted into the buffer")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".enqueue.rejected")
        .description("Play events refused because the batcher was shut down")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".dropped")
        .description("Play events dropped at the buffer's hard cap")
        .register(registry);
    this.rowsFlushed = Counter.builder(namePrefix + ".flush.rows.flushed")
        .description("History rows written")
        .register(registry);
    this.rowsFailed = Counter.builder(namePrefix + ".flush.rows.failed")
        .description("History rows that failed individually")
        .register(registry);
    this.retries = Counter.builder(namePrefix + ".flush.retries")
        .description("Batch write attempts that failed and were retried")
        .register(registry);
    this.flushFailures = Counter.builder(namePrefix + ".flush.failures")
        .description("Batches re-queued after exhausting their retries")
        .register(registry);
    this.flushDuration = Timer.builder(namePrefix + ".flush.duration")
        .description("Time spent writing a batch, retries included")
        .register(registry);
    this.bufferDepthGauge = Gauge.builder(namePrefix + ".buffer.depth", bufferDepth, AtomicInteger::get)
        .description("Pending play events")
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementDropped(int count) {
    if (closed) return;
    dropped.increment(count);
  }

  @Override
  public void recordFlush(int flushed, int failed, long durationMs) {
    if (closed) return;
    rowsFlushed.increment(flushed);
    rowsFailed.increment(failed);
    flushDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementRetry() {
    if (closed) return;
    retries.increment();
  }

  @Override
  public void incrementFlushFailure() {
    if (closed) return;
    flushFailures.increment();
  }

  @Override
  public void recordBufferDepth(int depth) {
    if (closed) return;
    bufferDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry, so a shut-down
   * batcher leaves no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, rejected, dropped, rowsFlushed, rowsFailed,
        retries, flushFailures, flushDuration, bufferDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
