package playlog.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import playlog.FlushResult;
import playlog.HistoryBatcher;
import playlog.TrackInfo;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countsEnqueuedRejectedAndDropped() {
    exporter.incrementEnqueued();
    exporter.incrementEnqueued();
    exporter.incrementRejected();
    exporter.incrementDropped(5);

    assertEquals(2.0, counter("playlog.enqueued").count());
    assertEquals(1.0, counter("playlog.enqueue.rejected").count());
    assertEquals(5.0, counter("playlog.dropped").count());
  }

  @Test
  void recordFlushUpdatesRowCountersAndTimer() {
    exporter.recordFlush(8, 2, 40);
    exporter.recordFlush(5, 0, 60);

    assertEquals(13.0, counter("playlog.flush.rows.flushed").count());
    assertEquals(2.0, counter("playlog.flush.rows.failed").count());
    Timer timer = registry.find("playlog.flush.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(100.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void countsRetriesAndFailures() {
    exporter.incrementRetry();
    exporter.incrementRetry();
    exporter.incrementFlushFailure();

    assertEquals(2.0, counter("playlog.flush.retries").count());
    assertEquals(1.0, counter("playlog.flush.failures").count());
  }

  @Test
  void bufferDepthGauge() {
    exporter.recordBufferDepth(42);
    assertEquals(42.0, gauge("playlog.buffer.depth").value());
    exporter.recordBufferDepth(0);
    assertEquals(0.0, gauge("playlog.buffer.depth").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "music.playlog");
    prefixed.incrementEnqueued();

    Counter c = custom.find("music.playlog.enqueued").counter();
    assertNotNull(c);
    assertEquals(1.0, c.count());
    assertNull(custom.find("playlog.enqueued").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "playlog."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertNull(registry.find("playlog.enqueued").counter());
    assertNull(registry.find("playlog.buffer.depth").gauge());
    assertDoesNotThrow(() -> exporter.incrementEnqueued());
    assertDoesNotThrow(() -> exporter.recordFlush(1, 0, 1));
  }

  @Test
  void batcherReportsThroughExporter() {
    HistoryBatcher batcher = HistoryBatcher.builder()
        .batchWriter(events -> FlushResult.of(events.size(), 0))
        .metrics(exporter)
        .build();
    batcher.enqueue("g1", "u1", TrackInfo.of("Song", "Artist", null, 1000));
    batcher.enqueue("g1", "u2", TrackInfo.of("Song", "Artist", null, 1000));
    batcher.flush();
    batcher.shutdown();
    batcher.enqueue("g1", "u3", TrackInfo.of("Song", "Artist", null, 1000));

    assertEquals(2.0, counter("playlog.enqueued").count());
    assertEquals(2.0, counter("playlog.flush.rows.flushed").count());
    assertEquals(1.0, counter("playlog.enqueue.rejected").count());
    assertEquals(0.0, gauge("playlog.buffer.depth").value());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
