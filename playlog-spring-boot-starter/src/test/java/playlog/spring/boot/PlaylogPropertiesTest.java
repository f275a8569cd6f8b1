package playlog.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaylogPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(PlaylogProperties.class);
      assertTrue(props.isInitializeSchema());
      assertTrue(props.isRecordAggregates());
      assertEquals(100, props.getBatcher().getMaxQueueSize());
      assertEquals(5000, props.getBatcher().getFlushIntervalMs());
      assertEquals(3, props.getBatcher().getMaxRetries());
      assertEquals(1000, props.getBatcher().getRetryDelayMs());
      assertEquals(10_000, props.getBatcher().getMaxPendingEvents());
      assertEquals(30_000, props.getBatcher().getDrainTimeoutMs());
      assertTrue(props.getBatcher().isAutoStart());
      assertFalse(props.getPurge().isEnabled());
      assertEquals(Duration.ofDays(30), props.getPurge().getRetention());
      assertEquals(500, props.getPurge().getBatchSize());
      assertEquals(3600, props.getPurge().getIntervalSeconds());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("playlog", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "playlog.initialize-schema=false",
        "playlog.record-aggregates=false",
        "playlog.batcher.max-queue-size=25",
        "playlog.batcher.flush-interval-ms=2000",
        "playlog.batcher.max-retries=5",
        "playlog.batcher.retry-delay-ms=250",
        "playlog.batcher.max-pending-events=400",
        "playlog.batcher.drain-timeout-ms=1500",
        "playlog.batcher.auto-start=false",
        "playlog.purge.enabled=true",
        "playlog.purge.retention=12h",
        "playlog.purge.batch-size=50",
        "playlog.purge.interval-seconds=60",
        "playlog.metrics.enabled=false",
        "playlog.metrics.name-prefix=bot.history"
    ).run(ctx -> {
      var props = ctx.getBean(PlaylogProperties.class);
      assertFalse(props.isInitializeSchema());
      assertFalse(props.isRecordAggregates());
      assertEquals(25, props.getBatcher().getMaxQueueSize());
      assertEquals(2000, props.getBatcher().getFlushIntervalMs());
      assertEquals(5, props.getBatcher().getMaxRetries());
      assertEquals(250, props.getBatcher().getRetryDelayMs());
      assertEquals(400, props.getBatcher().getMaxPendingEvents());
      assertEquals(1500, props.getBatcher().getDrainTimeoutMs());
      assertFalse(props.getBatcher().isAutoStart());
      assertTrue(props.getPurge().isEnabled());
      assertEquals(Duration.ofHours(12), props.getPurge().getRetention());
      assertEquals(50, props.getPurge().getBatchSize());
      assertEquals(60, props.getPurge().getIntervalSeconds());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("bot.history", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(PlaylogProperties.class)
  static class PropsConfig {
  }
}
