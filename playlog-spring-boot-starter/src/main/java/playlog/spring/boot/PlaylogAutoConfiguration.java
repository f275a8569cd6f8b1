package playlog.spring.boot;

import playlog.FlushListener;
import playlog.HistoryBatcher;
import playlog.jdbc.AggregateRecorder;
import playlog.jdbc.JdbcHistoryWriter;
import playlog.jdbc.PlayStore;
import playlog.jdbc.StatisticsRepository;
import playlog.jdbc.purge.HistoryPurgeScheduler;
import playlog.spi.BatchWriter;
import playlog.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for playlog.
 *
 * <p>Wires an initialized {@link PlayStore}, the JDBC batch writer and a started
 * {@link HistoryBatcher} from a {@link DataSource} and {@link PlaylogProperties}. The batcher
 * is shut down, flushing what it still holds, before the store is closed.
 *
 * @see PlaylogProperties
 * @see PlaylogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(HistoryBatcher.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(PlaylogProperties.class)
public class PlaylogAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public PlayStore playStore(DataSource dataSource, PlaylogProperties props) {
    return new PlayStore(dataSource, null, props.isInitializeSchema()).initialize();
  }

  @Bean
  @ConditionalOnMissingBean
  public AggregateRecorder aggregateRecorder(PlayStore playStore) {
    return new AggregateRecorder(playStore);
  }

  @Bean
  @ConditionalOnMissingBean(BatchWriter.class)
  public JdbcHistoryWriter historyWriter(PlayStore playStore, AggregateRecorder aggregateRecorder,
      PlaylogProperties props) {
    return props.isRecordAggregates()
        ? new JdbcHistoryWriter(playStore, aggregateRecorder)
        : new JdbcHistoryWriter(playStore);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public HistoryBatcher historyBatcher(PlaylogProperties props,
      BatchWriter batchWriter,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<FlushListener> listenerProvider) {
    PlaylogProperties.Batcher cfg = props.getBatcher();
    HistoryBatcher.Builder builder = HistoryBatcher.builder()
        .batchWriter(batchWriter)
        .maxQueueSize(cfg.getMaxQueueSize())
        .flushIntervalMs(cfg.getFlushIntervalMs())
        .maxRetries(cfg.getMaxRetries())
        .retryDelayMs(cfg.getRetryDelayMs())
        .maxPendingEvents(cfg.getMaxPendingEvents())
        .drainTimeoutMs(cfg.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    listenerProvider.orderedStream().forEach(builder::listener);
    HistoryBatcher batcher = builder.build();
    if (cfg.isAutoStart()) {
      batcher.start();
    }
    return batcher;
  }

  @Bean
  @ConditionalOnMissingBean
  public StatisticsRepository statisticsRepository(PlayStore playStore) {
    return new StatisticsRepository(playStore);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "playlog.purge", name = "enabled", havingValue = "true")
  public HistoryPurgeScheduler historyPurgeScheduler(PlayStore playStore, PlaylogProperties props) {
    PlaylogProperties.Purge cfg = props.getPurge();
    HistoryPurgeScheduler scheduler = HistoryPurgeScheduler.builder()
        .store(playStore)
        .retention(cfg.getRetention())
        .batchSize(cfg.getBatchSize())
        .intervalSeconds(cfg.getIntervalSeconds())
        .build();
    scheduler.start();
    return scheduler;
  }
}
