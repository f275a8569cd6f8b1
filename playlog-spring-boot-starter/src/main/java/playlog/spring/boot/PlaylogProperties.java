package playlog.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for playlog.
 *
 * @see PlaylogAutoConfiguration
 */
@ConfigurationProperties(prefix = "playlog")
public class PlaylogProperties {

    /**
     * Whether the store applies its bundled schema migrations on startup. Disable when the
     * tables are managed by an external migration tool.
     */
    private boolean initializeSchema = true;

    /**
     * Whether each written history row also updates the guild, user and track aggregates.
     */
    private boolean recordAggregates = true;

    private final Batcher batcher = new Batcher();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public boolean isRecordAggregates() {
        return recordAggregates;
    }

    public void setRecordAggregates(boolean recordAggregates) {
        this.recordAggregates = recordAggregates;
    }

    public Batcher getBatcher() {
        return batcher;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Batcher {
        private int maxQueueSize = 100;
        private long flushIntervalMs = 5000;
        private int maxRetries = 3;
        private long retryDelayMs = 1000;
        private int maxPendingEvents = 10_000;
        private long drainTimeoutMs = 30_000;
        private boolean autoStart = true;

        public int getMaxQueueSize() {
            return maxQueueSize;
        }

        public void setMaxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
        }

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public int getMaxPendingEvents() {
            return maxPendingEvents;
        }

        public void setMaxPendingEvents(int maxPendingEvents) {
            this.maxPendingEvents = maxPendingEvents;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Purge {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(30);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "playlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
