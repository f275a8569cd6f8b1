/**
 * Micrometer integration: {@link playlog.micrometer.MicrometerMetricsExporter} publishes
 * batcher counters, the flush timer and the buffer depth gauge to a {@code MeterRegistry}.
 */
package playlog.micrometer;
