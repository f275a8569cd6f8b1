/**
 * Service provider interfaces for storage backends and metrics.
 *
 * @see playlog.spi.BatchWriter
 * @see playlog.spi.MetricsExporter
 */
package playlog.spi;
