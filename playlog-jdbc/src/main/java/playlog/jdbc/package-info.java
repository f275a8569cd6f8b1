/**
 * JDBC persistence for play history: {@link playlog.jdbc.PlayStore}, the
 * {@link playlog.jdbc.JdbcHistoryWriter} batch writer, {@link playlog.jdbc.AggregateRecorder}
 * and the read-side {@link playlog.jdbc.StatisticsRepository}.
 *
 * <p>Schema creation is handled by {@link playlog.jdbc.SchemaMigrator}, which applies the
 * classpath scripts of the active {@link playlog.jdbc.spi.Dialect}.
 */
package playlog.jdbc;
