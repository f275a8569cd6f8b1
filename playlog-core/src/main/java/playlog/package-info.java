/**
 * Buffered play-history ingestion.
 *
 * <h2>Core Design</h2>
 * <p>Producers hand play events to a {@link playlog.HistoryBatcher}, which keeps them in an
 * ordered in-memory {@linkplain playlog.buffer.EventBuffer buffer}. A
 * {@linkplain playlog.flush.FlushScheduler scheduler} drains the buffer when a timer fires
 * or when the buffer reaches capacity, and a
 * {@linkplain playlog.flush.RetryController retry controller} hands each batch to a
 * {@link playlog.spi.BatchWriter}. Only one batch write is in flight at a time.
 *
 * <p>Delivery is at-least-once: a batch whose transaction keeps failing is put back at the
 * head of the buffer. Aggregate counters are eventually consistent with the history,
 * bounded by the flush interval.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>playlog-core</b>: buffer, scheduler, retry, lifecycle (zero external deps)</li>
 *   <li><b>playlog-jdbc</b>: JDBC store, batch writer, aggregate recorder</li>
 *   <li><b>playlog-micrometer</b>: Micrometer metrics</li>
 *   <li><b>playlog-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * PlayStore store = new PlayStore(dataSource);
 * store.initialize();
 *
 * HistoryBatcher batcher = HistoryBatcher.builder()
 *     .batchWriter(new JdbcHistoryWriter(store, new AggregateRecorder(store)))
 *     .listener(new FlushListener() {
 *       public void onError(Throwable error, int failedCount) {
 *         alerts.raise(error);
 *       }
 *     })
 *     .build();
 * batcher.start();
 *
 * batcher.enqueue("guild-1", "user-7", TrackInfo.of("Song", "Artist", url, 215_000));
 *
 * // on process teardown
 * batcher.shutdown();
 * }</pre>
 *
 * @see playlog.HistoryBatcher
 * @see playlog.FlushListener
 * @see playlog.PlayEvent
 */
package playlog;
