package playlog.jdbc;

import playlog.FlushResult;
import playlog.PlayEvent;
import playlog.spi.BatchWriter;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BatchWriter} that inserts history rows, and optionally updates aggregates, through a
 * {@link PlayStore}.
 *
 * <p>A batch runs in one transaction. Every event gets its own savepoint holding its history
 * insert and, when an {@link AggregateRecorder} is configured, its counter upserts; a failing
 * event is rolled back to its savepoint, counted as failed and skipped. Failures of the
 * enclosing transaction propagate to the caller.
 */
public final class JdbcHistoryWriter implements BatchWriter {
  private static final Logger logger = Logger.getLogger(JdbcHistoryWriter.class.getName());

  private final PlayStore store;
  private final AggregateRecorder aggregateRecorder;

  /** Writes history rows only. */
  public JdbcHistoryWriter(PlayStore store) {
    this(store, null);
  }

  /**
   * @param store             initialized store
   * @param aggregateRecorder recorder applied to each written event, or {@code null} to write
   *                          history only
   */
  public JdbcHistoryWriter(PlayStore store, AggregateRecorder aggregateRecorder) {
    this.store = Objects.requireNonNull(store, "store");
    this.aggregateRecorder = aggregateRecorder;
  }

  public boolean recordsAggregates() {
    return aggregateRecorder != null;
  }

  @Override
  public FlushResult write(List<PlayEvent> events) {
    if (events.isEmpty()) {
      return FlushResult.empty();
    }
    String insertSql = store.dialect().insertHistorySql();
    return store.transaction(conn -> {
      int flushed = 0;
      int failed = 0;
      for (PlayEvent event : events) {
        try {
          store.transaction(rowConn -> {
            JdbcTemplate.update(rowConn, insertSql,
                event.guildId(), event.userId(), event.trackTitle(), event.trackAuthor(),
                event.trackUrl(), event.trackDurationMs());
            if (aggregateRecorder != null) {
              aggregateRecorder.record(event);
            }
            return null;
          });
          flushed++;
        } catch (RuntimeException e) {
          failed++;
          logger.log(Level.WARNING, "Failed to insert history entry (guild=" + event.guildId() +
              ", user=" + event.userId() + ", title=" + event.trackTitle() + ")", e);
        }
      }
      return FlushResult.of(flushed, failed);
    });
  }
}
