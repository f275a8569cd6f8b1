package playlog.jdbc.tx;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Objects;

/**
 * Transaction manager for plain JDBC. The outermost {@link #begin()} on a thread obtains a
 * connection, disables auto-commit and binds it to a {@link ThreadLocalTxContext}; a
 * {@code begin()} while a transaction is already active sets a savepoint on the same
 * connection instead.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     JdbcTemplate.update(tx.connection(), sql, params);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>Nested transactions must be completed before the one enclosing them.
 */
public final class JdbcTransactionManager {
  private final DataSource dataSource;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(DataSource dataSource, ThreadLocalTxContext txContext) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a transaction, or a savepoint if one is already active on this thread.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection or savepoint cannot be obtained
   */
  public Transaction begin() throws SQLException {
    if (txContext.isTransactionActive()) {
      Connection connection = txContext.currentConnection();
      Savepoint savepoint = connection.setSavepoint();
      txContext.enterNested();
      return new Transaction(connection, savepoint, txContext);
    }
    Connection connection = dataSource.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    txContext.bind(connection);
    return new Transaction(connection, null, txContext);
  }

  /**
   * Runs {@code callback} in a transaction: commits when it returns, rolls back when it throws.
   */
  public <T> T execute(TransactionCallback<T> callback) throws SQLException {
    Objects.requireNonNull(callback, "callback");
    try (Transaction tx = begin()) {
      T result = callback.execute(tx.connection());
      tx.commit();
      return result;
    }
  }

  public ThreadLocalTxContext context() {
    return txContext;
  }

  /**
   * An active transaction or savepoint. If neither {@link #commit()} nor
   * {@link #rollback()} is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final Savepoint savepoint;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, Savepoint savepoint, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.savepoint = savepoint;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public boolean isNested() {
      return savepoint != null;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      if (savepoint != null) {
        try {
          connection.releaseSavepoint(savepoint);
        } finally {
          completed = true;
          txContext.exitNested();
        }
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        finish();
        throw e;
      }
      finish();
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      if (savepoint != null) {
        try {
          connection.rollback(savepoint);
        } finally {
          completed = true;
          txContext.exitNested();
        }
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish() throws SQLException {
      completed = true;
      txContext.clear();
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }
  }
}
