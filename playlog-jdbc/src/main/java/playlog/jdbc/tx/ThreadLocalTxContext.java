package playlog.jdbc.tx;

import java.sql.Connection;

/**
 * Holds the connection of the transaction running on the current thread.
 *
 * <p>Managed by {@link JdbcTransactionManager}; statements issued through the store while
 * a transaction is active reuse {@link #currentConnection()}.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  public boolean isTransactionActive() {
    return state.get() != null;
  }

  public Connection currentConnection() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current.connection;
  }

  /** Nesting depth: 0 outside a transaction, 1 for the outermost one. */
  public int depth() {
    TxState current = state.get();
    return current == null ? 0 : current.depth;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  void enterNested() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    current.depth++;
  }

  void exitNested() {
    TxState current = state.get();
    if (current != null && current.depth > 1) {
      current.depth--;
    }
  }

  void clear() {
    state.remove();
  }

  private static final class TxState {
    private final Connection connection;
    private int depth = 1;

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
