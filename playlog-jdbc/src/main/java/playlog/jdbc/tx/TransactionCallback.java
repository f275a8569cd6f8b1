package playlog.jdbc.tx;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work executed inside a transaction. The connection stays bound to the calling thread for
 * the duration of the callback.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {
  T execute(Connection connection) throws SQLException;
}
