/** Thread-bound JDBC transactions with savepoint nesting. */
package playlog.jdbc.tx;
