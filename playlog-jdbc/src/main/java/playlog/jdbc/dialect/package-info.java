/** Built-in dialects and the {@link playlog.jdbc.dialect.Dialects} registry. */
package playlog.jdbc.dialect;
