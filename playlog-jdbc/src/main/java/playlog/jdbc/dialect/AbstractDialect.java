package playlog.jdbc.dialect;

import playlog.jdbc.TableNames;
import playlog.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses provide the upsert statements and can override the rest.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertHistorySql() {
    return "INSERT INTO " + TableNames.HISTORY + " (" +
        "guild_id, user_id, track_title, track_author, track_url, track_duration" +
        ") VALUES (?,?,?,?,?,?)";
  }

  @Override
  public String purgeHistorySql() {
    return "DELETE FROM " + TableNames.HISTORY + " WHERE id IN (" +
        "SELECT id FROM " + TableNames.HISTORY +
        " WHERE played_at < ? ORDER BY id LIMIT ?)";
  }

  @Override
  public String toString() {
    return name();
  }
}
