package playlog.jdbc;

import java.util.List;

/**
 * Names of the tables owned by the play store.
 */
public final class TableNames {

  public static final String HISTORY = "history";
  public static final String GUILD_STATISTICS = "guild_statistics";
  public static final String USER_STATISTICS = "user_statistics";
  public static final String TRACK_STATISTICS = "track_statistics";
  public static final String SCHEMA_MIGRATIONS = "playlog_schema_migrations";

  /** Tables that must exist for the store to be usable, in creation order. */
  public static final List<String> REQUIRED = List.of(
      HISTORY, GUILD_STATISTICS, USER_STATISTICS, TRACK_STATISTICS);

  private TableNames() {
  }
}
