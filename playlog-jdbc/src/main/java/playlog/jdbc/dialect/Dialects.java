package playlog.jdbc.dialect;

import playlog.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Registry of {@link Dialect}s discovered with {@link ServiceLoader} from
 * {@code META-INF/services/playlog.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect byUrl = Dialects.detect("jdbc:postgresql://db/playlog");
 * Dialect byName = Dialects.get("h2");
 * Dialect fromPool = Dialects.detect(dataSource);
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME;

  static {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    BY_NAME = Map.copyOf(byName);
  }

  private Dialects() {
  }

  /** Registered dialects. */
  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException if no such dialect is registered
   */
  public static Dialect get(String name) {
    Dialect dialect = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect from the URL reported by a connection of {@code dataSource}.
   *
   * @throws IllegalStateException if no connection can be obtained or no dialect matches
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect claims its prefix
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return BY_NAME.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
            ". Supported prefixes: " + BY_NAME.values().stream()
            .flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }
}
