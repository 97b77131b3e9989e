package dbkit.jdbc.dialect;

import dbkit.jdbc.StorageException;
import dbkit.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of dialects discovered via {@link ServiceLoader} from
 * {@code META-INF/services/dbkit.jdbc.spi.Dialect}, with detection from a JDBC URL.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost:5432/app");
 * Dialect h2 = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @throws IllegalArgumentException if no dialect has this name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Finds the dialect whose URL prefix matches.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return DIALECTS.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + allPrefixes()));
  }

  /**
   * Detects the dialect from the URL reported by a connection of the data source.
   *
   * @throws StorageException if no connection can be obtained
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new StorageException("Failed to detect dialect from DataSource", e);
    }
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
