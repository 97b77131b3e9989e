package dbkit.jdbc.spi;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations translate column values between Java and JDBC and supply the few
 * database-specific SQL fragments repositories need.
 * Register custom dialects via {@code META-INF/services/dbkit.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, MySQL (+ TiDB), H2.
 *
 * @see dbkit.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Trivial query used by health checks.
   */
  default String validationQuery() {
    return "SELECT 1";
  }

  /**
   * Clause appended to list queries.
   *
   * <p>Parameters: limit (int), offset (int)
   */
  default String limitOffsetClause() {
    return "LIMIT ? OFFSET ?";
  }

  /**
   * Converts a column value to a value {@link java.sql.PreparedStatement} can bind.
   */
  Object toJdbcValue(Object value);

  /**
   * Reads one column of the current row.
   *
   * @param rs result set positioned on a row
   * @param column column label
   * @param type Java type of the column
   * @return the value, {@code null} for SQL NULL
   */
  <T> T readValue(ResultSet rs, String column, Class<T> type) throws SQLException;

  /**
   * Reads the generated primary key from the result of
   * {@link java.sql.Statement#getGeneratedKeys()}, positioned on its first row.
   */
  default long readGeneratedId(ResultSet keys) throws SQLException {
    return keys.getLong("id");
  }
}
