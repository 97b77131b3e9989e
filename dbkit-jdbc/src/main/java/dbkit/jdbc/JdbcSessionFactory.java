package dbkit.jdbc;

import dbkit.jdbc.spi.Dialect;
import dbkit.spi.RepositoryMetrics;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens {@link JdbcSession}s on connections borrowed from a {@link DataSource}.
 */
public final class JdbcSessionFactory {
  private final DataSource dataSource;
  private final Dialect dialect;
  private final RepositoryMetrics metrics;
  private final boolean echo;

  public JdbcSessionFactory(DataSource dataSource, Dialect dialect, RepositoryMetrics metrics, boolean echo) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.echo = echo;
  }

  /**
   * Opens a new session; the caller must close it.
   *
   * @throws StorageException if no connection can be obtained
   */
  public JdbcSession openSession() {
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException e) {
      throw new StorageException("Failed to obtain connection", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw new StorageException("Failed to disable auto-commit", e);
    }
    return new JdbcSession(connection, dialect, metrics, echo);
  }

  public Dialect dialect() {
    return dialect;
  }
}
