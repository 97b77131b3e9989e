package dbkit.jdbc;

import dbkit.jdbc.spi.Dialect;
import dbkit.spi.RepositoryMetrics;
import dbkit.spi.Session;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Session} over one JDBC connection with auto-commit disabled.
 *
 * <p>Statements go through {@link #update}, {@link #insert} and {@link #query} so that they are
 * logged at INFO when echo is enabled. {@link #close()} rolls back uncommitted work and returns the
 * connection to its pool.
 */
public final class JdbcSession implements Session {
  private static final Logger logger = Logger.getLogger(JdbcSession.class.getName());

  private final Connection connection;
  private final Dialect dialect;
  private final RepositoryMetrics metrics;
  private final boolean echo;
  private boolean closed;

  public JdbcSession(Connection connection, Dialect dialect, RepositoryMetrics metrics, boolean echo) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.echo = echo;
  }

  @Override
  public Connection connection() {
    ensureOpen();
    return connection;
  }

  public Dialect dialect() {
    return dialect;
  }

  @Override
  public RepositoryMetrics metrics() {
    return metrics;
  }

  public boolean echo() {
    return echo;
  }

  @Override
  public void commit() {
    ensureOpen();
    try {
      connection.commit();
    } catch (SQLException e) {
      throw new StorageException("Failed to commit", e);
    }
  }

  @Override
  public void rollback() {
    ensureOpen();
    try {
      connection.rollback();
    } catch (SQLException e) {
      throw new StorageException("Failed to roll back", e);
    }
  }

  @Override
  public boolean isOpen() {
    return !closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    SQLException failure = null;
    try {
      connection.rollback();
    } catch (SQLException e) {
      failure = e;
    } finally {
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure != null) {
          failure.addSuppressed(e);
        } else {
          failure = e;
        }
      }
    }
    if (failure != null) {
      throw new StorageException("Failed to close session", failure);
    }
  }

  /** Execute UPDATE/DELETE, return rows affected. */
  public int update(String sql, Object... params) {
    log(sql, params);
    return JdbcTemplate.update(connection(), sql, params);
  }

  /** Execute INSERT, return the generated {@code id}. */
  public long insert(String sql, Object... params) {
    log(sql, params);
    return JdbcTemplate.insert(connection(), sql, dialect::readGeneratedId, params);
  }

  /** Execute SELECT, map rows. */
  public <T> List<T> query(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    log(sql, params);
    return JdbcTemplate.query(connection(), sql, mapper, params);
  }

  private void log(String sql, Object[] params) {
    if (echo) {
      logger.log(Level.INFO, "{0} {1}", new Object[]{sql, Arrays.toString(params)});
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }
}
