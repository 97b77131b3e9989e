package dbkit.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dbkit.config.DatabaseSettings;
import dbkit.error.InvalidSettingException;
import dbkit.error.NotInitializedException;
import dbkit.jdbc.dialect.Dialects;
import dbkit.jdbc.spi.Dialect;
import dbkit.spi.RepositoryMetrics;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one HikariCP connection pool and the session factory built on it.
 *
 * <p>Construct one instance per process (or per test) and pass it to whatever needs sessions.
 * {@link #init} is idempotent: only the first call takes effect until {@link #close()}.
 *
 * <pre>{@code
 * DatabaseConnectionManager db = new DatabaseConnectionManager();
 * db.init(DatabaseSettings.fromEnvironment());
 *
 * Widget widget = db.inSession(session ->
 *     new JdbcRepository<>(session, WIDGETS).create(Map.of("name", "a")));
 *
 * db.close();
 * }</pre>
 */
public final class DatabaseConnectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DatabaseConnectionManager.class.getName());
  private static final int HEALTH_CHECK_TIMEOUT_SECONDS = 5;

  private final RepositoryMetrics metrics;

  private volatile HikariDataSource dataSource;
  private volatile JdbcSessionFactory sessionFactory;
  private volatile DatabaseSettings settings;

  public DatabaseConnectionManager() {
    this(RepositoryMetrics.NOOP);
  }

  public DatabaseConnectionManager(RepositoryMetrics metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the pool and session factory. A no-op if already initialized.
   *
   * @param settings connection settings
   * @throws InvalidSettingException if no dialect matches the JDBC URL
   */
  public synchronized void init(DatabaseSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (dataSource != null) {
      logger.log(Level.FINE, "Already initialized with {0}; ignoring init", this.settings);
      return;
    }
    String url = settings.jdbcUrl();
    Dialect dialect = Dialects.find(url).orElseThrow(
        () -> new InvalidSettingException("url", "no dialect supports " + url));

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.maximumPoolSize());
    config.setConnectionTimeout(settings.connectionTimeout().toMillis());
    config.setPoolName(settings.poolName());
    config.setAutoCommit(false);
    HikariDataSource pool = new HikariDataSource(config);

    this.sessionFactory = new JdbcSessionFactory(pool, dialect, metrics, settings.echo());
    this.settings = settings;
    this.dataSource = pool;
    logger.log(Level.INFO, "Initialized {0} pool ''{1}'' for {2}",
        new Object[]{dialect.name(), settings.poolName(), url});
  }

  public boolean isInitialized() {
    return dataSource != null;
  }

  /**
   * Returns the pooled data source.
   *
   * @throws NotInitializedException before {@link #init}
   */
  public DataSource dataSource() {
    HikariDataSource ds = dataSource;
    if (ds == null) {
      throw new NotInitializedException();
    }
    return ds;
  }

  /**
   * @throws NotInitializedException before {@link #init}
   */
  public JdbcSessionFactory sessionFactory() {
    JdbcSessionFactory factory = sessionFactory;
    if (factory == null) {
      throw new NotInitializedException();
    }
    return factory;
  }

  /**
   * Returns the settings of the active pool.
   *
   * @throws NotInitializedException before {@link #init}
   */
  public DatabaseSettings settings() {
    DatabaseSettings s = settings;
    if (s == null) {
      throw new NotInitializedException();
    }
    return s;
  }

  /**
   * Opens a new session; the caller must close it.
   *
   * @throws NotInitializedException before {@link #init}
   */
  public JdbcSession getSession() {
    return sessionFactory().openSession();
  }

  /**
   * Runs {@code work} in a new session and returns its result.
   *
   * <p>If the work throws, the session is rolled back before it is closed and the original exception
   * is rethrown. The session is always closed; nothing is committed here.
   *
   * @throws NotInitializedException before {@link #init}
   */
  public <T> T inSession(SessionWork<T> work) {
    Objects.requireNonNull(work, "work");
    JdbcSession session = getSession();
    Throwable primary = null;
    try {
      return work.execute(session);
    } catch (Throwable t) {
      primary = t;
      try {
        session.rollback();
      } catch (RuntimeException rollbackFailure) {
        t.addSuppressed(rollbackFailure);
      }
      throw t;
    } finally {
      try {
        session.close();
      } catch (RuntimeException closeFailure) {
        if (primary == null) {
          throw closeFailure;
        }
        primary.addSuppressed(closeFailure);
      }
    }
  }

  /**
   * Runs {@code action} in a new session, with the same rollback and close rules as
   * {@link #inSession(SessionWork)}.
   */
  public void runInSession(SessionAction action) {
    Objects.requireNonNull(action, "action");
    inSession(session -> {
      action.execute(session);
      return null;
    });
  }

  /**
   * Runs the dialect's validation query on a pooled connection.
   *
   * @return {@code true} if the query succeeded; {@code false} on any failure, including when
   *     the manager is not initialized
   */
  public boolean healthCheck() {
    HikariDataSource ds = dataSource;
    JdbcSessionFactory factory = sessionFactory;
    if (ds == null || factory == null) {
      logger.log(Level.FINE, "Health check on uninitialized manager");
      return false;
    }
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
      st.setQueryTimeout(HEALTH_CHECK_TIMEOUT_SECONDS);
      st.execute(factory.dialect().validationQuery());
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Database health check failed", e);
      return false;
    }
  }

  /**
   * Closes the pool. A no-op if not initialized; {@link #init} may be called again afterwards.
   */
  @Override
  public synchronized void close() {
    HikariDataSource ds = dataSource;
    if (ds == null) {
      return;
    }
    dataSource = null;
    sessionFactory = null;
    settings = null;
    ds.close();
    logger.log(Level.INFO, "Closed pool ''{0}''", ds.getPoolName());
  }
}
