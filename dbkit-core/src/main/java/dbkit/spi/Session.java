package dbkit.spi;

import java.sql.Connection;

/**
 * One unit of work against the store: a single connection with auto-commit off, exclusively
 * owned by whoever acquired it. Not thread-safe.
 *
 * <p>{@link #close()} rolls back anything not yet committed and then releases the connection.
 * It is idempotent.
 */
public interface Session extends AutoCloseable {

  /**
   * Returns the underlying connection.
   *
   * @throws IllegalStateException if the session is closed
   */
  Connection connection();

  void commit();

  void rollback();

  boolean isOpen();

  RepositoryMetrics metrics();

  @Override
  void close();
}
