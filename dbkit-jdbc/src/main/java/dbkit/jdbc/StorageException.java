package dbkit.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping a JDBC failure of the backing store.
 *
 * <p>The cause is always the original {@link SQLException}; it is never reinterpreted as one of
 * the {@link dbkit.error.DbKitException} kinds.
 */
public final class StorageException extends RuntimeException {
  public StorageException(String message, SQLException cause) {
    super(message, cause);
  }

  @Override
  public synchronized SQLException getCause() {
    return (SQLException) super.getCause();
  }

  /**
   * Returns the SQLSTATE of the underlying failure, or {@code null} if the driver did not supply one.
   */
  public String sqlState() {
    return getCause().getSQLState();
  }
}
