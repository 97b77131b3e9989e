package dbkit.jdbc;

/**
 * Unit of work producing a result, run by {@link DatabaseConnectionManager#inSession(SessionWork)}.
 */
@FunctionalInterface
public interface SessionWork<T> {
  T execute(JdbcSession session);
}
