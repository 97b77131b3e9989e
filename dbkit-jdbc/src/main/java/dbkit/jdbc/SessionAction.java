package dbkit.jdbc;

/**
 * Unit of work without a result, run by {@link DatabaseConnectionManager#runInSession(SessionAction)}.
 */
@FunctionalInterface
public interface SessionAction {
  void execute(JdbcSession session);
}
