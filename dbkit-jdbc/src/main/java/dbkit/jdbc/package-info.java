/**
 * JDBC implementation of the repository API.
 *
 * <p>{@link dbkit.jdbc.DatabaseConnectionManager} owns the HikariCP pool and hands out
 * {@link dbkit.jdbc.JdbcSession}s; {@link dbkit.jdbc.JdbcRepository} performs CRUD through one
 * session. JDBC failures surface as {@link dbkit.jdbc.StorageException}.
 */
package dbkit.jdbc;
