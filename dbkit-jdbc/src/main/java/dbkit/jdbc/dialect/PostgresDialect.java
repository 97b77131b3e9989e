package dbkit.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. Expects {@code uuid} columns of type {@code UUID}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
