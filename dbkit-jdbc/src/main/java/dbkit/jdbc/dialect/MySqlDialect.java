package dbkit.jdbc.dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * MySQL dialect. Also compatible with TiDB.
 *
 * <p>MySQL has no uuid type; uuids are stored as {@code CHAR(36)}.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public long readGeneratedId(ResultSet keys) throws SQLException {
    // Connector/J labels the key GENERATED_KEY
    return keys.getLong(1);
  }

  @Override
  protected Object uuidToJdbc(UUID uuid) {
    return uuid.toString();
  }

  @Override
  protected UUID readUuid(ResultSet rs, String column) throws SQLException {
    String value = rs.getString(column);
    return value == null ? null : UUID.fromString(value);
  }
}
