package dbkit.jdbc.dialect;

import dbkit.jdbc.spi.Dialect;
import dbkit.model.Values;
import dbkit.util.Timestamps;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Base dialect with standard JDBC conversions.
 *
 * <p>Instants are written as UTC {@link LocalDateTime}s truncated to microseconds, so a
 * {@code TIMESTAMP} column holds the same wall-clock value whatever the JVM time zone is.
 * Enums are written by name.
 * Subclasses override the conversions their driver handles differently.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public Object toJdbcValue(Object value) {
    if (value instanceof Instant instant) {
      return Timestamps.truncate(instant).atOffset(ZoneOffset.UTC).toLocalDateTime();
    }
    if (value instanceof LocalDate date) {
      return Date.valueOf(date);
    }
    if (value instanceof Enum<?> e) {
      return e.name();
    }
    if (value instanceof UUID uuid) {
      return uuidToJdbc(uuid);
    }
    return value;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T readValue(ResultSet rs, String column, Class<T> type) throws SQLException {
    Object value;
    if (type == String.class) {
      value = rs.getString(column);
    } else if (type == Long.class) {
      long v = rs.getLong(column);
      value = rs.wasNull() ? null : v;
    } else if (type == Integer.class) {
      int v = rs.getInt(column);
      value = rs.wasNull() ? null : v;
    } else if (type == Short.class) {
      short v = rs.getShort(column);
      value = rs.wasNull() ? null : v;
    } else if (type == Double.class) {
      double v = rs.getDouble(column);
      value = rs.wasNull() ? null : v;
    } else if (type == Float.class) {
      float v = rs.getFloat(column);
      value = rs.wasNull() ? null : v;
    } else if (type == Boolean.class) {
      boolean v = rs.getBoolean(column);
      value = rs.wasNull() ? null : v;
    } else if (type == BigDecimal.class) {
      value = rs.getBigDecimal(column);
    } else if (type == Instant.class) {
      LocalDateTime ts = rs.getObject(column, LocalDateTime.class);
      value = ts == null ? null : ts.toInstant(ZoneOffset.UTC);
    } else if (type == LocalDate.class) {
      Date date = rs.getDate(column);
      value = date == null ? null : date.toLocalDate();
    } else if (type == UUID.class) {
      value = readUuid(rs, column);
    } else if (type.isEnum()) {
      String name = rs.getString(column);
      value = name == null ? null : Values.enumConstant(type, name);
    } else {
      throw new IllegalArgumentException("Unsupported column type: " + type.getName());
    }
    return (T) value;
  }

  /**
   * Binds uuids natively; drivers with a uuid column type accept {@link UUID} directly.
   */
  protected Object uuidToJdbc(UUID uuid) {
    return uuid;
  }

  protected UUID readUuid(ResultSet rs, String column) throws SQLException {
    Object value = rs.getObject(column);
    if (value == null || value instanceof UUID) {
      return (UUID) value;
    }
    return UUID.fromString(value.toString());
  }
}
