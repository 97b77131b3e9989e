package dbkit.jdbc.dialect;

import org.h2.jdbcx.JdbcDataSource;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AbstractDialectTest {
  private final H2Dialect h2 = new H2Dialect();
  private final MySqlDialect mysql = new MySqlDialect();

  @Test
  void convertsValuesForBinding() {
    Instant instant = Instant.parse("2024-05-06T07:08:09.123456789Z");
    assertEquals(LocalDateTime.of(2024, 5, 6, 7, 8, 9, 123456000), h2.toJdbcValue(instant));
    assertEquals(Date.valueOf(LocalDate.of(2024, 5, 6)), h2.toJdbcValue(LocalDate.of(2024, 5, 6)));
    assertEquals("MONDAY", h2.toJdbcValue(DayOfWeek.MONDAY));
    assertEquals("plain", h2.toJdbcValue("plain"));
    assertNull(h2.toJdbcValue(null));
  }

  @Test
  void uuidBindingDependsOnDialect() {
    UUID uuid = UUID.randomUUID();
    assertEquals(uuid, h2.toJdbcValue(uuid));
    assertEquals(uuid, new PostgresDialect().toJdbcValue(uuid));
    assertEquals(uuid.toString(), mysql.toJdbcValue(uuid));
  }

  @Test
  void readsTypedValuesAndNulls() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_" + UUID.randomUUID());
    UUID uuid = UUID.randomUUID();
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE v (i INTEGER, l BIGINT, b BOOLEAN, u UUID, c VARCHAR(36), e VARCHAR(10), d DATE, "
          + "t TIMESTAMP)");
      st.execute("INSERT INTO v VALUES (1, 2, TRUE, '" + uuid + "', '" + uuid + "', 'FRIDAY', DATE '2020-02-29', "
          + "TIMESTAMP '2024-05-06 07:08:09.123456')");
      st.execute("INSERT INTO v VALUES (NULL, NULL, NULL, NULL, NULL, NULL, NULL, NULL)");
      try (ResultSet rs = st.executeQuery("SELECT * FROM v ORDER BY i NULLS LAST")) {
        assertTrue(rs.next());
        assertEquals(Integer.valueOf(1), h2.readValue(rs, "i", Integer.class));
        assertEquals(Long.valueOf(2), h2.readValue(rs, "l", Long.class));
        assertEquals(Boolean.TRUE, h2.readValue(rs, "b", Boolean.class));
        assertEquals(uuid, h2.readValue(rs, "u", UUID.class));
        assertEquals(uuid, mysql.readValue(rs, "c", UUID.class));
        assertEquals(DayOfWeek.FRIDAY, h2.readValue(rs, "e", DayOfWeek.class));
        assertEquals(LocalDate.of(2020, 2, 29), h2.readValue(rs, "d", LocalDate.class));
        assertEquals(Instant.parse("2024-05-06T07:08:09.123456Z"), h2.readValue(rs, "t", Instant.class));

        assertTrue(rs.next());
        assertNull(h2.readValue(rs, "i", Integer.class));
        assertNull(h2.readValue(rs, "l", Long.class));
        assertNull(h2.readValue(rs, "b", Boolean.class));
        assertNull(h2.readValue(rs, "u", UUID.class));
        assertNull(mysql.readValue(rs, "c", UUID.class));
        assertNull(h2.readValue(rs, "e", DayOfWeek.class));
        assertNull(h2.readValue(rs, "d", LocalDate.class));
        assertNull(h2.readValue(rs, "t", Instant.class));
      }
    }
  }

  @Test
  void unknownEnumNameIsRejected() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_" + UUID.randomUUID());
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT 'HOLIDAY' AS e")) {
      assertTrue(rs.next());
      assertThrows(IllegalArgumentException.class, () -> h2.readValue(rs, "e", DayOfWeek.class));
    }
  }
}
