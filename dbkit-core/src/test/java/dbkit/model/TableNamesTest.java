package dbkit.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void convertsCamelCase() {
    assertEquals("widget", TableNames.toSnakeCase("Widget"));
    assertEquals("order_line", TableNames.toSnakeCase("OrderLine"));
    assertEquals("http_request_log", TableNames.toSnakeCase("HTTPRequestLog"));
    assertEquals("user2_fa", TableNames.toSnakeCase("User2FA"));
  }

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals("order_line", TableNames.validate("order_line"));
    assertEquals("_tmp1", TableNames.validate("_tmp1"));
  }

  @Test
  void rejectsUnsafeIdentifiers() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1abc"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("a-b"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("x; drop table y"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
  }
}
