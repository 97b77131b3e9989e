package dbkit.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorKindTest {

  @Test
  void notFoundMapsTo404() {
    NotFoundException e = new NotFoundException("Widget", "id", 42L);

    assertEquals(ErrorKind.NOT_FOUND, e.kind());
    assertEquals(404, e.statusCode());
  }

  @Test
  void noPrimaryKeyMapsTo400() {
    assertEquals(400, new NoPrimaryKeyException("Widget").statusCode());
  }

  @Test
  void configurationErrorsMapTo500() {
    assertEquals(500, new NotInitializedException().statusCode());
    assertEquals(500, new EmptySessionException("WidgetRepository").statusCode());
    assertEquals(500, new NoModelException("WidgetRepository").statusCode());
    assertEquals(500, new NoUuidSupportException("Log").statusCode());
    assertEquals(500, new DeactivationNotSupportedException("Widget").statusCode());
  }

  @Test
  void defaultMessageComesFromKind() {
    assertEquals(ErrorKind.NOT_INITIALIZED.defaultMessage(), new NotInitializedException().getMessage());
    assertEquals(ErrorKind.NOT_FOUND.defaultMessage(), new NotFoundException().getMessage());
  }

  @Test
  void messagesNameTheEntity() {
    assertTrue(new NoUuidSupportException("Log").getMessage().contains("Log"));
    assertTrue(new DeactivationNotSupportedException("Widget").getMessage().contains("Widget"));
  }
}
