package dbkit.error;

/**
 * Raised when a lookup by id or uuid matches no row.
 */
public final class NotFoundException extends DbKitException {

  public NotFoundException() {
    super(ErrorKind.NOT_FOUND);
  }

  public NotFoundException(String entityName, String field, Object value) {
    super(ErrorKind.NOT_FOUND, entityName + " with " + field + "=" + value + " not found");
  }
}
