package dbkit.error;

/**
 * Raised when a uuid operation targets an entity type without the uuid capability.
 */
public final class NoUuidSupportException extends DbKitException {

  public NoUuidSupportException(String entityName) {
    super(ErrorKind.NO_UUID_SUPPORT, ErrorKind.NO_UUID_SUPPORT.defaultMessage() + ": " + entityName);
  }
}
