package dbkit.error;

/**
 * Raised when an update payload carries neither {@code id} nor {@code uuid}.
 */
public final class NoPrimaryKeyException extends DbKitException {

  public NoPrimaryKeyException(String entityName) {
    super(ErrorKind.NO_PRIMARY_KEY, ErrorKind.NO_PRIMARY_KEY.defaultMessage() + ": " + entityName);
  }
}
