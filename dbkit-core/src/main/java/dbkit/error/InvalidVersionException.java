package dbkit.error;

/**
 * Raised when an application version string is not a valid {@code YEAR.MONTH.PATCH}.
 */
public final class InvalidVersionException extends DbKitException {

  public InvalidVersionException(String message) {
    super(ErrorKind.INVALID_VERSION, message);
  }

  public InvalidVersionException(String message, Throwable cause) {
    super(ErrorKind.INVALID_VERSION, message, cause);
  }
}
