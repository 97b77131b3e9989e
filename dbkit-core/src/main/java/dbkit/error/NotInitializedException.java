package dbkit.error;

/**
 * Raised when the connection manager is used before {@code init} or after {@code close}.
 */
public final class NotInitializedException extends DbKitException {

  public NotInitializedException() {
    super(ErrorKind.NOT_INITIALIZED);
  }
}
