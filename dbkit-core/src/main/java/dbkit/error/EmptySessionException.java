package dbkit.error;

/**
 * Raised when a repository is constructed without a session.
 */
public final class EmptySessionException extends DbKitException {

  public EmptySessionException(String repository) {
    super(ErrorKind.EMPTY_SESSION, ErrorKind.EMPTY_SESSION.defaultMessage() + ": " + repository);
  }
}
