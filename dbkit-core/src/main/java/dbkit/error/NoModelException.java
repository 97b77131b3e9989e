package dbkit.error;

/**
 * Raised when a repository is constructed without an entity type.
 */
public final class NoModelException extends DbKitException {

  public NoModelException(String repository) {
    super(ErrorKind.NO_MODEL, ErrorKind.NO_MODEL.defaultMessage() + ": " + repository);
  }
}
