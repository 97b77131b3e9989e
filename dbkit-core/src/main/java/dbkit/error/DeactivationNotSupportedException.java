package dbkit.error;

/**
 * Raised when a deactivation toggle targets an entity type without the deactivation capability.
 */
public final class DeactivationNotSupportedException extends DbKitException {

  public DeactivationNotSupportedException(String entityName) {
    super(ErrorKind.DEACTIVATION_NOT_SUPPORTED,
        ErrorKind.DEACTIVATION_NOT_SUPPORTED.defaultMessage() + ": " + entityName);
  }
}
