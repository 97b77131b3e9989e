package dbkit.error;

/**
 * Machine-distinguishable kinds of expected failure raised by dbkit.
 *
 * <p>Each kind carries the HTTP-like status code and default message callers may use
 * when mapping failures to an external representation.
 *
 * @see DbKitException
 */
public enum ErrorKind {
  NOT_INITIALIZED(500, "Database connection manager is not initialized"),
  EMPTY_SESSION(500, "Repository requires a database session"),
  NO_MODEL(500, "Repository requires an entity type"),
  NOT_FOUND(404, "No resource matches the given parameters"),
  NO_UUID_SUPPORT(500, "Entity type has no uuid column"),
  NO_PRIMARY_KEY(400, "Payload contains neither id nor uuid"),
  DEACTIVATION_NOT_SUPPORTED(500, "Entity type does not support deactivation"),
  INVALID_SETTING(500, "Invalid configuration setting"),
  INVALID_VERSION(500, "Version must have the form YEAR.MONTH.PATCH, e.g. 2025.12.1");

  private final int statusCode;
  private final String defaultMessage;

  ErrorKind(int statusCode, String defaultMessage) {
    this.statusCode = statusCode;
    this.defaultMessage = defaultMessage;
  }

  public int statusCode() {
    return statusCode;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
