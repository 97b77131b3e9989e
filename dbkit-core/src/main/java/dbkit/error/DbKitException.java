package dbkit.error;

import java.util.Objects;

/**
 * Base class of the dbkit error taxonomy.
 *
 * <p>Every subclass is raised synchronously, before any partial mutation, and is never
 * retried internally. Failures of the backing store itself are not part of this hierarchy.
 *
 * @see ErrorKind
 */
public abstract class DbKitException extends RuntimeException {

  private final ErrorKind kind;

  protected DbKitException(ErrorKind kind) {
    this(kind, kind.defaultMessage());
  }

  protected DbKitException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected DbKitException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the HTTP-like status code associated with {@link #kind()}.
   */
  public int statusCode() {
    return kind.statusCode();
  }
}
