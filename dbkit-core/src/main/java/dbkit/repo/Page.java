package dbkit.repo;

/**
 * Limit/offset window applied after filtering and sorting.
 *
 * @param limit maximum number of rows, {@code >= 0}
 * @param offset rows to skip, {@code >= 0}
 */
public record Page(int limit, int offset) {
  public static final int DEFAULT_LIMIT = 100;

  private static final Page DEFAULT = new Page(DEFAULT_LIMIT, 0);

  public Page {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
  }

  /**
   * Returns the default window: 100 rows from offset 0.
   */
  public static Page defaults() {
    return DEFAULT;
  }

  public static Page of(int limit, int offset) {
    return new Page(limit, offset);
  }
}
