package dbkit.repo;

import java.util.Locale;

public enum SortDirection {
  ASC,
  DESC;

  /**
   * Parses {@code asc}/{@code desc}, case-insensitively.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static SortDirection parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Sort direction must not be null");
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "asc":
        return ASC;
      case "desc":
        return DESC;
      default:
        throw new IllegalArgumentException("Unknown sort direction: " + value);
    }
  }
}
