package dbkit.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier validation and class-name to table-name conversion.
 */
public final class TableNames {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

  private TableNames() {}

  /**
   * Validates a table or column name.
   *
   * @throws IllegalArgumentException if the name is not a plain SQL identifier
   */
  public static String validate(String name) {
    Objects.requireNonNull(name, "name");
    if (!name.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid identifier: " + name);
    }
    return name;
  }

  /**
   * Converts a class name to snake_case, e.g. {@code OrderLine -> order_line},
   * {@code HTTPRequestLog -> http_request_log}.
   */
  public static String toSnakeCase(String name) {
    Objects.requireNonNull(name, "name");
    String snake = CAMEL_BOUNDARY.matcher(name).replaceAll("_").replace("__", "_");
    return snake.toLowerCase(Locale.ROOT);
  }
}
