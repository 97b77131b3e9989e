package dbkit.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Lossless conversion of payload values to column types.
 */
public final class Values {
  private static final Set<Class<?>> SUPPORTED = Set.of(
      String.class, Integer.class, Long.class, Short.class, Double.class, Float.class,
      Boolean.class, BigDecimal.class, Instant.class, LocalDate.class, UUID.class);

  private Values() {}

  /**
   * Returns {@code true} if values of the given type can be stored in a column.
   */
  public static boolean isSupported(Class<?> type) {
    return SUPPORTED.contains(type) || type.isEnum();
  }

  /**
   * Converts a value to the target column type.
   *
   * @param type target column type
   * @param value value to convert, may be {@code null}
   * @return the converted value, {@code null} if {@code value} is {@code null}
   * @throws IllegalArgumentException if the conversion would lose information or is not defined
   */
  @SuppressWarnings("unchecked")
  public static <T> T coerce(Class<T> type, Object value) {
    Objects.requireNonNull(type, "type");
    if (value == null || type.isInstance(value)) {
      return (T) value;
    }
    Object converted;
    if (type == Long.class) {
      converted = integral(value, Long.MIN_VALUE, Long.MAX_VALUE);
    } else if (type == Integer.class) {
      Long l = integral(value, Integer.MIN_VALUE, Integer.MAX_VALUE);
      converted = l == null ? null : l.intValue();
    } else if (type == Short.class) {
      Long l = integral(value, Short.MIN_VALUE, Short.MAX_VALUE);
      converted = l == null ? null : l.shortValue();
    } else if (type == Double.class) {
      converted = value instanceof Float || value instanceof Integer || value instanceof Short
          || value instanceof Byte ? ((Number) value).doubleValue() : null;
    } else if (type == Float.class) {
      converted = value instanceof Short || value instanceof Byte ? ((Number) value).floatValue() : null;
    } else if (type == BigDecimal.class) {
      converted = toBigDecimal(value);
    } else if (type == UUID.class) {
      converted = value instanceof String s ? parse(type, s, UUID::fromString) : null;
    } else if (type == Instant.class) {
      if (value instanceof java.util.Date date) {
        converted = date.toInstant();
      } else {
        converted = value instanceof String s ? parse(type, s, Instant::parse) : null;
      }
    } else if (type == LocalDate.class) {
      if (value instanceof java.sql.Date date) {
        converted = date.toLocalDate();
      } else {
        converted = value instanceof String s ? parse(type, s, LocalDate::parse) : null;
      }
    } else if (type.isEnum()) {
      converted = value instanceof String s ? parse(type, s, name -> enumConstant(type, name)) : null;
    } else {
      converted = null;
    }
    if (converted == null) {
      throw new IllegalArgumentException(
          "Cannot convert " + value.getClass().getSimpleName() + " value '" + value + "' to " + type.getSimpleName());
    }
    return (T) converted;
  }

  /**
   * Looks up an enum constant by name.
   *
   * @throws IllegalArgumentException if {@code type} is not an enum or has no such constant
   */
  public static Object enumConstant(Class<?> type, String name) {
    if (!type.isEnum()) {
      throw new IllegalArgumentException(type.getName() + " is not an enum");
    }
    for (Object constant : type.getEnumConstants()) {
      if (((Enum<?>) constant).name().equals(name)) {
        return constant;
      }
    }
    throw new IllegalArgumentException("No constant " + name + " in " + type.getSimpleName());
  }

  private static Long integral(Object value, long min, long max) {
    long l;
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      l = ((Number) value).longValue();
    } else if (value instanceof BigInteger big && big.bitLength() < 64) {
      l = big.longValue();
    } else if (value instanceof BigDecimal dec) {
      try {
        l = dec.longValueExact();
      } catch (ArithmeticException e) {
        return null;
      }
    } else {
      return null;
    }
    return l < min || l > max ? null : l;
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    }
    if (value instanceof BigInteger big) {
      return new BigDecimal(big);
    }
    return null;
  }

  private static Object parse(Class<?> type, String text, java.util.function.Function<String, Object> parser) {
    try {
      return parser.apply(text);
    } catch (IllegalArgumentException | DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " value: " + text, e);
    }
  }
}
