package dbkit.model;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One persisted attribute of an entity type: column name, Java type and accessors.
 *
 * @param <E> entity type
 * @param <T> value type
 */
public final class Column<E, T> {
  private final String name;
  private final Class<T> type;
  private final Function<? super E, ? extends T> getter;
  private final BiConsumer<? super E, ? super T> setter;
  private final boolean standard;

  Column(String name, Class<T> type, Function<? super E, ? extends T> getter,
      BiConsumer<? super E, ? super T> setter, boolean standard) {
    this.name = TableNames.validate(name);
    this.type = Objects.requireNonNull(type, "type");
    this.getter = Objects.requireNonNull(getter, "getter");
    this.setter = Objects.requireNonNull(setter, "setter");
    this.standard = standard;
    if (!Values.isSupported(type)) {
      throw new IllegalArgumentException("Unsupported column type for " + name + ": " + type.getName());
    }
  }

  public String name() {
    return name;
  }

  public Class<T> type() {
    return type;
  }

  /**
   * Returns {@code true} for the columns contributed by {@link Entity} and the capability interfaces.
   */
  public boolean isStandard() {
    return standard;
  }

  public T get(E entity) {
    return getter.apply(entity);
  }

  /**
   * Coerces {@code value} to this column's type and stores it on the entity.
   *
   * @throws IllegalArgumentException if the value cannot be converted losslessly
   */
  public void set(E entity, Object value) {
    T coerced;
    try {
      coerced = Values.coerce(type, value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Column " + name + ": " + e.getMessage(), e);
    }
    setter.accept(entity, coerced);
  }

  @Override
  public String toString() {
    return name + ":" + type.getSimpleName();
  }
}
