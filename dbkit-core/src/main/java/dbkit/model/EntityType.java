package dbkit.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Immutable descriptor of one entity type: class, factory, table, capabilities and columns.
 *
 * <p>Standard columns are derived from the capabilities; domain columns are declared on the builder:
 *
 * <pre>{@code
 * EntityType<Widget> type = EntityType.builder(Widget.class, Widget::new)
 *     .column("name", String.class, Widget::getName, Widget::setName)
 *     .build();
 * }</pre>
 *
 * @param <E> entity type
 */
public final class EntityType<E extends Entity> {
  private final Class<E> entityClass;
  private final Supplier<? extends E> factory;
  private final String tableName;
  private final Capabilities capabilities;
  private final List<Column<E, ?>> columns;
  private final Map<String, Column<E, ?>> columnsByName;

  private EntityType(Builder<E> builder) {
    this.entityClass = builder.entityClass;
    this.factory = builder.factory;
    this.tableName = TableNames.validate(
        builder.tableName != null ? builder.tableName : TableNames.toSnakeCase(entityClass.getSimpleName()));
    this.capabilities = Capabilities.of(entityClass);

    Map<String, Column<E, ?>> byName = new LinkedHashMap<>();
    List<Column<E, ?>> standard = standardColumns(capabilities);
    for (Column<E, ?> column : standard) {
      byName.put(column.name(), column);
    }
    for (Column<E, ?> column : builder.columns) {
      if (byName.putIfAbsent(column.name(), column) != null) {
        throw new IllegalArgumentException("Duplicate column " + column.name() + " on " + entityClass.getSimpleName());
      }
    }
    this.columns = List.copyOf(byName.values());
    this.columnsByName = Collections.unmodifiableMap(byName);
  }

  public static <E extends Entity> Builder<E> builder(Class<E> entityClass, Supplier<? extends E> factory) {
    return new Builder<>(entityClass, factory);
  }

  public Class<E> entityClass() {
    return entityClass;
  }

  /**
   * Returns the simple class name, used in error messages.
   */
  public String name() {
    return entityClass.getSimpleName();
  }

  public String tableName() {
    return tableName;
  }

  public Capabilities capabilities() {
    return capabilities;
  }

  /**
   * Returns all columns, standard columns first, in declaration order.
   */
  public List<Column<E, ?>> columns() {
    return columns;
  }

  public Optional<Column<E, ?>> column(String name) {
    return Optional.ofNullable(columnsByName.get(name));
  }

  public boolean hasColumn(String name) {
    return columnsByName.containsKey(name);
  }

  public E newInstance() {
    return Objects.requireNonNull(factory.get(), "factory returned null");
  }

  @Override
  public String toString() {
    return "EntityType{" + name() + " -> " + tableName + ", " + capabilities + "}";
  }

  private static <E extends Entity> List<Column<E, ?>> standardColumns(Capabilities capabilities) {
    List<Column<E, ?>> result = new ArrayList<>();
    result.add(new Column<E, Long>(Fields.ID, Long.class, Entity::getId, Entity::setId, true));
    if (capabilities.supportsUuid()) {
      result.add(new Column<E, UUID>(Fields.UUID, UUID.class,
          e -> ((UuidIdentified) e).getUuid(), (e, v) -> ((UuidIdentified) e).setUuid(v), true));
    }
    if (capabilities.supportsTimestamps()) {
      result.add(new Column<E, Instant>(Fields.CREATED_AT, Instant.class,
          e -> ((Timestamped) e).getCreatedAt(), (e, v) -> ((Timestamped) e).setCreatedAt(v), true));
      result.add(new Column<E, Instant>(Fields.UPDATED_AT, Instant.class,
          e -> ((Timestamped) e).getUpdatedAt(), (e, v) -> ((Timestamped) e).setUpdatedAt(v), true));
    }
    if (capabilities.supportsSoftDelete()) {
      result.add(new Column<E, Instant>(Fields.DELETED_AT, Instant.class,
          e -> ((SoftDeletable) e).getDeletedAt(), (e, v) -> ((SoftDeletable) e).setDeletedAt(v), true));
    }
    if (capabilities.supportsDeactivation()) {
      result.add(new Column<E, Instant>(Fields.DEACTIVATED_AT, Instant.class,
          e -> ((Deactivatable) e).getDeactivatedAt(), (e, v) -> ((Deactivatable) e).setDeactivatedAt(v), true));
    }
    return result;
  }

  /**
   * Builder for {@link EntityType}.
   */
  public static final class Builder<E extends Entity> {
    private final Class<E> entityClass;
    private final Supplier<? extends E> factory;
    private final List<Column<E, ?>> columns = new ArrayList<>();
    private String tableName;

    private Builder(Class<E> entityClass, Supplier<? extends E> factory) {
      this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
      this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Overrides the default snake_case table name.
     */
    public Builder<E> tableName(String tableName) {
      this.tableName = TableNames.validate(tableName);
      return this;
    }

    /**
     * Declares a domain column.
     *
     * @throws IllegalArgumentException if the name is a standard column name or the type is unsupported
     */
    public <T> Builder<E> column(String name, Class<T> type, Function<? super E, ? extends T> getter,
        BiConsumer<? super E, ? super T> setter) {
      if (Fields.RESERVED.contains(name)) {
        throw new IllegalArgumentException("Column name is reserved: " + name);
      }
      columns.add(new Column<>(name, type, getter, setter, false));
      return this;
    }

    public EntityType<E> build() {
      return new EntityType<>(this);
    }
  }
}
