package dbkit.repo;

import dbkit.model.Values;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Visibility and identity filters for {@link Repository#list}.
 *
 * <p>By default soft-deleted and deactivated rows are hidden (for entity types that have the
 * capability). {@code onlyX} wins over {@code withX}. Empty id/uuid sets impose no restriction.
 */
public final class ListFilter {
  private static final ListFilter NONE = builder().build();

  private final Set<Long> ids;
  private final Set<UUID> uuids;
  private final boolean onlyDeleted;
  private final boolean withDeleted;
  private final boolean onlyDeactivated;
  private final boolean withDeactivated;

  private ListFilter(Builder builder) {
    this.ids = Set.copyOf(builder.ids);
    this.uuids = Set.copyOf(builder.uuids);
    this.onlyDeleted = builder.onlyDeleted;
    this.withDeleted = builder.withDeleted;
    this.onlyDeactivated = builder.onlyDeactivated;
    this.withDeactivated = builder.withDeactivated;
  }

  public static ListFilter none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Decodes a dynamic filter map, e.g. one parsed from a request.
   *
   * <p>Recognized keys: {@code ids}, {@code uuids}, {@code only_deleted}/{@code onlyDeleted},
   * {@code with_deleted}/{@code withDeleted}, {@code only_deactivated}/{@code onlyDeactivated},
   * {@code with_deactivated}/{@code withDeactivated}. Other keys are ignored.
   *
   * @throws IllegalArgumentException if a recognized key has a value of the wrong type
   */
  public static ListFilter fromMap(Map<String, ?> filters) {
    if (filters == null || filters.isEmpty()) {
      return NONE;
    }
    Builder builder = builder();
    for (Map.Entry<String, ?> entry : filters.entrySet()) {
      Object value = entry.getValue();
      switch (entry.getKey()) {
        case "ids" -> collection(entry.getKey(), value).forEach(v -> builder.id(element(entry.getKey(), Long.class, v)));
        case "uuids" -> collection(entry.getKey(), value).forEach(v -> builder.uuid(element(entry.getKey(), UUID.class, v)));
        case "only_deleted", "onlyDeleted" -> builder.onlyDeleted(flag(entry.getKey(), value));
        case "with_deleted", "withDeleted" -> builder.withDeleted(flag(entry.getKey(), value));
        case "only_deactivated", "onlyDeactivated" -> builder.onlyDeactivated(flag(entry.getKey(), value));
        case "with_deactivated", "withDeactivated" -> builder.withDeactivated(flag(entry.getKey(), value));
        default -> {
          // unknown keys carry no filter
        }
      }
    }
    return builder.build();
  }

  private static Collection<?> collection(String key, Object value) {
    if (value == null) {
      return Set.of();
    }
    if (value instanceof Collection<?> c) {
      return c;
    }
    throw new IllegalArgumentException(key + " must be a collection");
  }

  private static <T> T element(String key, Class<T> type, Object value) {
    if (value == null) {
      throw new IllegalArgumentException(key + " must not contain null");
    }
    return Values.coerce(type, value);
  }

  private static boolean flag(String key, Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw new IllegalArgumentException(key + " must be a boolean");
  }

  public Set<Long> ids() {
    return ids;
  }

  public Set<UUID> uuids() {
    return uuids;
  }

  public boolean onlyDeleted() {
    return onlyDeleted;
  }

  public boolean withDeleted() {
    return withDeleted;
  }

  public boolean onlyDeactivated() {
    return onlyDeactivated;
  }

  public boolean withDeactivated() {
    return withDeactivated;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ListFilter other)) return false;
    return onlyDeleted == other.onlyDeleted && withDeleted == other.withDeleted
        && onlyDeactivated == other.onlyDeactivated && withDeactivated == other.withDeactivated
        && ids.equals(other.ids) && uuids.equals(other.uuids);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ids, uuids, onlyDeleted, withDeleted, onlyDeactivated, withDeactivated);
  }

  @Override
  public String toString() {
    return "ListFilter{ids=" + ids + ", uuids=" + uuids
        + ", onlyDeleted=" + onlyDeleted + ", withDeleted=" + withDeleted
        + ", onlyDeactivated=" + onlyDeactivated + ", withDeactivated=" + withDeactivated + "}";
  }

  public static final class Builder {
    private final Set<Long> ids = new LinkedHashSet<>();
    private final Set<UUID> uuids = new LinkedHashSet<>();
    private boolean onlyDeleted;
    private boolean withDeleted;
    private boolean onlyDeactivated;
    private boolean withDeactivated;

    private Builder() {}

    public Builder id(long id) {
      ids.add(id);
      return this;
    }

    public Builder ids(Collection<Long> ids) {
      ids.forEach(id -> this.ids.add(Objects.requireNonNull(id, "id")));
      return this;
    }

    public Builder uuid(UUID uuid) {
      uuids.add(Objects.requireNonNull(uuid, "uuid"));
      return this;
    }

    public Builder uuids(Collection<UUID> uuids) {
      uuids.forEach(this::uuid);
      return this;
    }

    public Builder onlyDeleted(boolean onlyDeleted) {
      this.onlyDeleted = onlyDeleted;
      return this;
    }

    public Builder withDeleted(boolean withDeleted) {
      this.withDeleted = withDeleted;
      return this;
    }

    public Builder onlyDeactivated(boolean onlyDeactivated) {
      this.onlyDeactivated = onlyDeactivated;
      return this;
    }

    public Builder withDeactivated(boolean withDeactivated) {
      this.withDeactivated = withDeactivated;
      return this;
    }

    public ListFilter build() {
      return new ListFilter(this);
    }
  }
}
