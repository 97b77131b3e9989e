package dbkit.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable capability set of one entity type.
 *
 * <p>{@link #of(Class)} is a pure check of which capability interfaces a class implements.
 * It is evaluated once per {@link EntityType}; repositories never re-inspect entity classes.
 */
public final class Capabilities {
  private static final Capabilities NONE = new Capabilities(EnumSet.noneOf(Capability.class));

  private final Set<Capability> values;

  private Capabilities(EnumSet<Capability> values) {
    this.values = Collections.unmodifiableSet(values);
  }

  /**
   * Detects the capabilities declared by an entity class.
   *
   * @param entityClass the entity class
   * @return the declared capability set
   */
  public static Capabilities of(Class<? extends Entity> entityClass) {
    Objects.requireNonNull(entityClass, "entityClass");
    EnumSet<Capability> detected = EnumSet.noneOf(Capability.class);
    for (Capability capability : Capability.values()) {
      if (capability.marker().isAssignableFrom(entityClass)) {
        detected.add(capability);
      }
    }
    return detected.isEmpty() ? NONE : new Capabilities(detected);
  }

  public static Capabilities none() {
    return NONE;
  }

  public boolean supports(Capability capability) {
    return values.contains(capability);
  }

  public boolean supportsUuid() {
    return supports(Capability.UUID);
  }

  public boolean supportsTimestamps() {
    return supports(Capability.TIMESTAMPS);
  }

  public boolean supportsSoftDelete() {
    return supports(Capability.SOFT_DELETE);
  }

  public boolean supportsDeactivation() {
    return supports(Capability.DEACTIVATION);
  }

  public Set<Capability> asSet() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Capabilities other)) return false;
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Capabilities" + values;
  }
}
