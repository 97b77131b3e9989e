package dbkit.model;

/**
 * Optional structural features an entity type may declare.
 */
public enum Capability {
  UUID(UuidIdentified.class),
  TIMESTAMPS(Timestamped.class),
  SOFT_DELETE(SoftDeletable.class),
  DEACTIVATION(Deactivatable.class);

  private final Class<?> marker;

  Capability(Class<?> marker) {
    this.marker = marker;
  }

  /**
   * Returns the interface an entity class implements to declare this capability.
   */
  public Class<?> marker() {
    return marker;
  }
}
