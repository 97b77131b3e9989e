package dbkit.model;

/**
 * A persisted record with a server-assigned integer primary key.
 *
 * <p>Optional capabilities are declared by also implementing {@link UuidIdentified},
 * {@link Timestamped}, {@link SoftDeletable} or {@link Deactivatable}.
 *
 * @see BaseEntity
 * @see EntityType
 */
public interface Entity {

  /**
   * Returns the primary key, or {@code null} before the entity is persisted.
   */
  Long getId();

  void setId(Long id);
}
