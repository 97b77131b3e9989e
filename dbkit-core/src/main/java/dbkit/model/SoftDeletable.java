package dbkit.model;

import java.time.Instant;

/**
 * Capability: a nullable {@code deleted_at} column. Deleting such an entity marks it
 * instead of removing the row.
 */
public interface SoftDeletable {

  Instant getDeletedAt();

  void setDeletedAt(Instant deletedAt);

  default boolean isDeleted() {
    return getDeletedAt() != null;
  }
}
