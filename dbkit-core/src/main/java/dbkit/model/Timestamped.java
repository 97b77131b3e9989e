package dbkit.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Capability: {@code created_at} and {@code updated_at} columns.
 *
 * <p>{@code created_at} is set once; {@code updated_at} is set at creation and on every
 * mutating write, so {@code updated_at >= created_at} always holds.
 */
public interface Timestamped {

  Instant getCreatedAt();

  void setCreatedAt(Instant createdAt);

  Instant getUpdatedAt();

  void setUpdatedAt(Instant updatedAt);

  /**
   * Returns {@code true} if the record has not been modified since it was created.
   */
  default boolean isCreated() {
    return getCreatedAt() != null && Objects.equals(getCreatedAt(), getUpdatedAt());
  }
}
