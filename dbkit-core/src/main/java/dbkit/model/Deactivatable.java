package dbkit.model;

import java.time.Instant;

/**
 * Capability: a nullable {@code deactivated_at} column, independent of soft deletion.
 */
public interface Deactivatable {

  Instant getDeactivatedAt();

  void setDeactivatedAt(Instant deactivatedAt);

  default boolean isDeactivated() {
    return getDeactivatedAt() != null;
  }
}
