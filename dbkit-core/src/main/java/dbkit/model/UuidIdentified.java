package dbkit.model;

import java.util.UUID;

/**
 * Capability: a unique, immutable {@code uuid} column generated at creation, usable as an
 * alternate identifier to {@code id}.
 */
public interface UuidIdentified {

  UUID getUuid();

  void setUuid(UUID uuid);
}
