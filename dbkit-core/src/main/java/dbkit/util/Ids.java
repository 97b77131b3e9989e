package dbkit.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.UUID;

/**
 * Generates entity uuids.
 *
 * <p>Values are monotonic ULIDs rendered as RFC 4122 version 4 UUIDs, so they are valid
 * random UUIDs that also sort roughly by creation time.
 */
public final class Ids {

  private Ids() {}

  public static UUID newUuid() {
    return UlidCreator.getMonotonicUlid().toRfc4122().toUuid();
  }
}
