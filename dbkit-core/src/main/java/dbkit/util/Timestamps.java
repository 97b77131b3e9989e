package dbkit.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp helpers. All persisted instants are truncated to microseconds so that a value read
 * back from the store equals the one written.
 */
public final class Timestamps {

  private Timestamps() {}

  public static Instant now(Clock clock) {
    return truncate(clock.instant());
  }

  /**
   * Returns the current time, bumped to one microsecond after {@code previous} if the clock has
   * not moved past it.
   */
  public static Instant after(Instant previous, Clock clock) {
    Instant now = now(clock);
    if (previous != null && !now.isAfter(previous)) {
      return truncate(previous).plus(1, ChronoUnit.MICROS);
    }
    return now;
  }

  public static Instant truncate(Instant instant) {
    return instant == null ? null : instant.truncatedTo(ChronoUnit.MICROS);
  }
}
