package dbkit.config;

import dbkit.error.InvalidVersionException;

import java.time.Clock;
import java.time.Year;
import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar-based application version of the form {@code YEAR.MONTH.PATCH}, e.g. {@code 2025.12.1}.
 *
 * @param year four-digit year, from {@value #MIN_YEAR} up to next year
 * @param month month, 1 to 12
 * @param patch patch number, {@code >= 0}
 */
public record AppVersion(int year, int month, int patch) implements Comparable<AppVersion> {
  public static final int MIN_YEAR = 2020;

  private static final Pattern FORMAT = Pattern.compile("(\\d{4})\\.(\\d{1,2})\\.(\\d+)");
  private static final Comparator<AppVersion> ORDER = Comparator.comparingInt(AppVersion::year)
      .thenComparingInt(AppVersion::month)
      .thenComparingInt(AppVersion::patch);

  public AppVersion {
    if (month < 1 || month > 12) {
      throw new InvalidVersionException("Version month must be between 1 and 12, was " + month);
    }
    if (patch < 0) {
      throw new InvalidVersionException("Version patch must be >= 0, was " + patch);
    }
  }

  public static AppVersion parse(String version) {
    return parse(version, Clock.systemUTC());
  }

  /**
   * Parses and validates a version string.
   *
   * @param version version text
   * @param clock clock used to determine the current year
   * @throws InvalidVersionException if the text is malformed or out of range
   */
  public static AppVersion parse(String version, Clock clock) {
    Objects.requireNonNull(clock, "clock");
    if (version == null) {
      throw new InvalidVersionException("Version must not be null");
    }
    Matcher m = FORMAT.matcher(version.trim());
    if (!m.matches()) {
      throw new InvalidVersionException(
          "Version must have the form YEAR.MONTH.PATCH, e.g. 2025.12.1, was '" + version + "'");
    }
    int year = Integer.parseInt(m.group(1));
    int maxYear = Year.now(clock).getValue() + 1;
    if (year < MIN_YEAR || year > maxYear) {
      throw new InvalidVersionException(
          "Version year must be between " + MIN_YEAR + " and " + maxYear + ", was " + year);
    }
    int patch;
    try {
      patch = Integer.parseInt(m.group(3));
    } catch (NumberFormatException e) {
      throw new InvalidVersionException("Version patch is too large: " + m.group(3), e);
    }
    return new AppVersion(year, Integer.parseInt(m.group(2)), patch);
  }

  @Override
  public int compareTo(AppVersion other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return year + "." + month + "." + patch;
  }
}
