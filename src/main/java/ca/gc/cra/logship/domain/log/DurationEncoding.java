package ca.gc.cra.logship.domain.log;

import java.util.Locale;

/**
 * Encoding profile for {@link java.time.Duration} field values.
 *
 * <p>A forwarder uses exactly one profile for every record it emits.</p>
 *
 * @since 0.1.0
 */
public enum DurationEncoding {
  /** ISO-8601 duration text such as {@code PT1.5S}. */
  STRING,
  /** Decimal seconds such as {@code 1.5}. */
  SECONDS;

  /**
   * Parses a profile name case-insensitively.
   *
   * @param raw profile name; {@code null} or blank yields {@link #STRING}
   * @return parsed profile
   * @throws IllegalArgumentException when the name is not a known profile
   */
  public static DurationEncoding fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return STRING;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (DurationEncoding encoding : values()) {
      if (encoding.name().equals(normalized)) {
        return encoding;
      }
    }
    throw new IllegalArgumentException("durationEncoding must be STRING or SECONDS (was " + raw + ")");
  }
}
