package ca.gc.cra.logship.validation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration settings written either as {@code <amount><unit>} ({@code 500ms}, {@code 10s}, {@code 2m},
 * {@code 1h}, {@code 250us}, {@code 10ns}) or as ISO-8601 ({@code PT10S}).
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern SIMPLE = Pattern.compile("^(\\d+)(ns|us|ms|s|m|h)$");

  private Durations() {
    // Utility
  }

  /**
   * Parses a non-negative duration.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text
   * @return parsed duration
   * @throws IllegalArgumentException if the text is blank, malformed, or negative
   */
  public static Duration parse(String name, String raw) {
    String label = (name == null || name.isBlank()) ? "duration" : name;
    String trimmed = Strings.requireNonBlank(label, raw);
    Matcher matcher = SIMPLE.matcher(trimmed.toLowerCase(Locale.ROOT));
    Duration parsed;
    if (matcher.matches()) {
      try {
        long amount = Long.parseLong(matcher.group(1));
        parsed = switch (matcher.group(2)) {
          case "ns" -> Duration.ofNanos(amount);
          case "us" -> Duration.ofNanos(Math.multiplyExact(amount, 1_000L));
          case "ms" -> Duration.ofMillis(amount);
          case "s" -> Duration.ofSeconds(amount);
          case "m" -> Duration.ofMinutes(amount);
          default -> Duration.ofHours(amount);
        };
      } catch (NumberFormatException | ArithmeticException ex) {
        throw new IllegalArgumentException(label + " is out of range (was " + raw + ")", ex);
      }
    } else {
      try {
        parsed = Duration.parse(trimmed.toUpperCase(Locale.ROOT));
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(
            label + " must look like 500ms, 10s, 2m, 1h or PT10S (was " + raw + ")", ex);
      }
    }
    if (parsed.isNegative()) {
      throw new IllegalArgumentException(label + " must not be negative (was " + raw + ")");
    }
    return parsed;
  }
}
