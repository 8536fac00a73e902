package ca.gc.cra.logship.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by forwarder configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid ports, buffer limits, and retry counts before the transport
 * allocates resources.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseInt(String name, String raw, int min, int max) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    if (raw == null) {
      throw new IllegalArgumentException(label + " must be an integer (was null)");
    }
    int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(label, parsed, min, max);
  }
}
