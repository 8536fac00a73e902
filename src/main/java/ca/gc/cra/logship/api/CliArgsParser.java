package ca.gc.cra.logship.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into an ordered map.
 * <p>Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args arguments, typically {@link CliInput#arguments()}
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException when an argument is not {@code key=value}, the key has characters outside
   *     {@code [A-Za-z0-9._-]}, or the value contains control characters
   */
  public static Map<String, String> toMap(List<String> args) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String arg : args) {
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value);
    }
    return map;
  }
}
