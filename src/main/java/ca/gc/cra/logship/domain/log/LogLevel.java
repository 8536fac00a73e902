package ca.gc.cra.logship.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity levels understood by the structured logger, ordered from least to most severe.
 * <p><strong>Why:</strong> Drives level filtering before any encoding work and supplies the lowercase severity
 * names the collector schema expects.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Diagnostic detail. */
  DEBUG("debug"),
  /** Routine operational events. */
  INFO("info"),
  /** Unexpected but tolerated conditions. */
  WARN("warn"),
  /** Failures requiring attention. */
  ERROR("error");

  /** Level used when configuration names no recognizable level. */
  public static final LogLevel DEFAULT = DEBUG;

  private static final String LEGACY_WARNING = "WARNING";

  private final String wireName;

  LogLevel(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase severity written into encoded records.
   *
   * @return severity name such as {@code "warn"}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Indicates whether records at {@code candidate} pass a logger configured at this level.
   *
   * @param candidate level of the record being logged
   * @return {@code true} when {@code candidate} is at least as severe as this level
   */
  public boolean permits(LogLevel candidate) {
    return candidate.ordinal() >= ordinal();
  }

  /**
   * Resolves a configured level name without failing.
   *
   * <p>Canonical names are matched case-sensitively in their lowercase or uppercase spelling
   * ({@code "warn"}, {@code "WARN"}). The legacy token {@code WARNING} is accepted in any casing and maps to
   * {@link #WARN}. Anything else, including {@code null} and blank input, resolves to {@link #DEFAULT}.</p>
   *
   * @param raw configured level name; may be {@code null}
   * @return resolved level; never {@code null}
   */
  public static LogLevel parse(String raw) {
    if (raw == null) {
      return DEFAULT;
    }
    for (LogLevel level : values()) {
      if (level.wireName.equals(raw) || level.name().equals(raw)) {
        return level;
      }
    }
    if (LEGACY_WARNING.equals(raw.toUpperCase(Locale.ROOT))) {
      return WARN;
    }
    return DEFAULT;
  }
}
