package ca.gc.cra.logship.api;

/**
 * <strong>What:</strong> Process exit codes returned by the logship command-line tools.
 * <p><strong>Why:</strong> Lets supervisors and scripts tell a bad invocation from a bad configuration or a
 * shutdown that could not drain in time.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed, or the transport could not be built from it. */
  CONFIG_ERROR(4),
  /** Forwarding or shutdown failed at runtime, including a shutdown that exceeded its deadline. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
