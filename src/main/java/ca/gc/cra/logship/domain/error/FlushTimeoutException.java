package ca.gc.cra.logship.domain.error;

import java.time.Duration;

/**
 * Raised when the transport close does not finish within the shutdown deadline.
 *
 * <p>The close keeps running on a background thread; callers decide whether to proceed with process exit.</p>
 *
 * @since 0.1.0
 */
public final class FlushTimeoutException extends ForwarderException {
  private static final long serialVersionUID = 1L;

  private final Duration timeout;

  /**
   * Creates an exception for the elapsed deadline.
   *
   * @param timeout deadline that elapsed
   */
  public FlushTimeoutException(Duration timeout) {
    super("log flush timed out after " + timeout.toMillis() + " ms");
    this.timeout = timeout;
  }

  /**
   * Returns the deadline that elapsed.
   *
   * @return shutdown deadline
   */
  public Duration timeout() {
    return timeout;
  }
}
