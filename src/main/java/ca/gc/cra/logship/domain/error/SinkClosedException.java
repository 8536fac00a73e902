package ca.gc.cra.logship.domain.error;

/**
 * Raised when a record reaches a sink after shutdown has begun.
 *
 * <p>Recoverable: callers should stop logging rather than fail.</p>
 *
 * @since 0.1.0
 */
public final class SinkClosedException extends ForwarderException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with the standard message.
   */
  public SinkClosedException() {
    super("log sink is closed");
  }
}
