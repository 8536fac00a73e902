package ca.gc.cra.logship.domain.error;

/**
 * Raised when the transport client cannot be built from its configuration.
 *
 * <p>Covers unknown network types, a UNIX network without a socket path, and failures reported by the
 * transport library while it initializes.</p>
 *
 * @since 0.1.0
 */
public final class TransportInitException extends ConfigException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public TransportInitException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause library failure
   */
  public TransportInitException(String message, Throwable cause) {
    super(message, cause);
  }
}
