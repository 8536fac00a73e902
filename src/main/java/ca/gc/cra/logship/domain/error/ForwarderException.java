package ca.gc.cra.logship.domain.error;

/**
 * <strong>What:</strong> Root checked exception for every failure the log forwarder reports to callers.
 * <p><strong>Why:</strong> Lets shutdown paths aggregate sink, transport, and facade failures behind one type
 * while subclasses keep the failure category explicit.</p>
 * <p><strong>Thread-safety:</strong> Immutable once thrown, apart from suppressed exceptions attached during
 * shutdown aggregation.</p>
 *
 * @since 0.1.0
 * @see ConfigException
 * @see SinkClosedException
 */
public class ForwarderException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ForwarderException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause raised by the transport, decoder, or configuration layer
   */
  public ForwarderException(String message, Throwable cause) {
    super(message, cause);
  }
}
