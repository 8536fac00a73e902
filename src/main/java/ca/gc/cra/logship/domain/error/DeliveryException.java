package ca.gc.cra.logship.domain.error;

/**
 * Raised when the transport rejects or fails a post, flush, or close.
 *
 * <p>The affected record is dropped; retry policy belongs to the transport.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryException extends ForwarderException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception wrapping the transport failure.
   *
   * @param message human-readable error
   * @param cause transport failure
   */
  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
