package ca.gc.cra.logship.domain.error;

/**
 * Raised when bytes handed to the sink are not a single JSON object.
 *
 * <p>Indicates an encoder defect; surfaced to the failing write but never fatal to the process.</p>
 *
 * @since 0.1.0
 */
public final class RecordDecodeException extends ForwarderException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public RecordDecodeException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying parser failure.
   *
   * @param message human-readable error
   * @param cause parser failure
   */
  public RecordDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
