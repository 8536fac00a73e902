package ca.gc.cra.logship.domain.error;

/**
 * Raised when forwarder configuration is missing or malformed.
 *
 * <p>Fatal for construction: no forwarder handle is returned when this is thrown.</p>
 *
 * @since 0.1.0
 */
public class ConfigException extends ForwarderException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error naming the offending setting
   */
  public ConfigException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error naming the offending setting
   * @param cause validation or parsing failure
   */
  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
