package ca.gc.cra.logship.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Network families supported by the collector transport.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Network {
  /** Plain TCP forward protocol. */
  TCP("tcp"),
  /** TCP wrapped in TLS. */
  TLS("tls"),
  /** UNIX domain socket; requires a socket path. */
  UNIX("unix");

  private final String label;

  Network(String label) {
    this.label = label;
  }

  /**
   * Returns the configuration spelling of this network.
   *
   * @return lowercase label such as {@code "tcp"}
   */
  public String label() {
    return label;
  }

  /**
   * Parses a network name, defaulting to {@link #TCP} when blank.
   *
   * @param value textual representation such as {@code "tcp"} or {@code "unix"}
   * @return parsed network
   * @throws IllegalArgumentException if the string does not match a known network
   */
  public static Network fromString(String value) {
    if (value == null || value.isBlank()) {
      return TCP;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Network network : values()) {
      if (network.label.equals(normalized)) {
        return network;
      }
    }
    throw new IllegalArgumentException("Unknown network: " + value + " (expected tcp, tls or unix)");
  }
}
