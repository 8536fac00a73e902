package ca.gc.cra.logship.config;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for the collector transport client.
 * <p><strong>Why:</strong> Carries every knob the forward-protocol client understands so a deployment can tune
 * buffering, retry, and delivery mode without touching code.</p>
 * <p><strong>Role:</strong> Configuration value handed to a {@code TransportFactory}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe for concurrent reads.</p>
 *
 * @implNote {@link #network()} keeps the raw configured spelling; the transport factory resolves it and rejects
 *     unknown values so construction fails fast at the transport boundary.
 * @since 0.1.0
 * @see ForwarderConfig
 */
public final class TransportConfig {
  /** Default collector host. */
  public static final String DEFAULT_HOST = "127.0.0.1";
  /** Default forward-protocol port. */
  public static final int DEFAULT_PORT = 24224;
  /** Default connection timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);
  /** Default buffer limit in bytes. */
  public static final int DEFAULT_BUFFER_LIMIT = 8 * 1024 * 1024;
  /** Default number of delivery retries. */
  public static final int DEFAULT_MAX_RETRY = 13;
  /** Default base wait between retries. */
  public static final Duration DEFAULT_RETRY_WAIT = Duration.ofMillis(500);

  private final String network;
  private final String host;
  private final int port;
  private final String socketPath;
  private final Duration timeout;
  private final Duration writeTimeout;
  private final int bufferLimit;
  private final int maxRetry;
  private final Duration retryWait;
  private final boolean async;
  private final boolean forceStopAsyncSend;
  private final boolean subSecondPrecision;
  private final boolean marshalAsJson;
  private final boolean requestAck;
  private final boolean tlsInsecureSkipVerify;
  private final Duration asyncReconnectInterval;
  private final String tagPrefix;

  private TransportConfig(Builder builder) {
    this.network = builder.network == null || builder.network.isBlank()
        ? Network.TCP.label()
        : builder.network.trim();
    this.host = builder.host == null || builder.host.isBlank() ? DEFAULT_HOST : builder.host.trim();
    this.port = builder.port;
    this.socketPath = builder.socketPath == null || builder.socketPath.isBlank() ? null : builder.socketPath.trim();
    this.timeout = positiveOr(builder.timeout, DEFAULT_TIMEOUT);
    this.writeTimeout = Objects.requireNonNullElse(builder.writeTimeout, Duration.ZERO);
    this.bufferLimit = builder.bufferLimit;
    this.maxRetry = builder.maxRetry;
    this.retryWait = Objects.requireNonNullElse(builder.retryWait, DEFAULT_RETRY_WAIT);
    this.async = builder.async;
    this.forceStopAsyncSend = builder.forceStopAsyncSend;
    this.subSecondPrecision = builder.subSecondPrecision;
    this.marshalAsJson = builder.marshalAsJson;
    this.requestAck = builder.requestAck;
    this.tlsInsecureSkipVerify = builder.tlsInsecureSkipVerify;
    this.asyncReconnectInterval = Objects.requireNonNullElse(builder.asyncReconnectInterval, Duration.ZERO);
    this.tagPrefix = builder.tagPrefix == null ? "" : builder.tagPrefix.trim();

    if (writeTimeout.isNegative() || retryWait.isNegative() || asyncReconnectInterval.isNegative()) {
      throw new IllegalArgumentException("transport durations must not be negative");
    }
    if (bufferLimit <= 0) {
      throw new IllegalArgumentException("bufferLimit must be positive (was " + bufferLimit + ")");
    }
    if (maxRetry < 0) {
      throw new IllegalArgumentException("maxRetry must not be negative (was " + maxRetry + ")");
    }
  }

  /**
   * Returns transport settings populated with library defaults.
   *
   * @return default TCP configuration targeting {@code 127.0.0.1:24224}
   */
  public static TransportConfig defaults() {
    return builder().build();
  }

  /**
   * Starts a builder initialized with defaults.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** @return configured network spelling; resolved by the transport factory */
  public String network() {
    return network;
  }

  /** @return collector host for TCP and TLS networks */
  public String host() {
    return host;
  }

  /** @return collector port for TCP and TLS networks */
  public int port() {
    return port;
  }

  /** @return UNIX socket path, or {@code null} when unset */
  public String socketPath() {
    return socketPath;
  }

  /** @return connection timeout */
  public Duration timeout() {
    return timeout;
  }

  /** @return write/ack timeout; {@link Duration#ZERO} means the library default */
  public Duration writeTimeout() {
    return writeTimeout;
  }

  /** @return buffer limit in bytes */
  public int bufferLimit() {
    return bufferLimit;
  }

  /** @return maximum delivery retries */
  public int maxRetry() {
    return maxRetry;
  }

  /** @return base wait between retries */
  public Duration retryWait() {
    return retryWait;
  }

  /** @return {@code true} when posts return once queued rather than after a flush */
  public boolean async() {
    return async;
  }

  /** @return {@code true} when close should not wait for buffered records */
  public boolean forceStopAsyncSend() {
    return forceStopAsyncSend;
  }

  /** @return {@code true} when event times carry nanoseconds */
  public boolean subSecondPrecision() {
    return subSecondPrecision;
  }

  /** @return {@code true} when records should be marshalled as JSON instead of MessagePack */
  public boolean marshalAsJson() {
    return marshalAsJson;
  }

  /** @return {@code true} when the collector must acknowledge each chunk */
  public boolean requestAck() {
    return requestAck;
  }

  /** @return {@code true} when TLS certificate verification should be skipped */
  public boolean tlsInsecureSkipVerify() {
    return tlsInsecureSkipVerify;
  }

  /** @return upper bound on reconnect backoff; {@link Duration#ZERO} means the library default */
  public Duration asyncReconnectInterval() {
    return asyncReconnectInterval;
  }

  /** @return prefix prepended to every routing tag, empty when unset */
  public String tagPrefix() {
    return tagPrefix;
  }

  @Override
  public String toString() {
    String endpoint = socketPath != null ? socketPath : host + ':' + port;
    return "TransportConfig{network=" + network + ", endpoint=" + endpoint + ", async=" + async
        + ", bufferLimit=" + bufferLimit + ", maxRetry=" + maxRetry + '}';
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    if (value == null || value.isZero()) {
      return fallback;
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive (was " + value + ")");
    }
    return value;
  }

  /**
   * Mutable builder for {@link TransportConfig}.
   */
  public static final class Builder {
    private String network = Network.TCP.label();
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String socketPath;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Duration writeTimeout = Duration.ZERO;
    private int bufferLimit = DEFAULT_BUFFER_LIMIT;
    private int maxRetry = DEFAULT_MAX_RETRY;
    private Duration retryWait = DEFAULT_RETRY_WAIT;
    private boolean async;
    private boolean forceStopAsyncSend;
    private boolean subSecondPrecision;
    private boolean marshalAsJson;
    private boolean requestAck;
    private boolean tlsInsecureSkipVerify;
    private Duration asyncReconnectInterval = Duration.ZERO;
    private String tagPrefix = "";

    private Builder() {}

    public Builder network(String network) {
      this.network = network;
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder socketPath(String socketPath) {
      this.socketPath = socketPath;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder writeTimeout(Duration writeTimeout) {
      this.writeTimeout = writeTimeout;
      return this;
    }

    public Builder bufferLimit(int bufferLimit) {
      this.bufferLimit = bufferLimit;
      return this;
    }

    public Builder maxRetry(int maxRetry) {
      this.maxRetry = maxRetry;
      return this;
    }

    public Builder retryWait(Duration retryWait) {
      this.retryWait = retryWait;
      return this;
    }

    public Builder async(boolean async) {
      this.async = async;
      return this;
    }

    public Builder forceStopAsyncSend(boolean forceStopAsyncSend) {
      this.forceStopAsyncSend = forceStopAsyncSend;
      return this;
    }

    public Builder subSecondPrecision(boolean subSecondPrecision) {
      this.subSecondPrecision = subSecondPrecision;
      return this;
    }

    public Builder marshalAsJson(boolean marshalAsJson) {
      this.marshalAsJson = marshalAsJson;
      return this;
    }

    public Builder requestAck(boolean requestAck) {
      this.requestAck = requestAck;
      return this;
    }

    public Builder tlsInsecureSkipVerify(boolean tlsInsecureSkipVerify) {
      this.tlsInsecureSkipVerify = tlsInsecureSkipVerify;
      return this;
    }

    public Builder asyncReconnectInterval(Duration asyncReconnectInterval) {
      this.asyncReconnectInterval = asyncReconnectInterval;
      return this;
    }

    public Builder tagPrefix(String tagPrefix) {
      this.tagPrefix = tagPrefix;
      return this;
    }

    /**
     * Builds the immutable configuration.
     *
     * @return transport configuration
     * @throws IllegalArgumentException if a numeric or duration setting is out of range
     */
    public TransportConfig build() {
      return new TransportConfig(this);
    }
  }
}
