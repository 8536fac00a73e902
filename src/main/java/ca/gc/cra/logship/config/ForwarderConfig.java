package ca.gc.cra.logship.config;

import ca.gc.cra.logship.domain.error.ConfigException;
import ca.gc.cra.logship.domain.log.DurationEncoding;
import ca.gc.cra.logship.validation.Durations;
import ca.gc.cra.logship.validation.Net;
import ca.gc.cra.logship.validation.Numbers;
import ca.gc.cra.logship.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Immutable configuration for a {@code LogForwarder}.
 * <p><strong>Why:</strong> Bundles the routing tag, shutdown deadline, level threshold, encoding profile, and
 * transport settings so a forwarder is fully described before any resource is allocated.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by the lifecycle owner.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the routing tag and shutdown timeout to non-empty defaults when unset.</li>
 *   <li>Parse flattened key/value maps produced by the environment, YAML, and CLI sources.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 * @see TransportConfig
 * @see ConfigKeys
 */
public final class ForwarderConfig {
  /** Routing tag used when none is configured. */
  public static final String DEFAULT_TAG = "app.logs";
  /** Shutdown deadline used when none is configured. */
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final String routingTag;
  private final Duration shutdownTimeout;
  private final String minLogLevel;
  private final DurationEncoding durationEncoding;
  private final TransportConfig transport;

  private ForwarderConfig(Builder builder) {
    this.routingTag = builder.routingTag == null || builder.routingTag.isBlank()
        ? DEFAULT_TAG
        : Strings.sanitizeTag("tag", builder.routingTag);
    if (builder.shutdownTimeout == null || builder.shutdownTimeout.isZero()) {
      this.shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    } else if (builder.shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be positive (was " + builder.shutdownTimeout + ")");
    } else {
      this.shutdownTimeout = builder.shutdownTimeout;
    }
    this.minLogLevel = builder.minLogLevel;
    this.durationEncoding = Objects.requireNonNullElse(builder.durationEncoding, DurationEncoding.STRING);
    this.transport = Objects.requireNonNullElseGet(builder.transport, TransportConfig::defaults);
  }

  /**
   * Returns a configuration populated entirely with defaults.
   *
   * @return default configuration
   */
  public static ForwarderConfig defaults() {
    return builder().build();
  }

  /**
   * Starts a builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a configuration from flattened keys (see {@link ConfigKeys}).
   *
   * <p>Missing keys take defaults. Present keys are parsed strictly: unknown networks, non-boolean flags,
   * non-numeric integers, and malformed durations are rejected rather than defaulted.</p>
   *
   * @param values flattened configuration; must not be {@code null}
   * @return parsed configuration
   * @throws ConfigException naming the offending key when a value is invalid
   */
  public static ForwarderConfig fromMap(Map<String, String> values) throws ConfigException {
    Objects.requireNonNull(values, "values");
    try {
      TransportConfig.Builder transport = TransportConfig.builder();
      Network network = Network.fromString(values.get(ConfigKeys.NETWORK));
      transport.network(network.label());
      if (network == Network.UNIX) {
        String socketPath = Strings.trimToNull(values.get(ConfigKeys.SOCKET_PATH));
        if (socketPath == null) {
          throw new IllegalArgumentException(ConfigKeys.SOCKET_PATH + " is required for unix network");
        }
        transport.socketPath(Strings.requireNonBlank(ConfigKeys.SOCKET_PATH, socketPath));
      } else {
        ifPresent(values, ConfigKeys.HOST, raw -> transport.host(Net.validateHost(raw)));
        ifPresent(values, ConfigKeys.PORT,
            raw -> transport.port(Net.validatePort(Numbers.parseInt(ConfigKeys.PORT, raw, 1, 65535))));
      }
      ifPresent(values, ConfigKeys.TIMEOUT, raw -> transport.timeout(Durations.parse(ConfigKeys.TIMEOUT, raw)));
      ifPresent(values, ConfigKeys.WRITE_TIMEOUT,
          raw -> transport.writeTimeout(Durations.parse(ConfigKeys.WRITE_TIMEOUT, raw)));
      ifPresent(values, ConfigKeys.BUFFER_LIMIT,
          raw -> transport.bufferLimit(Numbers.parseInt(ConfigKeys.BUFFER_LIMIT, raw, 1, Integer.MAX_VALUE)));
      ifPresent(values, ConfigKeys.MAX_RETRY,
          raw -> transport.maxRetry(Numbers.parseInt(ConfigKeys.MAX_RETRY, raw, 0, Integer.MAX_VALUE)));
      ifPresent(values, ConfigKeys.RETRY_WAIT,
          raw -> transport.retryWait(parseMillisOrDuration(ConfigKeys.RETRY_WAIT, raw)));
      ifPresent(values, ConfigKeys.ASYNC_RECONNECT_INTERVAL,
          raw -> transport.asyncReconnectInterval(parseMillisOrDuration(ConfigKeys.ASYNC_RECONNECT_INTERVAL, raw)));
      transport.async(parseBoolean(ConfigKeys.ASYNC, values.get(ConfigKeys.ASYNC)));
      transport.forceStopAsyncSend(
          parseBoolean(ConfigKeys.FORCE_STOP_ASYNC_SEND, values.get(ConfigKeys.FORCE_STOP_ASYNC_SEND)));
      transport.subSecondPrecision(
          parseBoolean(ConfigKeys.SUB_SECOND_PRECISION, values.get(ConfigKeys.SUB_SECOND_PRECISION)));
      transport.marshalAsJson(parseBoolean(ConfigKeys.MARSHAL_AS_JSON, values.get(ConfigKeys.MARSHAL_AS_JSON)));
      transport.requestAck(parseBoolean(ConfigKeys.REQUEST_ACK, values.get(ConfigKeys.REQUEST_ACK)));
      transport.tlsInsecureSkipVerify(
          parseBoolean(ConfigKeys.TLS_INSECURE_SKIP_VERIFY, values.get(ConfigKeys.TLS_INSECURE_SKIP_VERIFY)));
      ifPresent(values, ConfigKeys.TAG_PREFIX,
          raw -> transport.tagPrefix(Strings.sanitizeTag(ConfigKeys.TAG_PREFIX, raw)));

      Builder builder = builder().transport(transport.build());
      ifPresent(values, ConfigKeys.TAG, raw -> builder.routingTag(Strings.sanitizeTag(ConfigKeys.TAG, raw)));
      ifPresent(values, ConfigKeys.SHUTDOWN_TIMEOUT,
          raw -> builder.shutdownTimeout(Durations.parse(ConfigKeys.SHUTDOWN_TIMEOUT, raw)));
      builder.minLogLevel(values.get(ConfigKeys.LOG_LEVEL));
      builder.durationEncoding(DurationEncoding.fromString(values.get(ConfigKeys.DURATION_ENCODING)));
      return builder.build();
    } catch (IllegalArgumentException ex) {
      throw new ConfigException("Invalid forwarder configuration: " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses a strict boolean: {@code true} or {@code false} in any casing; blank or absent means {@code false}.
   *
   * @param name key used in diagnostics
   * @param raw candidate value
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  static boolean parseBoolean(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }

  private static Duration parseMillisOrDuration(String name, String raw) {
    String trimmed = raw.trim();
    if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
      return Duration.ofMillis(Numbers.parseInt(name, trimmed, 0, Integer.MAX_VALUE));
    }
    return Durations.parse(name, trimmed);
  }

  private static void ifPresent(Map<String, String> values, String key, Consumer<String> action) {
    String raw = values.get(key);
    if (raw != null && !raw.isBlank()) {
      action.accept(raw.trim());
    }
  }

  /** @return routing tag records are published under */
  public String routingTag() {
    return routingTag;
  }

  /** @return deadline for the transport close during shutdown */
  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  /** @return configured level name, resolved by {@code LogLevel.parse}; may be {@code null} */
  public String minLogLevel() {
    return minLogLevel;
  }

  /** @return encoding profile for duration fields */
  public DurationEncoding durationEncoding() {
    return durationEncoding;
  }

  /** @return transport settings */
  public TransportConfig transport() {
    return transport;
  }

  @Override
  public String toString() {
    return "ForwarderConfig{tag=" + routingTag + ", shutdownTimeout=" + shutdownTimeout
        + ", minLogLevel=" + minLogLevel + ", durationEncoding=" + durationEncoding
        + ", transport=" + transport + '}';
  }

  /**
   * Mutable builder for {@link ForwarderConfig}.
   */
  public static final class Builder {
    private String routingTag;
    private Duration shutdownTimeout;
    private String minLogLevel;
    private DurationEncoding durationEncoding;
    private TransportConfig transport;

    private Builder() {}

    public Builder routingTag(String routingTag) {
      this.routingTag = routingTag;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Builder minLogLevel(String minLogLevel) {
      this.minLogLevel = minLogLevel;
      return this;
    }

    public Builder durationEncoding(DurationEncoding durationEncoding) {
      this.durationEncoding = durationEncoding;
      return this;
    }

    public Builder transport(TransportConfig transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Builds the immutable configuration.
     *
     * @return forwarder configuration
     * @throws IllegalArgumentException if the tag is malformed or the timeout is negative
     */
    public ForwarderConfig build() {
      return new ForwarderConfig(this);
    }
  }
}
