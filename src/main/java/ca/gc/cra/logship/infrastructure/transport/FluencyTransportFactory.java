package ca.gc.cra.logship.infrastructure.transport;

import ca.gc.cra.logship.application.port.TransportClient;
import ca.gc.cra.logship.application.port.TransportFactory;
import ca.gc.cra.logship.config.Network;
import ca.gc.cra.logship.config.TransportConfig;
import ca.gc.cra.logship.domain.error.TransportInitException;
import ca.gc.cra.logship.validation.Net;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.komamitsu.fluency.Fluency;
import org.komamitsu.fluency.fluentd.FluencyBuilderForFluentd;
import org.komamitsu.fluency.fluentd.FluencyExtBuilderForFluentd;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds Fluency-backed {@link TransportClient}s from {@link TransportConfig}.
 * <p><strong>Why:</strong> Keeps the forward-protocol library behind the transport port; the rest of the
 * forwarder never sees Fluency types.</p>
 * <p><strong>Role:</strong> Infrastructure adapter factory.</p>
 * <p><strong>Mapping:</strong>
 * <ul>
 *   <li>{@code tcp}/{@code tls} connect to {@code host:port}; {@code tls} enables SSL.</li>
 *   <li>{@code unix} connects to {@code socketPath} through the Fluency extension module.</li>
 *   <li>Timeouts, retry, buffer, and ack settings map to the matching Fluency builder options.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Fluency has no JSON marshalling mode and no switch to skip TLS verification; those settings are
 *     logged and ignored.
 * @since 0.1.0
 */
public final class FluencyTransportFactory implements TransportFactory {
  private static final Logger log = LoggerFactory.getLogger(FluencyTransportFactory.class);
  private static final int DEFAULT_CHUNK_INITIAL_SIZE = 1024 * 1024;
  private static final int DEFAULT_CHUNK_RETENTION_SIZE = 4 * 1024 * 1024;
  static final int MIN_BUFFER_SIZE = 8 * 1024;

  @Override
  public TransportClient create(TransportConfig config) throws TransportInitException {
    Objects.requireNonNull(config, "config");
    Network network = resolveNetwork(config.network());
    warnUnsupported(config);

    Fluency fluency;
    try {
      fluency = switch (network) {
        case TCP, TLS -> {
          String host = requireHost(config.host());
          int port = requirePort(config.port());
          FluencyBuilderForFluentd builder = new FluencyBuilderForFluentd();
          builder.setSslEnabled(network == Network.TLS);
          applyCommon(builder, config);
          yield builder.build(host, port);
        }
        case UNIX -> {
          Path socket = requireSocketPath(config.socketPath());
          FluencyExtBuilderForFluentd builder = new FluencyExtBuilderForFluentd();
          applyCommon(builder, config);
          yield builder.build(socket);
        }
      };
    } catch (RuntimeException ex) {
      throw new TransportInitException("failed to build " + network.label() + " transport: " + ex.getMessage(), ex);
    }
    log.debug("Built {} transport {}", network.label(), config);
    return new FluencyTransportClient(fluency, config.tagPrefix(), config.async(), config.subSecondPrecision());
  }

  static Network resolveNetwork(String raw) throws TransportInitException {
    try {
      return Network.fromString(raw);
    } catch (IllegalArgumentException ex) {
      throw new TransportInitException("unsupported transport network: " + raw, ex);
    }
  }

  private static String requireHost(String host) throws TransportInitException {
    try {
      return Net.validateHost(host);
    } catch (IllegalArgumentException ex) {
      throw new TransportInitException("invalid collector host: " + ex.getMessage(), ex);
    }
  }

  private static int requirePort(int port) throws TransportInitException {
    try {
      return Net.validatePort(port);
    } catch (IllegalArgumentException ex) {
      throw new TransportInitException("invalid collector port: " + ex.getMessage(), ex);
    }
  }

  private static Path requireSocketPath(String socketPath) throws TransportInitException {
    if (socketPath == null || socketPath.isBlank()) {
      throw new TransportInitException("unix network requires a socket path");
    }
    try {
      return Path.of(socketPath);
    } catch (InvalidPathException ex) {
      throw new TransportInitException("invalid unix socket path: " + socketPath, ex);
    }
  }

  private static void applyCommon(FluencyBuilderForFluentd builder, TransportConfig config) {
    builder.setConnectionTimeoutMilli(toMillis(config.timeout()));
    if (!config.writeTimeout().isZero()) {
      builder.setReadTimeoutMilli(toMillis(config.writeTimeout()));
    }
    builder.setAckResponseMode(config.requestAck());
    builder.setSenderMaxRetryCount(config.maxRetry());
    builder.setSenderBaseRetryIntervalMillis(toMillis(config.retryWait()));
    if (!config.asyncReconnectInterval().isZero()) {
      builder.setSenderMaxRetryIntervalMillis(toMillis(config.asyncReconnectInterval()));
    }
    BufferSizes sizes = bufferSizes(config.bufferLimit());
    if (sizes.maxBufferSize() != config.bufferLimit()) {
      log.warn("bufferLimit {} is below the transport minimum; using {} bytes",
          config.bufferLimit(), sizes.maxBufferSize());
    }
    builder.setMaxBufferSize(sizes.maxBufferSize());
    builder.setBufferChunkInitialSize(sizes.chunkInitialSize());
    builder.setBufferChunkRetentionSize(sizes.chunkRetentionSize());
    if (config.forceStopAsyncSend()) {
      builder.setWaitUntilBufferFlushed(0);
      builder.setWaitUntilFlusherTerminated(0);
    }
  }

  /**
   * Derives Fluency buffer sizes from a byte limit. Fluency requires
   * {@code chunkInitialSize < chunkRetentionSize < maxBufferSize}; limits below {@link #MIN_BUFFER_SIZE} are
   * raised to it.
   *
   * @param bufferLimit configured buffer limit in bytes
   * @return sizes that satisfy Fluency's ordering
   */
  static BufferSizes bufferSizes(int bufferLimit) {
    long max = Math.max(bufferLimit, MIN_BUFFER_SIZE);
    int retention = (int) Math.min(DEFAULT_CHUNK_RETENTION_SIZE, max / 2);
    int initial = Math.min(DEFAULT_CHUNK_INITIAL_SIZE, retention / 2);
    return new BufferSizes(max, initial, retention);
  }

  record BufferSizes(long maxBufferSize, int chunkInitialSize, int chunkRetentionSize) {}

  private static void warnUnsupported(TransportConfig config) {
    if (config.marshalAsJson()) {
      log.warn("marshalAsJson is not supported by the Fluency transport; records are sent as MessagePack");
    }
    if (config.tlsInsecureSkipVerify()) {
      log.warn("tlsInsecureSkipVerify is not supported by the Fluency transport; certificates are verified");
    }
  }

  private static int toMillis(Duration duration) {
    return (int) Math.min(Integer.MAX_VALUE, duration.toMillis());
  }
}
