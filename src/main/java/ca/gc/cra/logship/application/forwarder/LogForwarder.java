package ca.gc.cra.logship.application.forwarder;

import ca.gc.cra.logship.application.logging.RecordEncoder;
import ca.gc.cra.logship.application.logging.StructuredLogger;
import ca.gc.cra.logship.application.port.ClockPort;
import ca.gc.cra.logship.application.port.MetricsPort;
import ca.gc.cra.logship.application.port.RecordSink;
import ca.gc.cra.logship.application.port.TransportClient;
import ca.gc.cra.logship.application.port.TransportFactory;
import ca.gc.cra.logship.config.ForwarderConfig;
import ca.gc.cra.logship.domain.error.ConfigException;
import ca.gc.cra.logship.domain.error.ForwarderException;
import ca.gc.cra.logship.domain.log.LogLevel;
import ca.gc.cra.logship.infrastructure.sink.TransportSinkAdapter;
import ca.gc.cra.logship.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.logship.infrastructure.transport.FluencyTransportFactory;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns a transport client, the sink adapter on top of it, and the logger facade on top of
 * that, and shuts them down in order.
 * <p><strong>Why:</strong> Callers need one handle that either comes up completely or not at all, and whose
 * shutdown drains records within a bounded time.</p>
 * <p><strong>Role:</strong> Composition root and lifecycle owner for one forwarding pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build transport, then sink, then logger; release the transport if a later step fails.</li>
 *   <li>Close once: sync the logger, then flush and close the sink within the shutdown timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #logger()} may be used from any thread. {@link #close()} may be called
 * concurrently; the work runs once and every caller observes the same outcome.</p>
 *
 * @since 0.1.0
 */
public final class LogForwarder implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LogForwarder.class);

  private final ForwarderConfig config;
  private final RecordSink sink;
  private final StructuredLogger logger;
  private final AtomicReference<CompletableFuture<Void>> closeOutcome = new AtomicReference<>();

  private LogForwarder(ForwarderConfig config, RecordSink sink, StructuredLogger logger) {
    this.config = config;
    this.sink = sink;
    this.logger = logger;
  }

  /**
   * Creates a forwarder backed by the Fluency transport, the system clock, and no metrics.
   *
   * @param config forwarder configuration
   * @return ready forwarder
   * @throws ConfigException when the transport cannot be constructed from {@code config}
   */
  public static LogForwarder create(ForwarderConfig config) throws ConfigException {
    return create(config, new FluencyTransportFactory(), MetricsPort.NO_OP, new SystemClockAdapter());
  }

  /**
   * Creates a forwarder with explicit collaborators.
   *
   * @param config forwarder configuration
   * @param transports factory for the transport client
   * @param metrics metrics sink shared by the sink and the logger
   * @param clock source of record timestamps and event times
   * @return ready forwarder
   * @throws ConfigException when any component cannot be constructed; nothing stays open in that case
   */
  public static LogForwarder create(
      ForwarderConfig config, TransportFactory transports, MetricsPort metrics, ClockPort clock)
      throws ConfigException {
    return create(config, transports, metrics, clock, TransportSinkAdapter::new);
  }

  static LogForwarder create(
      ForwarderConfig config, TransportFactory transports, MetricsPort metrics, ClockPort clock, SinkFactory sinks)
      throws ConfigException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(transports, "transports");
    Objects.requireNonNull(clock, "clock");
    MetricsPort effectiveMetrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);

    TransportClient transport = transports.create(config.transport());
    if (transport == null) {
      throw new ConfigException("transport factory returned no client");
    }
    try {
      RecordSink sink = sinks.create(config.routingTag(), transport, clock, effectiveMetrics);
      StructuredLogger logger = new StructuredLogger(
          LogLevel.parse(config.minLogLevel()),
          new RecordEncoder(config.durationEncoding()),
          sink,
          clock,
          effectiveMetrics);
      log.info("Log forwarder ready: tag={}, level={}, transport={}",
          config.routingTag(), logger.level().wireName(), config.transport());
      return new LogForwarder(config, sink, logger);
    } catch (RuntimeException ex) {
      closeAfterFailedStart(transport, ex);
      throw new ConfigException("failed to assemble log forwarder: " + ex.getMessage(), ex);
    }
  }

  /**
   * Closes {@code forwarder} and logs any failure instead of throwing. {@code null} is ignored.
   *
   * @param forwarder forwarder to close; may be {@code null}
   */
  public static void closeQuietly(LogForwarder forwarder) {
    if (forwarder == null) {
      return;
    }
    try {
      forwarder.close();
    } catch (ForwarderException ex) {
      log.warn("Log forwarder shutdown failed: {}", ex.getMessage(), ex);
    }
  }

  /** @return logger facade bound to this forwarder */
  public StructuredLogger logger() {
    return logger;
  }

  /** @return configuration this forwarder was built from */
  public ForwarderConfig config() {
    return config;
  }

  /** @return {@code true} once {@link #close()} has been called */
  public boolean isClosed() {
    return closeOutcome.get() != null;
  }

  /**
   * Syncs the logger, then flushes and closes the transport within the configured shutdown timeout.
   *
   * <p>If both steps fail the logger's error is thrown and the transport's error is attached as suppressed.
   * Repeated and concurrent calls wait for the first close and rethrow its exception instance.</p>
   *
   * @throws ForwarderException when either step fails, including
   *     {@link ca.gc.cra.logship.domain.error.FlushTimeoutException} on deadline expiry
   */
  @Override
  public void close() throws ForwarderException {
    CompletableFuture<Void> mine = new CompletableFuture<>();
    CompletableFuture<Void> existing = closeOutcome.compareAndExchange(null, mine);
    if (existing == null) {
      try {
        shutdown();
        mine.complete(null);
      } catch (ForwarderException | RuntimeException ex) {
        mine.completeExceptionally(ex);
      }
      await(mine);
    } else {
      await(existing);
    }
  }

  private void shutdown() throws ForwarderException {
    ForwarderException syncFailure = null;
    try {
      logger.sync();
    } catch (ForwarderException ex) {
      syncFailure = ex;
    }
    try {
      sink.flushAndClose(config.shutdownTimeout());
    } catch (ForwarderException ex) {
      if (syncFailure == null) {
        throw ex;
      }
      log.warn("Transport shutdown also failed after logger sync error: {}", ex.getMessage(), ex);
      syncFailure.addSuppressed(ex);
    }
    if (syncFailure != null) {
      throw syncFailure;
    }
    log.info("Log forwarder for tag {} closed", config.routingTag());
  }

  private static void await(CompletableFuture<Void> outcome) throws ForwarderException {
    try {
      outcome.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ForwarderException fe) {
        throw fe;
      }
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      throw ex;
    }
  }

  /** Builds the sink that sits on top of a freshly created transport. */
  @FunctionalInterface
  interface SinkFactory {
    RecordSink create(String tag, TransportClient transport, ClockPort clock, MetricsPort metrics);
  }

  private static void closeAfterFailedStart(TransportClient transport, RuntimeException failure) {
    try {
      transport.close();
    } catch (IOException | RuntimeException closeFailure) {
      failure.addSuppressed(closeFailure);
      log.warn("Failed to release transport after startup failure", closeFailure);
    }
  }
}
