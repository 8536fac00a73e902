package ca.gc.cra.logship.infrastructure.sink;

import ca.gc.cra.logship.application.logging.JsonRecordDecoder;
import ca.gc.cra.logship.application.port.ClockPort;
import ca.gc.cra.logship.application.port.MetricsPort;
import ca.gc.cra.logship.application.port.RecordSink;
import ca.gc.cra.logship.application.port.TransportClient;
import ca.gc.cra.logship.domain.error.DeliveryException;
import ca.gc.cra.logship.domain.error.FlushTimeoutException;
import ca.gc.cra.logship.domain.error.ForwarderException;
import ca.gc.cra.logship.domain.error.RecordDecodeException;
import ca.gc.cra.logship.domain.error.SinkClosedException;
import ca.gc.cra.logship.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logship.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RecordSink} that decodes encoded records and posts them to a {@link TransportClient}.
 * <p><strong>Why:</strong> The logging facade produces bytes; the transport wants tagged, timestamped maps.</p>
 * <p><strong>Role:</strong> Adapter between the facade and the collector transport; owns the open/closed state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject writes once closed, decode records, and post them under the routing tag.</li>
 *   <li>Close the transport at most once, waiting no longer than the supplied deadline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Writes from many threads share only a single {@link AtomicBoolean}; the
 * network call itself is not serialized here.</p>
 * <p><strong>Metrics:</strong> {@code sink.write.accepted}, {@code sink.write.rejected.closed},
 * {@code sink.write.decodeFailed}, {@code sink.write.deliveryFailed}, {@code sink.close.timeout},
 * {@code sink.close.failed}, {@code sink.close.latencyMillis}.</p>
 *
 * @implNote A write that read the flag before the close won the CAS may still reach the transport while it
 *     closes; the transport decides whether to accept it.
 * @since 0.1.0
 */
public final class TransportSinkAdapter implements RecordSink {
  private static final Logger log = LoggerFactory.getLogger(TransportSinkAdapter.class);

  private final String tag;
  private final TransportClient transport;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ThreadFactory closeThreads;
  private final JsonRecordDecoder decoder = new JsonRecordDecoder();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a sink posting under {@code tag}.
   *
   * @param tag routing tag for every record
   * @param transport open transport client; closed by {@link #flushAndClose(Duration)}
   * @param clock source of event times
   * @param metrics metrics sink
   */
  public TransportSinkAdapter(String tag, TransportClient transport, ClockPort clock, MetricsPort metrics) {
    this(tag, transport, clock, metrics,
        ExecutorFactories.namedThreadFactory("logship-transport-close", true,
            (t, ex) -> log.error("Transport close thread {} failed", t.getName(), ex)));
  }

  TransportSinkAdapter(
      String tag, TransportClient transport, ClockPort clock, MetricsPort metrics, ThreadFactory closeThreads) {
    this.tag = Objects.requireNonNull(tag, "tag");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.closeThreads = Objects.requireNonNull(closeThreads, "closeThreads");
  }

  /**
   * Decodes one record and posts it to the transport.
   *
   * @param encoded one JSON object as produced by the facade
   * @return {@code encoded.length} on success
   * @throws SinkClosedException after {@link #flushAndClose(Duration)} has started
   * @throws RecordDecodeException when {@code encoded} is not a single JSON object
   * @throws DeliveryException when the transport rejects the record
   */
  @Override
  public int write(byte[] encoded) throws ForwarderException {
    if (closed.get()) {
      metrics.increment("sink.write.rejected.closed");
      throw new SinkClosedException();
    }
    if (encoded == null) {
      metrics.increment("sink.write.decodeFailed");
      throw new RecordDecodeException("log record is null");
    }
    Map<String, Object> record;
    try {
      record = decoder.decode(encoded);
    } catch (RecordDecodeException ex) {
      metrics.increment("sink.write.decodeFailed");
      log.debug("Rejected undecodable record {}", Logs.truncate(encoded, Logs.EXCERPT_BYTES));
      throw ex;
    }
    try {
      transport.postWithTime(tag, clock.now(), record);
    } catch (IOException | RuntimeException ex) {
      metrics.increment("sink.write.deliveryFailed");
      throw new DeliveryException("failed to post record with tag " + tag, ex);
    }
    metrics.increment("sink.write.accepted");
    return encoded.length;
  }

  /**
   * Asks the transport to flush buffered records.
   *
   * @throws SinkClosedException after close
   * @throws DeliveryException when the transport flush fails
   */
  @Override
  public void flush() throws ForwarderException {
    if (closed.get()) {
      throw new SinkClosedException();
    }
    try {
      transport.flush();
    } catch (IOException | RuntimeException ex) {
      throw new DeliveryException("failed to flush transport for tag " + tag, ex);
    }
  }

  /**
   * Marks the sink closed and closes the transport, waiting at most {@code timeout}.
   *
   * <p>Only the first caller performs the close; later callers return immediately. On timeout the close keeps
   * running on its daemon thread and its eventual outcome is logged.</p>
   *
   * @param timeout maximum wait for the transport to drain and close
   * @throws FlushTimeoutException when the transport did not close within {@code timeout}
   * @throws DeliveryException when the transport close failed
   * @throws ForwarderException when the calling thread is interrupted while waiting
   */
  @Override
  public void flushAndClose(Duration timeout) throws ForwarderException {
    Objects.requireNonNull(timeout, "timeout");
    if (!closed.compareAndSet(false, true)) {
      log.debug("Sink for tag {} already closed", tag);
      return;
    }
    long started = System.nanoTime();
    CompletableFuture<Void> closing = new CompletableFuture<>();
    Thread closer = closeThreads.newThread(() -> {
      try {
        transport.close();
        closing.complete(null);
      } catch (IOException | RuntimeException ex) {
        closing.completeExceptionally(ex);
      }
    });
    closer.start();
    try {
      closing.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
      metrics.observe("sink.close.latencyMillis", elapsedMillis);
      log.debug("Closed transport for tag {} in {} ms", tag, elapsedMillis);
    } catch (TimeoutException ex) {
      metrics.increment("sink.close.timeout");
      log.warn("Transport close for tag {} exceeded {} ms; continuing in background", tag, timeout.toMillis());
      closing.whenComplete((ignored, failure) -> {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (failure == null) {
          log.info("Background transport close for tag {} finished after {} ms", tag, elapsedMillis);
        } else {
          log.warn("Background transport close for tag {} failed after {} ms", tag, elapsedMillis, failure);
        }
      });
      throw new FlushTimeoutException(timeout);
    } catch (ExecutionException ex) {
      metrics.increment("sink.close.failed");
      throw new DeliveryException("failed to close transport for tag " + tag, ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ForwarderException("interrupted while closing transport for tag " + tag, ex);
    }
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  /** @return routing tag records are posted under */
  public String tag() {
    return tag;
  }
}
