package ca.gc.cra.logship.application.port;

import ca.gc.cra.logship.domain.error.ForwarderException;
import java.time.Duration;

/**
 * <strong>What:</strong> Byte-oriented write endpoint that receives encoded log records from the structured logger.
 * <p><strong>Why:</strong> Separates the "what to log" facade from delivery so the facade stays a pure encoder.</p>
 * <p><strong>Role:</strong> Output port consumed by {@code StructuredLogger}; implemented by
 * {@code TransportSinkAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent writes and a concurrent close.</p>
 *
 * @since 0.1.0
 */
public interface RecordSink {
  /**
   * Accepts one encoded record.
   *
   * @param encoded a complete record; never {@code null}
   * @return number of bytes consumed, always {@code encoded.length} on success
   * @throws ForwarderException if the sink is closed, the record cannot be decoded, or delivery fails
   */
  int write(byte[] encoded) throws ForwarderException;

  /**
   * Pushes any buffered records towards the collector.
   *
   * @throws ForwarderException if the sink is closed or the flush fails
   */
  default void flush() throws ForwarderException {}

  /**
   * Closes the sink, waiting at most {@code timeout} for the underlying close to finish.
   *
   * <p>Idempotent: only the first call performs the close; later calls succeed immediately.</p>
   *
   * @param timeout upper bound on the wait; must be positive
   * @throws ForwarderException if the close fails or does not complete in time
   */
  void flushAndClose(Duration timeout) throws ForwarderException;

  /**
   * Reports whether shutdown has begun.
   *
   * @return {@code true} once {@link #flushAndClose(Duration)} has been invoked
   */
  boolean isClosed();
}
