package ca.gc.cra.logship.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock instants to the encoder and sink.
 * <p><strong>Why:</strong> Record timestamps and event times must be deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on every logging
 * thread.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.logship.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock time, subject to system clock adjustments
   */
  Instant now();
}
