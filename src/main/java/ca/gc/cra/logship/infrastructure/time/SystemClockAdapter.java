package ca.gc.cra.logship.infrastructure.time;

import ca.gc.cra.logship.application.port.ClockPort;
import java.time.Instant;

/**
 * {@link ClockPort} implementation backed by the system UTC clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current instant.
   *
   * @return current instant with the best precision the platform offers
   * @implNote Delegates to {@link Instant#now()} without smoothing.
   */
  @Override
  public Instant now() {
    return Instant.now();
  }
}
