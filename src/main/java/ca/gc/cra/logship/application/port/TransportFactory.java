package ca.gc.cra.logship.application.port;

import ca.gc.cra.logship.config.TransportConfig;
import ca.gc.cra.logship.domain.error.TransportInitException;

/**
 * Builds {@link TransportClient} instances from transport configuration.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportFactory {
  /**
   * Creates a transport client.
   *
   * @param config transport settings; never {@code null}
   * @return ready-to-use client
   * @throws TransportInitException if the network type is unknown, required settings are missing, or the
   *     underlying library refuses the configuration
   */
  TransportClient create(TransportConfig config) throws TransportInitException;
}
