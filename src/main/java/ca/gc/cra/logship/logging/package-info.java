/**
 * <strong>Purpose:</strong> Utilities for the forwarder's own SLF4J diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logship.logging;
