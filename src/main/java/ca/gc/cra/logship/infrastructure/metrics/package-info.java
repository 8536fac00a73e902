/**
 * Metrics adapter bridging the forwarder's {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code sink.*} and {@code logger.*} namespaces.</p>
 */
package ca.gc.cra.logship.infrastructure.metrics;
