/**
 * Record sink adapters bridging the logging facade to a transport client.
 * <p><strong>Concurrency:</strong> Close is guarded by a single compare-and-set; writes never block on it.</p>
 */
package ca.gc.cra.logship.infrastructure.sink;
