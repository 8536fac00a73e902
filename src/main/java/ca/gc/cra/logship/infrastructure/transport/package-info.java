/**
 * Forward-protocol transport adapters backed by Fluency.
 * <p><strong>Role:</strong> Adapter layer implementing {@code TransportClient} and {@code TransportFactory}.</p>
 * <p><strong>Concurrency:</strong> Fluency clients are thread-safe; posts from many threads share one client.</p>
 */
package ca.gc.cra.logship.infrastructure.transport;
