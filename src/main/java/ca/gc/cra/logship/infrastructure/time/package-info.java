/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Role:</strong> Adapter layer providing concrete time sources.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Performance:</strong> One {@code Instant.now()} call per record.</p>
 */
package ca.gc.cra.logship.infrastructure.time;
