/**
 * Structured logging facade: level filtering, record encoding, and record decoding.
 * <p><strong>Role:</strong> Application layer between callers and the {@code RecordSink} port.</p>
 * <p><strong>Concurrency:</strong> All types are immutable or stateless and safe to share across threads.</p>
 * <p><strong>Metrics:</strong> {@code logger.emit.dropped}, {@code logger.fields.dropped}.</p>
 */
package ca.gc.cra.logship.application.logging;
