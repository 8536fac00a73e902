/**
 * <strong>Purpose:</strong> Ports connecting the structured logger to delivery, time, and metrics.
 * <p><strong>Pipeline role:</strong> facade -> {@link ca.gc.cra.logship.application.port.RecordSink} ->
 * {@link ca.gc.cra.logship.application.port.TransportClient} -> collector.
 * <p><strong>Concurrency:</strong> Every port is invoked from arbitrary application threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logship.application.port;
