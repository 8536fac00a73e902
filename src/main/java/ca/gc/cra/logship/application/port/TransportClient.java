package ca.gc.cra.logship.application.port;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * <strong>What:</strong> Output port delivering tagged, timestamped structured records to a remote log collector.
 * <p><strong>Why:</strong> Keeps the forwarder independent of the forward-protocol library so tests can substitute
 * a fake and deployments can swap transports.</p>
 * <p><strong>Role:</strong> Output port on the sink side; implemented by
 * {@code ca.gc.cra.logship.infrastructure.transport.FluencyTransportClient}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize and deliver records, applying its own buffering and retry policy.</li>
 *   <li>Drain buffered records on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent posts from many logging threads.</p>
 * <p><strong>Performance:</strong> Posts sit on the logging hot path; asynchronous implementations should return
 * once the record is queued.</p>
 *
 * @since 0.1.0
 * @see TransportFactory
 */
public interface TransportClient extends AutoCloseable {
  /**
   * Publishes one record under the supplied routing tag.
   *
   * @param tag routing key at the collector; never {@code null}
   * @param time event time attached to the record
   * @param record decoded record fields; the implementation must not mutate it
   * @throws IOException if the record cannot be queued or sent
   */
  void postWithTime(String tag, Instant time, Map<String, Object> record) throws IOException;

  /**
   * Requests delivery of buffered records.
   *
   * @throws IOException if the flush cannot be initiated
   */
  default void flush() throws IOException {}

  /**
   * Flushes remaining records and releases connections.
   *
   * <p>May block on network I/O; there is no cancellation primitive, so callers that need a deadline must
   * race this call rather than interrupt it.</p>
   *
   * @throws IOException if shutdown fails
   */
  @Override
  void close() throws IOException;
}
