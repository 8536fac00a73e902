package ca.gc.cra.logship.infrastructure.transport;

import ca.gc.cra.logship.application.port.TransportClient;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.komamitsu.fluency.EventTime;
import org.komamitsu.fluency.Fluency;

/**
 * {@link TransportClient} backed by a Fluency forward-protocol client.
 *
 * <p>Fluency buffers and retries on its own flusher thread. In synchronous mode every post is followed by a
 * {@link Fluency#flush()} request so records leave the buffer without waiting for the flush interval.</p>
 *
 * @implNote {@link Fluency#flush()} hands buffered chunks to the flusher thread and returns; it does not wait for
 *     the network write. A synchronous post therefore never blocks on collector I/O and does not report send
 *     failures, which surface through Fluency's retry logging and at {@link #close()}.
 * @since 0.1.0
 */
public final class FluencyTransportClient implements TransportClient {
  private final Fluency fluency;
  private final String tagPrefix;
  private final boolean async;
  private final boolean subSecondPrecision;

  /**
   * Wraps a built Fluency client.
   *
   * @param fluency client; closed by {@link #close()}
   * @param tagPrefix prefix joined to every tag with a dot; empty for none
   * @param async {@code true} to leave flushing to Fluency's flusher thread
   * @param subSecondPrecision {@code true} to send nanosecond event times
   */
  public FluencyTransportClient(Fluency fluency, String tagPrefix, boolean async, boolean subSecondPrecision) {
    this.fluency = Objects.requireNonNull(fluency, "fluency");
    this.tagPrefix = tagPrefix == null ? "" : tagPrefix;
    this.async = async;
    this.subSecondPrecision = subSecondPrecision;
  }

  @Override
  public void postWithTime(String tag, Instant time, Map<String, Object> record) throws IOException {
    String effectiveTag = effectiveTag(tagPrefix, tag);
    if (subSecondPrecision) {
      fluency.emit(effectiveTag, EventTime.fromEpoch(time.getEpochSecond(), time.getNano()), record);
    } else {
      fluency.emit(effectiveTag, time.getEpochSecond(), record);
    }
    if (!async) {
      fluency.flush();
    }
  }

  @Override
  public void flush() throws IOException {
    fluency.flush();
  }

  @Override
  public void close() throws IOException {
    fluency.close();
  }

  static String effectiveTag(String prefix, String tag) {
    return prefix == null || prefix.isEmpty() ? tag : prefix + '.' + tag;
  }
}
