package ca.gc.cra.logship.application.logging;

import ca.gc.cra.logship.application.port.ClockPort;
import ca.gc.cra.logship.application.port.MetricsPort;
import ca.gc.cra.logship.application.port.RecordSink;
import ca.gc.cra.logship.domain.error.ForwarderException;
import ca.gc.cra.logship.domain.error.SinkClosedException;
import ca.gc.cra.logship.domain.log.LogLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Leveled, structured logging facade that encodes records and writes them to a
 * {@link RecordSink}.
 * <p><strong>Why:</strong> Application code logs messages with key/value fields; the facade filters by level,
 * applies the encoding policy, and isolates callers from delivery failures.</p>
 * <p><strong>Role:</strong> Application-layer facade owned by a {@code LogForwarder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject below-threshold calls before any encoding work.</li>
 *   <li>Pair alternating key/value arguments, dropping dangling or non-string keys.</li>
 *   <li>Swallow single-emission failures, counting them under {@code logger.emit.dropped}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; child loggers share the sink and encoder. Safe for concurrent
 * use from any number of threads.</p>
 *
 * @since 0.1.0
 */
public final class StructuredLogger {
  private static final Logger log = LoggerFactory.getLogger(StructuredLogger.class);
  private static final Object[] NO_FIELDS = new Object[0];

  private final LogLevel minLevel;
  private final RecordEncoder encoder;
  private final RecordSink sink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final String name;
  private final Map<String, Object> context;

  /**
   * Creates a root logger.
   *
   * @param minLevel lowest level that is emitted
   * @param encoder record encoder carrying the duration profile
   * @param sink destination of encoded records
   * @param clock source of record timestamps
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} when not needed
   */
  public StructuredLogger(
      LogLevel minLevel, RecordEncoder encoder, RecordSink sink, ClockPort clock, MetricsPort metrics) {
    this(
        Objects.requireNonNull(minLevel, "minLevel"),
        Objects.requireNonNull(encoder, "encoder"),
        Objects.requireNonNull(sink, "sink"),
        Objects.requireNonNull(clock, "clock"),
        Objects.requireNonNullElse(metrics, MetricsPort.NO_OP),
        null,
        Map.of());
  }

  private StructuredLogger(
      LogLevel minLevel,
      RecordEncoder encoder,
      RecordSink sink,
      ClockPort clock,
      MetricsPort metrics,
      String name,
      Map<String, Object> context) {
    this.minLevel = minLevel;
    this.encoder = encoder;
    this.sink = sink;
    this.clock = clock;
    this.metrics = metrics;
    this.name = name;
    this.context = context;
  }

  public void debug(String message, Object... keysAndValues) {
    log(LogLevel.DEBUG, message, keysAndValues);
  }

  public void info(String message, Object... keysAndValues) {
    log(LogLevel.INFO, message, keysAndValues);
  }

  public void warn(String message, Object... keysAndValues) {
    log(LogLevel.WARN, message, keysAndValues);
  }

  public void error(String message, Object... keysAndValues) {
    log(LogLevel.ERROR, message, keysAndValues);
  }

  /**
   * Emits one record when {@code level} passes the threshold.
   *
   * <p>Never throws for delivery problems: a closed sink, an undecodable record, or a transport failure drops
   * the record and is reported through SLF4J.</p>
   *
   * @param level record severity
   * @param message log message
   * @param keysAndValues alternating {@code String} keys and values
   */
  public void log(LogLevel level, String message, Object... keysAndValues) {
    if (!minLevel.permits(level)) {
      return;
    }
    Map<String, Object> fields = new LinkedHashMap<>(context);
    appendPairs(keysAndValues == null ? NO_FIELDS : keysAndValues, fields);
    try {
      byte[] encoded = encoder.encode(level, clock.now(), name, message, fields);
      sink.write(encoded);
    } catch (SinkClosedException ex) {
      metrics.increment("logger.emit.dropped");
      log.debug("Dropped {} record after sink close: {}", level.wireName(), message);
    } catch (ForwarderException ex) {
      metrics.increment("logger.emit.dropped");
      log.warn("Dropped {} record: {}", level.wireName(), ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      metrics.increment("logger.emit.dropped");
      log.warn("Dropped {} record after unexpected failure", level.wireName(), ex);
    }
  }

  /**
   * @param level candidate level
   * @return {@code true} when records at {@code level} would be emitted
   */
  public boolean isEnabled(LogLevel level) {
    return minLevel.permits(level);
  }

  /** @return threshold below which records are discarded */
  public LogLevel level() {
    return minLevel;
  }

  /** @return dot-joined logger name, or {@code null} for the root logger */
  public String name() {
    return name;
  }

  /**
   * Returns a child logger whose records carry {@code keysAndValues} ahead of per-call fields.
   *
   * @param keysAndValues alternating {@code String} keys and values
   * @return child logger sharing this logger's sink
   */
  public StructuredLogger with(Object... keysAndValues) {
    if (keysAndValues == null || keysAndValues.length == 0) {
      return this;
    }
    Map<String, Object> bound = new LinkedHashMap<>(context);
    appendPairs(keysAndValues, bound);
    return new StructuredLogger(
        minLevel, encoder, sink, clock, metrics, name, Collections.unmodifiableMap(bound));
  }

  /**
   * Returns a child logger whose records carry a {@code logger} field. Names nest with dots.
   *
   * @param childName name segment; blank returns this logger
   * @return named child logger
   */
  public StructuredLogger named(String childName) {
    if (childName == null || childName.isBlank()) {
      return this;
    }
    String joined = name == null ? childName.trim() : name + '.' + childName.trim();
    return new StructuredLogger(minLevel, encoder, sink, clock, metrics, joined, context);
  }

  /**
   * Flushes buffered records through the sink. Blocks until the sink reports completion.
   *
   * @throws ForwarderException when the sink is closed or its flush fails
   */
  public void sync() throws ForwarderException {
    sink.flush();
  }

  private void appendPairs(Object[] keysAndValues, Map<String, Object> target) {
    List<String> problems = null;
    int i = 0;
    for (; i + 1 < keysAndValues.length; i += 2) {
      Object key = keysAndValues[i];
      if (!(key instanceof String stringKey)) {
        problems = note(problems, "non-string key " + key);
        continue;
      }
      if (RecordEncoder.RESERVED_KEYS.contains(stringKey)) {
        problems = note(problems, "reserved key " + stringKey);
        continue;
      }
      target.put(stringKey, keysAndValues[i + 1]);
    }
    if (i < keysAndValues.length) {
      problems = note(problems, "dangling key " + keysAndValues[i]);
    }
    if (problems != null) {
      metrics.increment("logger.fields.dropped");
      log.warn("Ignored malformed log fields: {}", problems);
    }
  }

  private static List<String> note(List<String> problems, String problem) {
    List<String> list = problems == null ? new ArrayList<>(2) : problems;
    list.add(problem);
    return list;
  }
}
