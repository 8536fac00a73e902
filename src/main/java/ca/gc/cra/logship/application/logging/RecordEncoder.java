package ca.gc.cra.logship.application.logging;

import ca.gc.cra.logship.domain.log.DurationEncoding;
import ca.gc.cra.logship.domain.log.LogLevel;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Serializes one log call into a single-line JSON record.
 * <p><strong>Why:</strong> The sink consumes an opaque byte stream; the encoder fixes the field layout and the
 * value encoding policy so every record a forwarder emits looks the same.</p>
 * <p><strong>Role:</strong> Encoding policy of the structured logger facade.</p>
 * <p><strong>Layout:</strong> {@code severity}, {@code timestamp}, {@code logger} (only when named),
 * {@code message}, then caller fields in insertion order; terminated by a newline.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent
 * use.</p>
 *
 * @since 0.1.0
 */
public final class RecordEncoder {
  /** Severity field name. */
  public static final String SEVERITY_KEY = "severity";
  /** Timestamp field name. */
  public static final String TIMESTAMP_KEY = "timestamp";
  /** Logger-name field name. */
  public static final String LOGGER_KEY = "logger";
  /** Message field name. */
  public static final String MESSAGE_KEY = "message";
  /** Field names the encoder writes itself; caller fields may not reuse them. */
  public static final Set<String> RESERVED_KEYS = Set.of(SEVERITY_KEY, TIMESTAMP_KEY, LOGGER_KEY, MESSAGE_KEY);

  static final int MAX_DEPTH = 32;
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

  private final JsonFactory factory = new JsonFactory();
  private final DurationEncoding durationEncoding;

  /**
   * Creates an encoder.
   *
   * @param durationEncoding profile applied to every {@link Duration} field
   */
  public RecordEncoder(DurationEncoding durationEncoding) {
    this.durationEncoding = Objects.requireNonNull(durationEncoding, "durationEncoding");
  }

  /** @return duration profile this encoder applies */
  public DurationEncoding durationEncoding() {
    return durationEncoding;
  }

  /**
   * Encodes one record.
   *
   * @param level record severity
   * @param time record timestamp
   * @param loggerName dot-joined logger name, or {@code null} for the root logger
   * @param message log message; {@code null} is written as an empty string
   * @param fields caller fields in emission order
   * @return UTF-8 JSON object followed by {@code '\n'}
   */
  public byte[] encode(LogLevel level, Instant time, String loggerName, String message, Map<String, Object> fields) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField(SEVERITY_KEY, level.wireName());
      generator.writeStringField(TIMESTAMP_KEY, formatTimestamp(time));
      if (loggerName != null && !loggerName.isEmpty()) {
        generator.writeStringField(LOGGER_KEY, loggerName);
      }
      generator.writeStringField(MESSAGE_KEY, message == null ? "" : message);
      for (Map.Entry<String, Object> field : fields.entrySet()) {
        generator.writeFieldName(field.getKey());
        writeValue(generator, field.getValue(), 0);
      }
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode log record", ex);
    }
    out.write('\n');
    return out.toByteArray();
  }

  /**
   * Formats an instant as ISO-8601 UTC with nine fractional digits.
   *
   * @param time instant to format
   * @return text such as {@code 2024-05-01T12:00:00.000000000Z}
   */
  public static String formatTimestamp(Instant time) {
    return TIMESTAMP_FORMAT.format(time);
  }

  private void writeValue(JsonGenerator generator, Object value, int depth) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String s) {
      generator.writeString(s);
    } else if (value instanceof Boolean b) {
      generator.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal big) {
      generator.writeNumber(big.toPlainString());
    } else if (value instanceof Double d) {
      generator.writeNumber(d);
    } else if (value instanceof Float f) {
      generator.writeNumber(f);
    } else if (value instanceof Duration duration) {
      writeDuration(generator, duration);
    } else if (value instanceof Instant instant) {
      generator.writeString(formatTimestamp(instant));
    } else if (value instanceof Enum<?> e) {
      generator.writeString(e.name());
    } else if (value instanceof Throwable t) {
      generator.writeString(t.toString());
    } else if (depth >= MAX_DEPTH) {
      generator.writeString(value.getClass().getName() + "(depth limit)");
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue(), depth + 1);
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> iterable) {
      generator.writeStartArray();
      for (Object element : iterable) {
        writeValue(generator, element, depth + 1);
      }
      generator.writeEndArray();
    } else if (value instanceof Object[] array) {
      generator.writeStartArray();
      for (Object element : array) {
        writeValue(generator, element, depth + 1);
      }
      generator.writeEndArray();
    } else if (value instanceof int[] ints) {
      generator.writeArray(ints, 0, ints.length);
    } else if (value instanceof long[] longs) {
      generator.writeArray(longs, 0, longs.length);
    } else if (value instanceof double[] doubles) {
      generator.writeArray(doubles, 0, doubles.length);
    } else if (value instanceof byte[] bytes) {
      generator.writeBinary(bytes);
    } else if (value instanceof char[] chars) {
      generator.writeString(chars, 0, chars.length);
    } else if (value instanceof boolean[] flags) {
      generator.writeStartArray();
      for (boolean flag : flags) {
        generator.writeBoolean(flag);
      }
      generator.writeEndArray();
    } else if (value instanceof short[] shorts) {
      generator.writeStartArray();
      for (short number : shorts) {
        generator.writeNumber(number);
      }
      generator.writeEndArray();
    } else if (value instanceof float[] floats) {
      generator.writeStartArray();
      for (float number : floats) {
        generator.writeNumber(number);
      }
      generator.writeEndArray();
    } else {
      generator.writeString(String.valueOf(value));
    }
  }

  private void writeDuration(JsonGenerator generator, Duration duration) throws IOException {
    switch (durationEncoding) {
      case SECONDS -> generator.writeNumber(toSeconds(duration).toPlainString());
      case STRING -> generator.writeString(duration.toString());
      default -> throw new IllegalStateException("Unhandled duration encoding " + durationEncoding);
    }
  }

  static BigDecimal toSeconds(Duration duration) {
    BigDecimal seconds = BigDecimal.valueOf(duration.getSeconds())
        .add(BigDecimal.valueOf(duration.getNano(), 9))
        .stripTrailingZeros();
    return seconds.scale() < 0 ? seconds.setScale(0) : seconds;
  }
}
