package ca.gc.cra.logship.application.logging;

import ca.gc.cra.logship.domain.error.RecordDecodeException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses one encoded log record back into a structured map of maps, lists, and primitives.
 *
 * @since 0.1.0
 */
public final class JsonRecordDecoder {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Decodes a single JSON object.
   *
   * @param encoded UTF-8 JSON bytes; never {@code null}
   * @return mutable map preserving field order
   * @throws RecordDecodeException when the input is empty, malformed, not an object, or has trailing content
   */
  public Map<String, Object> decode(byte[] encoded) throws RecordDecodeException {
    Objects.requireNonNull(encoded, "encoded");
    try (JsonParser parser = factory.createParser(encoded)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new RecordDecodeException("log record is empty");
      }
      if (token != JsonToken.START_OBJECT) {
        throw new RecordDecodeException("log record must be a JSON object but starts with " + token);
      }
      Map<String, Object> record = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new RecordDecodeException("log record contains trailing content");
      }
      return record;
    } catch (IOException ex) {
      throw new RecordDecodeException("log record is not valid JSON", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IOException("Unexpected end of input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
