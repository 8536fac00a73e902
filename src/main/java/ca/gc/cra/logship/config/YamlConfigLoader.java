package ca.gc.cra.logship.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads forwarder configuration from a YAML document and flattens nested sections into dotted keys.
 *
 * <p>The {@code common} section is read first, then the {@code forwarder} section overrides it. Nested
 * mappings become dotted keys, so {@code transport: {host: x}} yields {@code transport.host=x}.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final String FORWARDER_SECTION = "forwarder";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return flat map of merged sections, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses a YAML document from {@code reader}.
   *
   * @param reader source document
   * @param origin description used in error messages
   * @return flat map of merged sections
   * @throws IllegalArgumentException when the YAML is malformed or sections are not mappings
   */
  static Map<String, String> parse(Reader reader, String origin) {
    try {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, COMMON_SECTION);
      if (common != null) {
        flatten(asMap(common, COMMON_SECTION), "", flattened);
      }
      Object forwarder = findSection(root, FORWARDER_SECTION);
      if (forwarder != null) {
        flatten(asMap(forwarder, FORWARDER_SECTION), "", flattened);
      }
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
