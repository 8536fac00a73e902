package ca.gc.cra.logship.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void forwarderSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("logship.yaml");
    Files.writeString(yaml, """
        common:
          logLevel: info
          tag: shared.logs
        forwarder:
          tag: app.logs
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml);

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("info", map.get("logLevel"));
    assertEquals("app.logs", map.get("tag"));
  }

  @Test
  void nestedMapsFlattenToDottedKeys() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        forwarder:
          transport:
            host: fluentd
            port: 24224
            async: true
            socketPath:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("fluentd", map.get(ConfigKeys.HOST));
    assertEquals("24224", map.get(ConfigKeys.PORT));
    assertEquals("true", map.get(ConfigKeys.ASYNC));
    assertEquals("", map.get(ConfigKeys.SOCKET_PATH));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml")).isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml).orElseThrow());
  }

  @Test
  void invalidStructureThrows() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - forwarder:
            tag: x
        """);
    Path lists = tempDir.resolve("lists.yaml");
    Files.writeString(lists, """
        forwarder:
          tags: [a, b]
        """);
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "forwarder: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(lists));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken));
  }
}
