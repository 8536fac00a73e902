package ca.gc.cra.logship.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, environment, and CLI sources.
 *
 * <p>Precedence is CLI &gt; environment &gt; YAML &gt; defaults. Values are merged as raw strings; parsing is
 * left to {@link ForwarderConfig#fromMap(Map)}.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param defaults embedded defaults (may be {@code null})
   * @param yaml optional YAML-derived settings
   * @param env environment-derived settings, already translated to configuration keys (may be {@code null})
   * @param cli CLI key/value overrides (may be {@code null})
   * @param warn consumer invoked when a higher-precedence source overrides a lower one; may be {@code null}
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      Map<String, String> defaults,
      Optional<Map<String, String>> yaml,
      Map<String, String> env,
      Map<String, String> cli,
      Consumer<String> warn) {
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml.orElse(Map.of());
    Map<String, String> envCopy = env == null ? Map.of() : env;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    overlay(merged, envCopy, yamlCopy, "environment overrides YAML for key: ", warn);
    overlay(merged, cliCopy, envCopy, "CLI overrides environment for key: ", warn);

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void overlay(
      Map<String, String> merged,
      Map<String, String> overrides,
      Map<String, String> lower,
      String message,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : overrides.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (lower.containsKey(key) && warn != null) {
        warn.accept(message + key);
      }
      merged.put(key, value);
    }
  }

  private static void validate(Map<String, String> effective) {
    String network = trim(effective.get(ConfigKeys.NETWORK));
    if (Network.UNIX.label().equalsIgnoreCase(network) && trim(effective.get(ConfigKeys.SOCKET_PATH)).isEmpty()) {
      throw new IllegalArgumentException(ConfigKeys.SOCKET_PATH + " is required when network=unix");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
