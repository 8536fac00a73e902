package ca.gc.cra.logship.config;

import ca.gc.cra.logship.domain.error.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Translates process environment variables into flattened forwarder configuration keys.
 *
 * <p>Only variables that are present are translated; {@link #defaults()} supplies the values used for
 * everything else. Parsing and validation happen in {@link ForwarderConfig#fromMap(Map)}, so an invalid
 * boolean, integer, duration, or network fails with a {@link ConfigException} instead of silently defaulting.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentConfigLoader {
  /** Environment variable to configuration key mapping, in documentation order. */
  static final Map<String, String> VARIABLES = variables();

  private EnvironmentConfigLoader() {}

  /**
   * Loads a forwarder configuration from the environment, applying {@link #defaults()} for unset variables.
   *
   * @param env environment snapshot, typically {@link System#getenv()}
   * @return parsed configuration
   * @throws ConfigException when a variable holds an invalid value
   */
  public static ForwarderConfig load(Map<String, String> env) throws ConfigException {
    Map<String, String> merged = new LinkedHashMap<>(defaults());
    merged.putAll(toKeys(env));
    return ForwarderConfig.fromMap(merged);
  }

  /**
   * Returns the configuration keys set by {@code env}, skipping variables that are absent.
   *
   * @param env environment snapshot; must not be {@code null}
   * @return flattened keys keyed by {@link ConfigKeys} names
   */
  public static Map<String, String> toKeys(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    Map<String, String> keys = new LinkedHashMap<>();
    for (Map.Entry<String, String> variable : VARIABLES.entrySet()) {
      String value = env.get(variable.getKey());
      if (value != null) {
        keys.put(variable.getValue(), value);
      }
    }
    return keys;
  }

  /**
   * Defaults applied when the environment is silent.
   *
   * @return immutable map of flattened keys
   */
  public static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put(ConfigKeys.NETWORK, Network.TCP.label());
    defaults.put(ConfigKeys.HOST, TransportConfig.DEFAULT_HOST);
    defaults.put(ConfigKeys.PORT, Integer.toString(TransportConfig.DEFAULT_PORT));
    defaults.put(ConfigKeys.TIMEOUT, "10s");
    defaults.put(ConfigKeys.BUFFER_LIMIT, "8192");
    defaults.put(ConfigKeys.RETRY_WAIT, "500");
    defaults.put(ConfigKeys.MAX_RETRY, Integer.toString(TransportConfig.DEFAULT_MAX_RETRY));
    defaults.put(ConfigKeys.ASYNC, "false");
    return Map.copyOf(defaults);
  }

  private static Map<String, String> variables() {
    Map<String, String> vars = new LinkedHashMap<>();
    vars.put("FLUENT_NETWORK", ConfigKeys.NETWORK);
    vars.put("FLUENT_HOST", ConfigKeys.HOST);
    vars.put("FLUENT_PORT", ConfigKeys.PORT);
    vars.put("FLUENT_SOCKET_PATH", ConfigKeys.SOCKET_PATH);
    vars.put("FLUENT_TIMEOUT", ConfigKeys.TIMEOUT);
    vars.put("FLUENT_WRITE_TIMEOUT", ConfigKeys.WRITE_TIMEOUT);
    vars.put("FLUENT_BUFFER_LIMIT", ConfigKeys.BUFFER_LIMIT);
    vars.put("FLUENT_MAX_RETRY", ConfigKeys.MAX_RETRY);
    vars.put("FLUENT_RETRY_WAIT", ConfigKeys.RETRY_WAIT);
    vars.put("FLUENT_ASYNC", ConfigKeys.ASYNC);
    vars.put("FLUENT_FORCE_STOP_ASYNC_SEND", ConfigKeys.FORCE_STOP_ASYNC_SEND);
    vars.put("FLUENT_SUB_SECOND_PRECISION", ConfigKeys.SUB_SECOND_PRECISION);
    vars.put("FLUENT_MARSHAL_AS_JSON", ConfigKeys.MARSHAL_AS_JSON);
    vars.put("FLUENT_REQUEST_ACK", ConfigKeys.REQUEST_ACK);
    vars.put("FLUENT_TLS_INSECURE_SKIP_VERIFY", ConfigKeys.TLS_INSECURE_SKIP_VERIFY);
    vars.put("FLUENT_ASYNC_RECONNECT_INTERVAL", ConfigKeys.ASYNC_RECONNECT_INTERVAL);
    vars.put("FLUENT_TAG_PREFIX", ConfigKeys.TAG_PREFIX);
    vars.put("FLUENT_TAG", ConfigKeys.TAG);
    vars.put("LOG_LEVEL", ConfigKeys.LOG_LEVEL);
    vars.put("LOG_SHUTDOWN_TIMEOUT", ConfigKeys.SHUTDOWN_TIMEOUT);
    vars.put("LOG_DURATION_ENCODING", ConfigKeys.DURATION_ENCODING);
    return Collections.unmodifiableMap(vars);
  }
}
