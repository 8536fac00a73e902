package ca.gc.cra.logship.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logship.domain.error.ConfigException;
import ca.gc.cra.logship.domain.log.DurationEncoding;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ForwarderConfigTest {

  @Test
  void defaultsFillTagAndShutdownTimeout() {
    ForwarderConfig config = ForwarderConfig.defaults();

    assertEquals("app.logs", config.routingTag());
    assertEquals(Duration.ofSeconds(5), config.shutdownTimeout());
    assertNull(config.minLogLevel());
    assertEquals(DurationEncoding.STRING, config.durationEncoding());
    assertEquals("tcp", config.transport().network());
    assertEquals("127.0.0.1", config.transport().host());
    assertEquals(24224, config.transport().port());
  }

  @Test
  void blankTagAndZeroTimeoutResolveToDefaults() {
    ForwarderConfig config = ForwarderConfig.builder()
        .routingTag("  ")
        .shutdownTimeout(Duration.ZERO)
        .build();

    assertEquals(ForwarderConfig.DEFAULT_TAG, config.routingTag());
    assertEquals(ForwarderConfig.DEFAULT_SHUTDOWN_TIMEOUT, config.shutdownTimeout());
  }

  @Test
  void builderRejectsNegativeTimeoutAndMalformedTag() {
    assertThrows(IllegalArgumentException.class,
        () -> ForwarderConfig.builder().shutdownTimeout(Duration.ofSeconds(-1)).build());
    assertThrows(IllegalArgumentException.class,
        () -> ForwarderConfig.builder().routingTag("app logs").build());
  }

  @Test
  void fromMapParsesEveryKey() throws ConfigException {
    Map<String, String> values = Map.ofEntries(
        Map.entry(ConfigKeys.TAG, "billing.audit"),
        Map.entry(ConfigKeys.SHUTDOWN_TIMEOUT, "2s"),
        Map.entry(ConfigKeys.LOG_LEVEL, "WARNING"),
        Map.entry(ConfigKeys.DURATION_ENCODING, "seconds"),
        Map.entry(ConfigKeys.NETWORK, "TLS"),
        Map.entry(ConfigKeys.HOST, "collector.example"),
        Map.entry(ConfigKeys.PORT, "24225"),
        Map.entry(ConfigKeys.TIMEOUT, "10s"),
        Map.entry(ConfigKeys.WRITE_TIMEOUT, "PT1S"),
        Map.entry(ConfigKeys.BUFFER_LIMIT, "8192"),
        Map.entry(ConfigKeys.MAX_RETRY, "3"),
        Map.entry(ConfigKeys.RETRY_WAIT, "250"),
        Map.entry(ConfigKeys.ASYNC, "TRUE"),
        Map.entry(ConfigKeys.FORCE_STOP_ASYNC_SEND, "true"),
        Map.entry(ConfigKeys.SUB_SECOND_PRECISION, "true"),
        Map.entry(ConfigKeys.MARSHAL_AS_JSON, "false"),
        Map.entry(ConfigKeys.REQUEST_ACK, "true"),
        Map.entry(ConfigKeys.TLS_INSECURE_SKIP_VERIFY, ""),
        Map.entry(ConfigKeys.ASYNC_RECONNECT_INTERVAL, "2m"),
        Map.entry(ConfigKeys.TAG_PREFIX, "prod"));

    ForwarderConfig config = ForwarderConfig.fromMap(values);
    TransportConfig transport = config.transport();

    assertEquals("billing.audit", config.routingTag());
    assertEquals(Duration.ofSeconds(2), config.shutdownTimeout());
    assertEquals("WARNING", config.minLogLevel());
    assertEquals(DurationEncoding.SECONDS, config.durationEncoding());
    assertEquals("tls", transport.network());
    assertEquals("collector.example", transport.host());
    assertEquals(24225, transport.port());
    assertEquals(Duration.ofSeconds(10), transport.timeout());
    assertEquals(Duration.ofSeconds(1), transport.writeTimeout());
    assertEquals(8192, transport.bufferLimit());
    assertEquals(3, transport.maxRetry());
    assertEquals(Duration.ofMillis(250), transport.retryWait());
    assertTrue(transport.async());
    assertTrue(transport.forceStopAsyncSend());
    assertTrue(transport.subSecondPrecision());
    assertFalse(transport.marshalAsJson());
    assertTrue(transport.requestAck());
    assertFalse(transport.tlsInsecureSkipVerify());
    assertEquals(Duration.ofMinutes(2), transport.asyncReconnectInterval());
    assertEquals("prod", transport.tagPrefix());
  }

  @Test
  void fromMapRejectsUnknownNetwork() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.NETWORK, "carrier-pigeon")));
    assertTrue(ex.getMessage().contains("carrier-pigeon"), ex.getMessage());
  }

  @Test
  void fromMapRequiresSocketPathForUnix() {
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.NETWORK, "unix")));
  }

  @Test
  void fromMapAcceptsUnixSocket() throws ConfigException {
    ForwarderConfig config = ForwarderConfig.fromMap(Map.of(
        ConfigKeys.NETWORK, "unix",
        ConfigKeys.SOCKET_PATH, "/var/run/fluent.sock"));

    assertEquals("unix", config.transport().network());
    assertEquals("/var/run/fluent.sock", config.transport().socketPath());
  }

  @Test
  void fromMapRejectsInvalidScalars() {
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.ASYNC, "yes")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.PORT, "http")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.PORT, "0")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.TIMEOUT, "soon")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.BUFFER_LIMIT, "0")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.MAX_RETRY, "-1")));
    assertThrows(ConfigException.class, () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.TAG, "a b")));
    assertThrows(ConfigException.class,
        () -> ForwarderConfig.fromMap(Map.of(ConfigKeys.DURATION_ENCODING, "minutes")));
  }

  @Test
  void parseBooleanTreatsBlankAsFalse() {
    assertFalse(ForwarderConfig.parseBoolean("flag", null));
    assertFalse(ForwarderConfig.parseBoolean("flag", ""));
    assertTrue(ForwarderConfig.parseBoolean("flag", "True"));
    assertThrows(IllegalArgumentException.class, () -> ForwarderConfig.parseBoolean("flag", "1"));
  }

  @Test
  void transportConfigRejectsOutOfRangeSettings() {
    assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder().bufferLimit(0).build());
    assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder().maxRetry(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> TransportConfig.builder().retryWait(Duration.ofMillis(-1)).build());
    assertThrows(IllegalArgumentException.class,
        () -> TransportConfig.builder().timeout(Duration.ofSeconds(-3)).build());
  }

  @Test
  void transportConfigDefaults() {
    TransportConfig defaults = TransportConfig.defaults();

    assertEquals("tcp", defaults.network());
    assertEquals("127.0.0.1", defaults.host());
    assertEquals(24224, defaults.port());
    assertEquals(TransportConfig.DEFAULT_TIMEOUT, defaults.timeout());
    assertEquals(8 * 1024 * 1024, defaults.bufferLimit());
    assertFalse(defaults.async());
    assertEquals("", defaults.tagPrefix());
  }
}
