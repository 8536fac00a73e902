package ca.gc.cra.logship.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logship.application.port.TransportClient;
import ca.gc.cra.logship.config.EnvironmentConfigLoader;
import ca.gc.cra.logship.config.ForwarderConfig;
import ca.gc.cra.logship.config.Network;
import ca.gc.cra.logship.config.TransportConfig;
import ca.gc.cra.logship.domain.error.TransportInitException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class FluencyTransportFactoryTest {
  private final FluencyTransportFactory factory = new FluencyTransportFactory();

  @Test
  void resolvesKnownNetworksInAnyCase() throws TransportInitException {
    assertEquals(Network.TCP, FluencyTransportFactory.resolveNetwork("tcp"));
    assertEquals(Network.TLS, FluencyTransportFactory.resolveNetwork("TLS"));
    assertEquals(Network.UNIX, FluencyTransportFactory.resolveNetwork(" unix "));
  }

  @Test
  void rejectsUnknownNetwork() {
    TransportInitException ex = assertThrows(TransportInitException.class,
        () -> factory.create(TransportConfig.builder().network("carrier-pigeon").build()));

    assertTrue(ex.getMessage().contains("unsupported transport network: carrier-pigeon"));
  }

  @Test
  void unixRequiresSocketPath() {
    TransportInitException ex = assertThrows(TransportInitException.class,
        () -> factory.create(TransportConfig.builder().network("unix").build()));

    assertTrue(ex.getMessage().contains("socket path"));
  }

  @Test
  void rejectsInvalidEndpoint() {
    assertThrows(TransportInitException.class,
        () -> factory.create(TransportConfig.builder().host("bad host!").build()));
    assertThrows(TransportInitException.class,
        () -> factory.create(TransportConfig.builder().port(0).build()));
  }

  @Test
  void buildsClientFromLibraryDefaults() throws Exception {
    buildAndClose(TransportConfig.defaults());
  }

  @Test
  void buildsClientFromEnvironmentDefaults() throws Exception {
    ForwarderConfig config = ForwarderConfig.fromMap(EnvironmentConfigLoader.defaults());

    assertEquals(8192, config.transport().bufferLimit());
    buildAndClose(config.transport());
  }

  @Test
  void buildsClientWithTinyBufferLimit() throws Exception {
    buildAndClose(TransportConfig.builder().bufferLimit(1024).build());
  }

  @Test
  void buildsClientWithForcedStopAndTls() throws Exception {
    buildAndClose(TransportConfig.builder().forceStopAsyncSend(true).maxRetry(0).build());
    buildAndClose(TransportConfig.builder().network("tls").requestAck(true).writeTimeout(Duration.ofSeconds(2))
        .asyncReconnectInterval(Duration.ofSeconds(5)).tagPrefix("prod").build());
  }

  @Test
  void bufferSizesKeepFluencyOrdering() {
    for (int limit : new int[] {1, 1024, 8192, 65_536, 1024 * 1024, 8 * 1024 * 1024, Integer.MAX_VALUE}) {
      FluencyTransportFactory.BufferSizes sizes = FluencyTransportFactory.bufferSizes(limit);

      assertTrue(sizes.chunkInitialSize() > 0, "initial for " + limit);
      assertTrue(sizes.chunkInitialSize() < sizes.chunkRetentionSize(), "retention for " + limit);
      assertTrue(sizes.chunkRetentionSize() < sizes.maxBufferSize(), "max for " + limit);
      assertTrue(sizes.maxBufferSize() >= Math.max(limit, FluencyTransportFactory.MIN_BUFFER_SIZE));
    }
    assertEquals(8L * 1024 * 1024, FluencyTransportFactory.bufferSizes(8 * 1024 * 1024).maxBufferSize());
  }

  private void buildAndClose(TransportConfig config) throws TransportInitException, IOException {
    TransportClient client = factory.create(config);
    try {
      assertInstanceOf(FluencyTransportClient.class, client);
    } finally {
      client.close();
    }
  }

  @Test
  void prefixesTagsWithDot() {
    assertEquals("app.logs", FluencyTransportClient.effectiveTag("", "app.logs"));
    assertEquals("app.logs", FluencyTransportClient.effectiveTag(null, "app.logs"));
    assertEquals("prod.app.logs", FluencyTransportClient.effectiveTag("prod", "app.logs"));
  }
}
