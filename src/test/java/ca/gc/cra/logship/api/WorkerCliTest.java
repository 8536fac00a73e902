package ca.gc.cra.logship.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logship.testutil.FakeTransportClient;
import ca.gc.cra.logship.testutil.LogCapture;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkerCliTest {
  @TempDir Path tempDir;

  private final FakeTransportClient transport = new FakeTransportClient();
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void workersLogThroughForwarderAndShutDown() {
    ExitCode code = WorkerCli.run(
        new String[] {"workers=2", "iterations=2", "interval=1ms", "tag=demo"}, Map.of(), config -> transport);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(4, transport.posted().size());
    for (FakeTransportClient.Posted posted : transport.posted()) {
      assertEquals("demo", posted.tag());
      assertEquals("log collected", posted.record().get("message"));
      assertEquals("worker", posted.record().get("logger"));
    }
    Set<Object> workers = transport.posted().stream()
        .map(posted -> posted.record().get("worker"))
        .collect(Collectors.toSet());
    assertEquals(Set.of(0, 1), workers);
    assertEquals(1, transport.closeCount());
  }

  @Test
  void levelFromEnvironmentFiltersWorkerRecords() {
    ExitCode code = WorkerCli.run(
        new String[] {"workers=1", "iterations=3", "interval=1ms"}, Map.of("LOG_LEVEL", "error"),
        config -> transport);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(transport.posted().isEmpty());
    assertEquals(1, transport.closeCount());
  }

  @Test
  void transportCloseFailureIsRuntimeFailure() {
    transport.failCloseWith(new java.io.IOException("ack lost"));

    ExitCode code = WorkerCli.run(
        new String[] {"workers=1", "iterations=1", "interval=1ms"}, Map.of(), config -> transport);

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
  }

  @Test
  void dryRunPrintsPlanWithoutOpeningTransport() {
    try (LogCapture capture = LogCapture.of(WorkerCli.class)) {
      ExitCode code = WorkerCli.run(
          new String[] {"tag=from-cli", "workers=3", "--dry-run"},
          Map.of("FLUENT_TAG", "from-env"),
          config -> {
            throw new AssertionError("dry run must not build a transport");
          });

      assertEquals(ExitCode.SUCCESS, code);
      assertTrue(capture.contains("CLI overrides environment for key: tag"));
    }
    String output = buffer.toString();
    assertTrue(output.contains("Worker dry-run"));
    assertTrue(output.contains("tag=from-cli"));
    assertTrue(output.contains("Workers    : 3"));
    assertTrue(output.contains("unbounded"));
  }

  @Test
  void yamlFileFeedsConfiguration() throws Exception {
    Path yamlFile = tempDir.resolve("logship.yaml");
    Files.writeString(yamlFile, "forwarder:\n  tag: from-yaml\n  transport:\n    port: 24300\n");

    ExitCode code = WorkerCli.run(new String[] {"config=" + yamlFile, "--dry-run"}, Map.of(), config -> transport);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("tag=from-yaml"));
    assertTrue(buffer.toString().contains("127.0.0.1:24300"));
  }

  @Test
  void malformedArgumentsReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        WorkerCli.run(new String[] {"workers"}, Map.of(), config -> transport));
    assertEquals(ExitCode.INVALID_ARGS,
        WorkerCli.run(new String[] {"workers=0"}, Map.of(), config -> transport));
    assertEquals(ExitCode.INVALID_ARGS,
        WorkerCli.run(new String[] {"interval=soon"}, Map.of(), config -> transport));
    assertTrue(buffer.toString().contains("usage: worker"));
  }

  @Test
  void invalidForwarderSettingsReturnConfigError() throws Exception {
    assertEquals(ExitCode.CONFIG_ERROR, WorkerCli.run(
        new String[] {"transport.network=carrier-pigeon", "--dry-run"}, Map.of(), config -> transport));
    assertEquals(ExitCode.CONFIG_ERROR, WorkerCli.run(
        new String[] {"--dry-run"}, Map.of("FLUENT_NETWORK", "unix"), config -> transport));

    Path listRoot = tempDir.resolve("list.yaml");
    Files.writeString(listRoot, "- not\n- a map\n");
    assertEquals(ExitCode.CONFIG_ERROR, WorkerCli.run(
        new String[] {"config=" + listRoot, "--dry-run"}, Map.of(), config -> transport));
  }

  @Test
  void missingConfigFileFallsBackToDefaults() {
    ExitCode code = WorkerCli.run(
        new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"}, Map.of(), config -> transport);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("tag=" + "app.logs"));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, WorkerCli.run(new String[] {"--help"}, Map.of(), config -> transport));
    assertTrue(buffer.toString().contains("logship worker"));
  }
}
