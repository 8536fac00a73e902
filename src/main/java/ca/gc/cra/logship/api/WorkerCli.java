package ca.gc.cra.logship.api;

import ca.gc.cra.logship.application.forwarder.LogForwarder;
import ca.gc.cra.logship.application.logging.StructuredLogger;
import ca.gc.cra.logship.application.port.MetricsPort;
import ca.gc.cra.logship.application.port.TransportFactory;
import ca.gc.cra.logship.config.ConfigMerger;
import ca.gc.cra.logship.config.EnvironmentConfigLoader;
import ca.gc.cra.logship.config.ForwarderConfig;
import ca.gc.cra.logship.config.YamlConfigLoader;
import ca.gc.cra.logship.domain.error.ConfigException;
import ca.gc.cra.logship.domain.error.ForwarderException;
import ca.gc.cra.logship.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logship.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logship.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.logship.infrastructure.transport.FluencyTransportFactory;
import ca.gc.cra.logship.logging.LoggingConfigurator;
import ca.gc.cra.logship.validation.Durations;
import ca.gc.cra.logship.validation.Numbers;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo driver: runs a pool of workers that log through one {@link LogForwarder} and shuts it down on every exit
 * path, including SIGINT.
 *
 * @since 0.1.0
 */
public final class WorkerCli {
  private static final Logger log = LoggerFactory.getLogger(WorkerCli.class);
  static final int DEFAULT_WORKERS = 10;
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
  private static final String CONFIG = "config";
  private static final String WORKERS = "workers";
  private static final String INTERVAL = "interval";
  private static final String ITERATIONS = "iterations";
  private static final String SUMMARY_USAGE =
      "usage: worker [config=PATH] [workers=N] [interval=DURATION] [iterations=N] [KEY=VALUE...] "
          + "[--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      logship worker

      Usage:
        worker [options] [forwarder overrides]

      Options:
        config=PATH          Optional YAML file with common/forwarder sections
        workers=N            Number of logging workers (default 10)
        interval=DURATION    Pause between records per worker, e.g. 500ms, 10s, PT1M (default 10s)
        iterations=N         Records per worker; 0 runs until interrupted (default 0)
        --dry-run            Print the effective configuration and exit
        --verbose            Enable DEBUG logging
        --help               Show this message

      Forwarder overrides:
        tag, logLevel, shutdownTimeout, durationEncoding, transport.* keys.
        Precedence: command line > FLUENT_* / LOG_* environment > YAML > defaults.
      """;

  private WorkerCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the worker command against the process environment and the Fluency transport.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, System.getenv(), new FluencyTransportFactory());
  }

  static ExitCode run(String[] args, Map<String, String> env, TransportFactory transports) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for worker CLI");
    }

    Map<String, String> overrides;
    WorkerPlan plan;
    try {
      overrides = new LinkedHashMap<>(CliArgsParser.toMap(input.arguments()));
      plan = WorkerPlan.extract(overrides);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ForwarderConfig config;
    try {
      Optional<Map<String, String>> yaml =
          plan.configPath() == null ? Optional.empty() : YamlConfigLoader.load(plan.configPath());
      if (plan.configPath() != null && yaml.isEmpty()) {
        log.warn("Config file {} not found; continuing with environment and defaults", plan.configPath());
      }
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          EnvironmentConfigLoader.defaults(),
          yaml,
          EnvironmentConfigLoader.toKeys(env),
          overrides,
          log::warn);
      config = ForwarderConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read config file {}", plan.configPath(), ex);
      return ExitCode.IO_ERROR;
    } catch (ConfigException | IllegalArgumentException ex) {
      log.error("Invalid forwarder configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.println(
          "Worker dry-run: no records will be sent.",
          " Forwarder  : " + config,
          " Workers    : " + plan.workers(),
          " Interval   : " + plan.interval(),
          " Iterations : " + (plan.iterations() == 0 ? "unbounded" : plan.iterations()));
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(env)) {
      return runWorkers(config, plan, transports, metrics);
    }
  }

  private static ExitCode runWorkers(
      ForwarderConfig config, WorkerPlan plan, TransportFactory transports, MetricsPort metrics) {
    LogForwarder forwarder;
    try {
      forwarder = LogForwarder.create(config, transports, metrics, new SystemClockAdapter());
    } catch (ConfigException ex) {
      log.error("Unable to start log forwarder: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }

    Thread hook = new Thread(() -> LogForwarder.closeQuietly(forwarder), "logship-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    ExecutorService pool = ExecutorFactories.newWorkerPool(plan.workers(), "logship-worker",
        (t, ex) -> log.error("Worker thread {} terminated unexpectedly", t.getName(), ex));
    ExitCode exit = ExitCode.SUCCESS;
    try {
      StructuredLogger logger = forwarder.logger().named("worker");
      for (int i = 0; i < plan.workers(); i++) {
        pool.execute(new Worker(i, logger.with("worker", i), plan.interval(), plan.iterations()));
      }
      pool.shutdown();
      while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
        log.debug("Workers still running");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Worker CLI interrupted; stopping workers");
      pool.shutdownNow();
      exit = ExitCode.INTERRUPTED;
    } finally {
      try {
        forwarder.close();
      } catch (ForwarderException ex) {
        log.error("Log forwarder shutdown failed: {}", ex.getMessage(), ex);
        if (exit == ExitCode.SUCCESS) {
          exit = ExitCode.RUNTIME_FAILURE;
        }
      }
      removeHook(hook);
    }
    return exit;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown already in progress; hook stays registered");
    }
  }

  /**
   * One logging worker. A failing iteration is logged and the worker continues.
   */
  static final class Worker implements Runnable {
    private final int id;
    private final StructuredLogger logger;
    private final Duration interval;
    private final long iterations;

    Worker(int id, StructuredLogger logger, Duration interval, long iterations) {
      this.id = id;
      this.logger = logger;
      this.interval = interval;
      this.iterations = iterations;
    }

    @Override
    public void run() {
      for (long i = 0; iterations == 0 || i < iterations; i++) {
        try {
          logger.info("log collected", "iteration", i);
        } catch (RuntimeException ex) {
          logger.error("worker iteration failed", "iteration", i, "error", ex);
        }
        if (iterations != 0 && i + 1 >= iterations) {
          break;
        }
        try {
          Thread.sleep(interval.toMillis());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.debug("Worker {} interrupted", id);
          return;
        }
      }
    }
  }

  record WorkerPlan(Path configPath, int workers, Duration interval, long iterations) {
    /**
     * Removes worker options from {@code args}, leaving forwarder overrides behind.
     */
    static WorkerPlan extract(Map<String, String> args) {
      String config = args.remove(CONFIG);
      String workers = args.remove(WORKERS);
      String interval = args.remove(INTERVAL);
      String iterations = args.remove(ITERATIONS);
      return new WorkerPlan(
          config == null || config.isBlank() ? null : Path.of(config),
          workers == null ? DEFAULT_WORKERS : Numbers.parseInt(WORKERS, workers, 1, 1024),
          interval == null ? DEFAULT_INTERVAL : Durations.parse(INTERVAL, interval),
          iterations == null ? 0 : Numbers.parseInt(ITERATIONS, iterations, 0, Integer.MAX_VALUE));
    }
  }
}
