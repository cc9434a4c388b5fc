package ai.drivewise.risk.api;

import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.application.schedule.JobScheduler;
import ai.drivewise.risk.config.CompositionRoot;
import ai.drivewise.risk.config.EngineConfig;
import ai.drivewise.risk.config.JobPlan;
import ai.drivewise.risk.config.SinkType;
import ai.drivewise.risk.logging.LoggingConfigurator;
import ai.drivewise.risk.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the long-running ingestion engine: builds the composition root, starts the job scheduler and
 * blocks until the JVM is asked to stop.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  /** Slack on top of the call timeout for an interrupted sweep to write what it already collected. */
  private static final Duration DRAIN_MARGIN = Duration.ofSeconds(5);
  private static final String SUMMARY_USAGE =
      "usage: drivewise run [config=PATH] [tomtomApiKey=KEY] [sink=ndjson|kafka|none] [sink.dir=PATH] "
          + "[kafkaBootstrap=HOST:PORT] [regions=NAME:LAT,LON;...] [vehicles=YEAR:MAKE:MODEL;...] "
          + "[--dry-run] [metricsExporter=otlp|logging|none]";
  private static final String HELP_TEXT = """
      DriveWise ingestion engine

      Usage:
        drivewise run [options]

      Options (key=value; YAML keys use the same dotted names):
        config=PATH                  YAML file with common/run sections
        tomtomApiKey=KEY             TomTom key (or TOMTOM_API_KEY); without it traffic and full-pipeline jobs are disabled
        tomtomBaseUrl=URL            TomTom traffic API base (default https://api.tomtom.com/traffic)
        nhtsaBaseUrl=URL             NHTSA ratings base (or NHTSA_BASE_URL)
        recallsBaseUrl=URL           NHTSA recalls base (default https://api.nhtsa.gov/recalls)
        regions=NAME:LAT,LON;...     Sweep regions (default ten US cities)
        vehicles=Y:MAKE:MODEL[:VIN]  Vehicle worklist, ';' separated; vin:VIN entries are decoded first
        grid.density=N               Grid steps per side (default 5)
        grid.radiusKm=KM             Grid radius (default 25)
        incidents.radiusKm=KM        Incident search radius (default 10)
        tomtom.minSpacingMs=MS       Minimum spacing between TomTom calls (default 1000)
        nhtsa.minSpacingMs=MS        Minimum spacing between NHTSA calls (default 500)
        batchSize=N                  Calls per batch before cooldown (default 100)
        batchCooldownMs=MS           Cooldown between batches (default 5000)
        parallelism=N                Concurrent calls per sweep (default 4)
        callTimeoutMs=MS             Per-call budget (default 20000)
        cadence.trafficSweep=ISO     Default PT15M (also vehicleSweep PT6H, modelRefresh PT1H, fullPipeline PT30M)
        sink=ndjson|kafka|none       Record sink (default ndjson)
        sink.dir=PATH                NDJSON directory (default ~/.drivewise/out)
        kafkaBootstrap=HOST:PORT     Required when sink=kafka (or KAFKA_BOOTSTRAP)
        kafka.topicPrefix=PREFIX     Topic prefix (default drivewise)
        shutdownGraceMs=MS           Grace period for running jobs on shutdown (default 30000)
        metricsExporter=otlp|logging|none  Metrics exporter (default otlp)
        otelEndpoint=URL             OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --dry-run                    Print the job plan and exit
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private RunCli() {}

  /**
   * Runs the engine until the JVM shuts down.
   *
   * @param args raw CLI arguments after the {@code run} token
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    if (input.command().isPresent()) {
      log.error("Unexpected argument: {}", input.command().get());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.resolveEffectiveConfig("run", kv, environment, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    EngineConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = EngineConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root;
    try {
      root = new CompositionRoot(config);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Unable to wire engine: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while wiring engine", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    return runUntilShutdown(root, config);
  }

  private static ExitCode runUntilShutdown(CompositionRoot root, EngineConfig config) {
    JobScheduler scheduler = root.scheduler();
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      try {
        shutdown(root, config);
      } finally {
        stopped.countDown();
      }
    }, "drivewise-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    log.info("DriveWise engine starting: {}", config);
    try {
      scheduler.start();
      stopped.await();
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Run CLI interrupted; shutting down");
      removeHook(hook);
      shutdown(root, config);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in engine", ex);
      removeHook(hook);
      shutdown(root, config);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void shutdown(CompositionRoot root, EngineConfig config) {
    boolean clean = root.scheduler().stop(config.shutdownGrace(), config.callTimeout().plus(DRAIN_MARGIN));
    try {
      root.close();
    } catch (SinkException ex) {
      log.error("Sink did not close cleanly", ex);
    }
    log.info("DriveWise engine stopped{}", clean ? "" : " after interrupting running jobs");
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("Shutdown already in progress", ex);
    }
  }

  private static void printDryRunPlan(EngineConfig config) {
    CliPrinter.printLines(
        "Run dry-run: no upstream calls will be made.",
        " TomTom key        : " + Logs.redact(config.tomtomApiKey().orElse(null)),
        " TomTom base       : " + config.tomtomBaseUrl(),
        " NHTSA base        : " + config.nhtsaBaseUrl(),
        " Regions           : " + config.regions().size(),
        " Vehicles          : " + config.vehicles().size(),
        " Sink              : " + config.sink()
            + (config.sink() == SinkType.NDJSON ? " (" + config.sinkDirectory() + ")" : ""),
        " Jobs:");
    for (JobPlan entry : JobPlan.of(config)) {
      CliPrinter.printf("  %-14s every %-8s %-8s %s",
          entry.kind().label(), entry.cadence(), entry.enabled() ? "enabled" : "disabled", entry.note());
    }
    CliPrinter.println(" Re-run without --dry-run to start the scheduler.");
  }
}
