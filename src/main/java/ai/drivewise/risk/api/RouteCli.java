package ai.drivewise.risk.api;

import ai.drivewise.risk.application.pipeline.RouteTrafficUseCase;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.config.CompositionRoot;
import ai.drivewise.risk.config.EngineConfig;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import ai.drivewise.risk.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up live traffic along one route through TomTom routing and prints its summary.
 *
 * @since 0.1.0
 */
public final class RouteCli {
  private static final Logger log = LoggerFactory.getLogger(RouteCli.class);
  private static final String SUMMARY_USAGE =
      "usage: drivewise route from=LAT,LON to=LAT,LON [tomtomApiKey=KEY] [config=PATH]";
  private static final String HELP_TEXT = """
      DriveWise route traffic

      Usage:
        drivewise route from=37.7749,-122.4194 to=37.8044,-122.2712

      Prints distance, travel time, traffic delay and the congestion level for the fastest route.
      Requires a TomTom key (tomtomApiKey=KEY or TOMTOM_API_KEY). tomtomRoutingBaseUrl overrides the
      routing API base; calls share tomtom.minSpacingMs with the sweeps.
      """;

  private RouteCli() {}

  static ExitCode run(String[] args) {
    return run(args, System.getenv(), CompositionRoot::new);
  }

  static ExitCode run(
      String[] args, Map<String, String> environment, Function<EngineConfig, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.command().isPresent()) {
      log.error("Unexpected argument: {}", input.command().get());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Coordinate origin;
    Coordinate destination;
    EngineConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      origin = coordinate("from", kv.remove("from"));
      destination = coordinate("to", kv.remove("to"));
      Map<String, String> effective = ConfigCliUtils.resolveEffectiveConfig("route", kv, environment, log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = EngineConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid route arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (!config.hasTomTomKey()) {
      log.error("Route traffic needs a TomTom key (tomtomApiKey=KEY or TOMTOM_API_KEY)");
      return ExitCode.CONFIG_ERROR;
    }

    CompositionRoot root;
    try {
      root = rootFactory.apply(config);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Unable to wire engine: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    try (root) {
      Optional<RouteTrafficUseCase> lookup = root.routeTraffic();
      if (lookup.isEmpty()) {
        log.error("Route traffic is not available with this configuration");
        return ExitCode.CONFIG_ERROR;
      }
      Optional<RouteTraffic> route = lookup.get().lookup(origin, destination);
      if (Thread.currentThread().isInterrupted()) {
        return ExitCode.INTERRUPTED;
      }
      if (route.isEmpty()) {
        CliPrinter.println("No route found from " + origin.toQueryValue() + " to " + destination.toQueryValue());
        return ExitCode.RUNTIME_FAILURE;
      }
      printRoute(route.get());
      return ExitCode.SUCCESS;
    } catch (SinkException ex) {
      log.error("Sink did not close cleanly", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during route lookup", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static Coordinate coordinate(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required as LAT,LON");
    }
    String[] parts = raw.split(",", -1);
    if (parts.length != 2) {
      throw new IllegalArgumentException(key + " must be LAT,LON (was '" + raw + "')");
    }
    try {
      return new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric LAT,LON (was '" + raw + "')", ex);
    }
  }

  private static void printRoute(RouteTraffic route) {
    CliPrinter.printf("Route %s -> %s", route.origin().toQueryValue(), route.destination().toQueryValue());
    CliPrinter.printf("  distance         %.1f km", route.distanceMeters() / 1000d);
    CliPrinter.printf("  travel time      %d s", route.travelTimeSeconds());
    CliPrinter.printf("  traffic delay    %d s", route.trafficDelaySeconds());
    CliPrinter.printf("  congestion       %.1f", route.congestionLevel());
    CliPrinter.printf("  points           %d", route.points().size());
  }
}
