package ai.drivewise.risk.api;

import ai.drivewise.risk.application.pipeline.ScoreRequest;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.config.CompositionRoot;
import ai.drivewise.risk.config.EngineConfig;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs one on-demand fusion with live lookups and prints the score breakdown.
 *
 * @since 0.1.0
 */
public final class ScoreCli {
  private static final Logger log = LoggerFactory.getLogger(ScoreCli.class);
  private static final String SUMMARY_USAGE =
      "usage: drivewise score subject=ID [speeding=0..1 ...] [lat=DEG lon=DEG] "
          + "[year=YYYY make=MAKE model=MODEL | vin=VIN] [config=PATH]";
  private static final String HELP_TEXT = """
      DriveWise on-demand risk score

      Usage:
        drivewise score subject=driver-42 speeding=0.4 hard_braking=0.2 lat=37.77 lon=-122.42 \\
            year=2020 make=Toyota model=Camry

      Behavioural factors (0..1, missing factors read as 0):
        speeding, hard_braking, acceleration, distraction, time_of_day, weather

      Signals:
        lat=DEG lon=DEG          Location for the traffic slot (both or neither)
        year= make= model=       Vehicle for the safety slot
        vin=VIN                  Vehicle identified by VIN (decoded through vPIC)

      Any run option (tomtomApiKey, nhtsaBaseUrl, sink, fusion.weight.<factor>, ...) is accepted as well.
      """;

  private ScoreCli() {}

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

    ScoreRequest request;
    EngineConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      request = extractRequest(kv);
      Map<String, String> effective = ConfigCliUtils.resolveEffectiveConfig("score", kv, environment, log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = EngineConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid score arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CompositionRoot root;
    try {
      root = rootFactory.apply(config);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Unable to wire engine: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    try (root) {
      RiskScore score = root.scoringUseCase().score(request);
      printScore(score);
      return ExitCode.SUCCESS;
    } catch (SinkException ex) {
      log.error("Sink did not close cleanly", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while scoring {}", request.subjectId(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /** Removes the request keys from {@code kv}, leaving only configuration keys. */
  static ScoreRequest extractRequest(Map<String, String> kv) {
    String subject = kv.remove("subject");
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    Map<String, Double> factors = new LinkedHashMap<>();
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      String raw = kv.remove(factor);
      if (raw != null && !raw.isBlank()) {
        factors.put(factor, parseDouble(factor, raw));
      }
    }

    String lat = kv.remove("lat");
    String lon = kv.remove("lon");
    Optional<Coordinate> location = Optional.empty();
    if (lat != null || lon != null) {
      if (lat == null || lon == null) {
        throw new IllegalArgumentException("lat and lon must be given together");
      }
      location = Optional.of(new Coordinate(parseDouble("lat", lat), parseDouble("lon", lon)));
    }

    String year = kv.remove("year");
    String make = kv.remove("make");
    String model = kv.remove("model");
    String vin = kv.remove("vin");
    Optional<VehicleQuery> vehicle = Optional.empty();
    if (year != null || make != null || model != null) {
      if (year == null || make == null || model == null) {
        throw new IllegalArgumentException("year, make and model must be given together");
      }
      int parsedYear;
      try {
        parsedYear = Integer.parseInt(year.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("year must be numeric (was '" + year + "')", ex);
      }
      vehicle = Optional.of(new VehicleQuery(parsedYear, make, model, Optional.ofNullable(vin)));
    } else if (vin != null) {
      vehicle = Optional.of(VehicleQuery.ofVin(vin));
    }
    return new ScoreRequest(subject.trim(), new BehavioralFactors(factors), location, vehicle);
  }

  private static double parseDouble(String key, String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was '" + raw + "')", ex);
    }
  }

  private static void printScore(RiskScore score) {
    CliPrinter.printf("Risk score for %s: %.4f (confidence %.2f)",
        score.subjectId(), score.overall(), score.confidence());
    for (Map.Entry<String, Double> entry : score.breakdown().entrySet()) {
      CliPrinter.printf("  %-16s %+.4f", entry.getKey(), entry.getValue());
    }
    CliPrinter.printf("  traffic signal   %s%s", score.provenance().traffic(),
        score.inputs().trafficSampleId().map(id -> " (" + id + ")").orElse(""));
    CliPrinter.printf("  vehicle signal   %s%s", score.provenance().vehicle(),
        score.inputs().vehicleRecordId().map(id -> " (" + id + ")").orElse(""));
    CliPrinter.println("  computed at      " + score.computedAt());
  }
}
