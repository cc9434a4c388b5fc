package ai.drivewise.risk.api;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.geo.GeoGridSampler;
import ai.drivewise.risk.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the coordinates a traffic sweep would poll around one centre.
 *
 * @since 0.1.0
 */
public final class GridCli {
  private static final Logger log = LoggerFactory.getLogger(GridCli.class);
  private static final String SUMMARY_USAGE = "usage: drivewise grid lat=DEG lon=DEG [radiusKm=25] [density=5]";
  private static final String HELP_TEXT = """
      DriveWise grid sampler

      Usage:
        drivewise grid lat=37.7749 lon=-122.4194 [radiusKm=25] [density=5]

      Prints (2*density+1)^2 coordinates, row by row from south-west to north-east, one lat,lon pair per line.
      """;

  private GridCli() {}

  static ExitCode run(String[] args) {
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

    List<Coordinate> points;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      Coordinate center = new Coordinate(requireDouble(kv, "lat"), requireDouble(kv, "lon"));
      double radiusKm = optionalDouble(kv, "radiusKm", 25d);
      int density = optionalInt(kv, "density", 5);
      points = GeoGridSampler.sample(center, radiusKm, density);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid grid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliPrinter.println("# " + points.size() + " points");
    for (Coordinate point : points) {
      CliPrinter.printf("%.6f,%.6f", point.latitude(), point.longitude());
    }
    return ExitCode.SUCCESS;
  }

  private static double requireDouble(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return parse(key, raw);
  }

  private static double optionalDouble(Map<String, String> kv, String key, double fallback) {
    String raw = kv.get(key);
    return raw == null || raw.isBlank() ? fallback : parse(key, raw);
  }

  private static int optionalInt(Map<String, String> kv, String key, int fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a whole number (was '" + raw + "')", ex);
    }
  }

  private static double parse(String key, String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was '" + raw + "')", ex);
    }
  }
}
