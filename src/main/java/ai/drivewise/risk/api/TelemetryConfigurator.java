package ai.drivewise.risk.api;

import ai.drivewise.risk.validation.Numbers;
import ai.drivewise.risk.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the JVM before the OpenTelemetry meter provider is built.
 *
 * <p>Consumes {@code metricsExporter}, {@code otelEndpoint}, {@code otelResourceAttributes} and
 * {@code metricsIntervalMs} from the map so the remaining keys describe the engine alone.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  private static final Set<String> EXPORTERS = Set.of("otlp", "logging", "none");

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = args.remove("metricsExporter");
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.isEmpty()) {
        if (!EXPORTERS.contains(normalized)) {
          throw new IllegalArgumentException("metricsExporter must be 'otlp', 'logging' or 'none'");
        }
        log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
        System.setProperty("otel.metrics.exporter", normalized);
      }
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      String trimmed = Strings.requireToken(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", trimmed);
    }

    String interval = args.remove("metricsIntervalMs");
    if (interval != null && !interval.isBlank()) {
      long millis;
      try {
        millis = Long.parseLong(interval.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("metricsIntervalMs must be an integer (was '" + interval + "')", ex);
      }
      Numbers.requireRange("metricsIntervalMs", millis, 1_000L, 3_600_000L);
      System.setProperty("otel.metric.export.interval", Long.toString(millis));
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
