package ai.drivewise.risk.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.logging.LoggingMetricExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the engine from system properties and environment variables.
 *
 * <p>Recognised settings (system property first, then environment):
 * {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} ({@code otlp}, {@code logging} or {@code none}),
 * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT},
 * {@code otel.resource.attributes}/{@code OTEL_RESOURCE_ATTRIBUTES} and
 * {@code otel.metric.export.interval}/{@code OTEL_METRIC_EXPORT_INTERVAL} in milliseconds.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ai.drivewise.risk";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final String POM_PROPERTIES =
      "/META-INF/maven/ai.drivewise/drivewise-risk-engine/pom.properties";

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.fromEnvironment();
      if (settings.exporter() == Exporter.NONE) {
        log.info("OpenTelemetry metrics disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      MetricReader reader = PeriodicMetricReader.builder(createExporter(settings))
          .setInterval(settings.interval())
          .build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting via {} every {} s{}",
          settings.exporter(),
          settings.interval().toSeconds(),
          settings.exporter() == Exporter.OTLP ? " to " + settings.endpoint() : "");
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraResource) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, extraResource))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  private static MetricExporter createExporter(Settings settings) {
    if (settings.exporter() == Exporter.LOGGING) {
      return LoggingMetricExporter.create();
    }
    return OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
  }

  private static Resource resource(String version, Attributes extra) {
    AttributesBuilder builder = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "drivewise-risk")
        .put(AttributeKey.stringKey("service.namespace"), "ai.drivewise")
        .put(AttributeKey.stringKey("service.version"), version);
    String instance = instanceId();
    if (!instance.isBlank()) {
      builder.put(AttributeKey.stringKey("service.instance.id"), instance);
    }
    Resource merged = Resource.getDefault().merge(Resource.create(builder.build()));
    return extra.isEmpty() ? merged : merged.merge(Resource.create(extra));
  }

  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null || raw.isBlank()) {
      return builder.build();
    }
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int eq = entry.indexOf('=');
      if (entry.isEmpty()) {
        continue;
      }
      if (eq <= 0 || eq == entry.length() - 1) {
        log.warn("Ignoring malformed resource attribute '{}'", entry);
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, eq).trim()), entry.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String instanceId() {
    String override = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "";
    }
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read {}", POM_PROPERTIES, ex);
    }
    return "0.0.0-dev";
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  enum Exporter {
    OTLP,
    LOGGING,
    NONE;

    static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      switch (normalized) {
        case "none":
          return NONE;
        case "logging":
        case "console":
          return LOGGING;
        case "":
        case "otlp":
          return OTLP;
        default:
          log.warn("Unknown metrics exporter '{}'; using otlp", raw);
          return OTLP;
      }
    }
  }

  record Settings(Exporter exporter, String endpoint, Attributes resourceAttributes, Duration interval) {
    static Settings fromEnvironment() {
      Exporter exporter = Exporter.parse(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"));
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      Attributes attributes =
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      return new Settings(exporter, endpoint, attributes, interval(
          setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL", "")));
    }

    private static Duration interval(String raw) {
      if (raw.isEmpty()) {
        return DEFAULT_INTERVAL;
      }
      try {
        long millis = Long.parseLong(raw);
        if (millis > 0) {
          return Duration.ofMillis(millis);
        }
      } catch (NumberFormatException ex) {
        log.warn("Metric export interval '{}' is not a number of milliseconds", raw, ex);
      }
      return DEFAULT_INTERVAL;
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode flushed = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!flushed.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within 5 s");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("OpenTelemetry meter provider did not shut down within 5 s");
      }
    }
  }
}
