package ai.drivewise.risk.config;

import ai.drivewise.risk.application.schedule.JobKind;
import ai.drivewise.risk.domain.geo.Region;
import ai.drivewise.risk.domain.risk.FusionWeights;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.logging.Logs;
import ai.drivewise.risk.validation.Net;
import ai.drivewise.risk.validation.Numbers;
import ai.drivewise.risk.validation.Strings;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated engine settings built from the merged flat configuration map.
 * <p><strong>Why:</strong> Keeps string parsing and range checks at the edge so the composition root only sees
 * typed values.</p>
 * <p><strong>Role:</strong> Immutable configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param tomtomApiKey TomTom API key; absent disables live traffic and incident calls
 * @param tomtomBaseUrl TomTom traffic API base
 * @param tomtomRoutingBaseUrl TomTom routing API base used for route traffic
 * @param nhtsaBaseUrl NHTSA safety ratings API base
 * @param vpicBaseUrl NHTSA vPIC VIN decoder base
 * @param recallsBaseUrl NHTSA recalls API base
 * @param httpTimeout connect and request timeout for upstream calls
 * @param tomtomMinSpacing minimum spacing between TomTom calls
 * @param nhtsaMinSpacing minimum spacing between NHTSA calls
 * @param batchSize units issued before a batch cooldown
 * @param batchCooldown pause between batches
 * @param parallelism concurrent calls per poller run
 * @param callTimeout per-call budget measured from call start; also bounds the wait for a free worker
 * @param gridDensity traffic grid density
 * @param gridRadiusKm traffic grid radius
 * @param incidentRadiusKm incident search radius around each region centre
 * @param regions regions swept by traffic and incident jobs
 * @param vehicles vehicle worklist for the vehicle sweep
 * @param cadences cadence per job kind
 * @param fusionWeights risk fusion weights
 * @param sink sink type
 * @param sinkDirectory NDJSON output directory
 * @param kafkaBootstrap Kafka bootstrap servers when {@code sink=kafka}
 * @param kafkaTopicPrefix prefix for versioned Kafka topics
 * @param shutdownGrace time allowed for running jobs after a stop request
 * @param cacheMaxDistanceKm maximum distance for a cached traffic sample to count as nearby
 * @param cacheMaxTrafficAge maximum age of a cached traffic sample
 * @param cacheMaxVehicleAge maximum age of a cached vehicle safety record
 * @since 0.1.0
 */
public record EngineConfig(
    Optional<String> tomtomApiKey,
    URI tomtomBaseUrl,
    URI tomtomRoutingBaseUrl,
    URI nhtsaBaseUrl,
    URI vpicBaseUrl,
    URI recallsBaseUrl,
    Duration httpTimeout,
    Duration tomtomMinSpacing,
    Duration nhtsaMinSpacing,
    int batchSize,
    Duration batchCooldown,
    int parallelism,
    Duration callTimeout,
    int gridDensity,
    double gridRadiusKm,
    double incidentRadiusKm,
    List<Region> regions,
    List<VehicleQuery> vehicles,
    Map<JobKind, Duration> cadences,
    FusionWeights fusionWeights,
    SinkType sink,
    Path sinkDirectory,
    Optional<String> kafkaBootstrap,
    String kafkaTopicPrefix,
    Duration shutdownGrace,
    double cacheMaxDistanceKm,
    Duration cacheMaxTrafficAge,
    Duration cacheMaxVehicleAge) {
  private static final int MAX_API_KEY_LENGTH = 256;
  private static final long MAX_MILLIS = Duration.ofDays(1).toMillis();

  public EngineConfig {
    Objects.requireNonNull(tomtomApiKey, "tomtomApiKey");
    Objects.requireNonNull(tomtomBaseUrl, "tomtomBaseUrl");
    Objects.requireNonNull(tomtomRoutingBaseUrl, "tomtomRoutingBaseUrl");
    Objects.requireNonNull(nhtsaBaseUrl, "nhtsaBaseUrl");
    Objects.requireNonNull(vpicBaseUrl, "vpicBaseUrl");
    Objects.requireNonNull(recallsBaseUrl, "recallsBaseUrl");
    Objects.requireNonNull(httpTimeout, "httpTimeout");
    Objects.requireNonNull(tomtomMinSpacing, "tomtomMinSpacing");
    Objects.requireNonNull(nhtsaMinSpacing, "nhtsaMinSpacing");
    Objects.requireNonNull(batchCooldown, "batchCooldown");
    Objects.requireNonNull(callTimeout, "callTimeout");
    Objects.requireNonNull(fusionWeights, "fusionWeights");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(sinkDirectory, "sinkDirectory");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(kafkaTopicPrefix, "kafkaTopicPrefix");
    Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    Objects.requireNonNull(cacheMaxTrafficAge, "cacheMaxTrafficAge");
    Objects.requireNonNull(cacheMaxVehicleAge, "cacheMaxVehicleAge");
    regions = List.copyOf(regions);
    vehicles = List.copyOf(vehicles);
    Map<JobKind, Duration> cadenceCopy = new EnumMap<>(JobKind.class);
    for (JobKind kind : JobKind.values()) {
      cadenceCopy.put(kind, cadences.getOrDefault(kind, kind.defaultCadence()));
    }
    cadences = Collections.unmodifiableMap(cadenceCopy);
    if (regions.isEmpty()) {
      throw new IllegalArgumentException("at least one region is required");
    }
    if (sink == SinkType.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when sink=kafka");
    }
  }

  /**
   * Returns the configuration obtained from the embedded {@code run} defaults.
   *
   * @return default configuration
   */
  public static EngineConfig defaults() {
    return fromMap(EngineDefaults.asFlatMap("run"));
  }

  /**
   * Builds a validated configuration from a flat key/value map. Missing keys fall back to
   * {@link EngineDefaults}.
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = EngineDefaults.asFlatMap("run");

    Optional<String> apiKey = optionalString(options.get("tomtomApiKey"))
        .map(value -> Strings.requireToken("tomtomApiKey", value, MAX_API_KEY_LENGTH));
    SinkType sink = SinkType.fromString(options.get("sink"), SinkType.NDJSON);
    Optional<String> bootstrap = optionalString(options.get("kafkaBootstrap"))
        .map(Net::validateBootstrapServers);

    Map<JobKind, Duration> cadences = new EnumMap<>(JobKind.class);
    for (JobKind kind : JobKind.values()) {
      cadences.put(kind, parseCadence(kind.cadenceKey(), value(options, defaults, kind.cadenceKey())));
    }

    return new EngineConfig(
        apiKey,
        Net.validateHttpUrl("tomtomBaseUrl", value(options, defaults, "tomtomBaseUrl")),
        Net.validateHttpUrl("tomtomRoutingBaseUrl", value(options, defaults, "tomtomRoutingBaseUrl")),
        Net.validateHttpUrl("nhtsaBaseUrl", value(options, defaults, "nhtsaBaseUrl")),
        Net.validateHttpUrl("vpicBaseUrl", value(options, defaults, "vpicBaseUrl")),
        Net.validateHttpUrl("recallsBaseUrl", value(options, defaults, "recallsBaseUrl")),
        millis(options, defaults, "httpTimeoutMs", 1),
        millis(options, defaults, "tomtom.minSpacingMs", 0),
        millis(options, defaults, "nhtsa.minSpacingMs", 0),
        (int) parseLong(options, defaults, "batchSize", 1, 100_000),
        millis(options, defaults, "batchCooldownMs", 0),
        (int) parseLong(options, defaults, "parallelism", 1, 64),
        millis(options, defaults, "callTimeoutMs", 1),
        (int) parseLong(options, defaults, "grid.density", 0, 50),
        parseDouble(options, defaults, "grid.radiusKm", 0.1d, 500d),
        parseDouble(options, defaults, "incidents.radiusKm", 0.1d, 500d),
        parseRegions(value(options, defaults, "regions")),
        parseVehicles(value(options, defaults, "vehicles")),
        cadences,
        FusionWeights.fromMap(options),
        sink,
        parsePath("sink.dir", value(options, defaults, "sink.dir")),
        bootstrap,
        Strings.sanitizeTopic("kafka.topicPrefix", value(options, defaults, "kafka.topicPrefix")),
        millis(options, defaults, "shutdownGraceMs", 0),
        parseDouble(options, defaults, "cache.maxDistanceKm", 0.1d, 500d),
        parseCadence("cache.maxTrafficAge", value(options, defaults, "cache.maxTrafficAge")),
        parseCadence("cache.maxVehicleAge", value(options, defaults, "cache.maxVehicleAge")));
  }

  /**
   * Indicates whether live TomTom calls are possible.
   *
   * @return {@code true} when an API key is configured
   */
  public boolean hasTomTomKey() {
    return tomtomApiKey.isPresent();
  }

  /**
   * Cadence configured for a job.
   *
   * @param kind job kind
   * @return cadence
   */
  public Duration cadence(JobKind kind) {
    return cadences.get(kind);
  }

  @Override
  public String toString() {
    return "EngineConfig[tomtomApiKey=" + Logs.redact(tomtomApiKey.orElse(null))
        + ", tomtomBaseUrl=" + tomtomBaseUrl
        + ", nhtsaBaseUrl=" + nhtsaBaseUrl
        + ", regions=" + regions.size()
        + ", vehicles=" + vehicles.size()
        + ", sink=" + sink
        + ", cadences=" + cadences + "]";
  }

  static List<Region> parseRegions(String raw) {
    if (raw == null || raw.isBlank()) {
      return Region.DEFAULT_CITIES;
    }
    List<Region> regions = new ArrayList<>();
    for (String entry : raw.split(";")) {
      if (!entry.isBlank()) {
        regions.add(Region.parse(entry.trim()));
      }
    }
    return regions.isEmpty() ? Region.DEFAULT_CITIES : regions;
  }

  static List<VehicleQuery> parseVehicles(String raw) {
    List<VehicleQuery> vehicles = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return vehicles;
    }
    for (String entry : raw.split(";")) {
      if (!entry.isBlank()) {
        vehicles.add(VehicleQuery.parse(entry.trim()));
      }
    }
    return vehicles;
  }

  static Duration parseCadence(String key, String raw) {
    String trimmed = Strings.requireNonBlank(key, raw);
    Duration duration;
    try {
      duration = trimmed.chars().allMatch(Character::isDigit)
          ? Duration.ofMillis(Long.parseLong(trimmed))
          : Duration.parse(trimmed);
    } catch (DateTimeParseException | NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an ISO-8601 duration such as PT15M (was '" + raw + "')", ex);
    }
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(key + " must be positive (was " + raw + ")");
    }
    return duration;
  }

  private static String value(Map<String, String> options, Map<String, String> defaults, String key) {
    String raw = options.get(key);
    return raw == null ? defaults.get(key) : raw;
  }

  private static Duration millis(
      Map<String, String> options, Map<String, String> defaults, String key, long min) {
    return Duration.ofMillis(parseLong(options, defaults, key, min, MAX_MILLIS));
  }

  private static long parseLong(
      Map<String, String> options, Map<String, String> defaults, String key, long min, long max) {
    String raw = Strings.requireNonBlank(key, value(options, defaults, key));
    try {
      return Numbers.requireRange(key, Long.parseLong(raw), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static double parseDouble(
      Map<String, String> options, Map<String, String> defaults, String key, double min, double max) {
    String raw = Strings.requireNonBlank(key, value(options, defaults, key));
    try {
      return Numbers.requireRange(key, Double.parseDouble(raw), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was '" + raw + "')", ex);
    }
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }
}
