package ai.drivewise.risk.config;

import ai.drivewise.risk.application.schedule.JobKind;
import ai.drivewise.risk.domain.geo.Region;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.risk.FusionWeights;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Supplies flattened default configuration maps for each engine CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class EngineDefaults {
  static final String TOMTOM_BASE_URL = "https://api.tomtom.com/traffic";
  static final String NHTSA_BASE_URL = "https://api.nhtsa.gov/SafetyRatings";
  static final String VPIC_BASE_URL = "https://vpic.nhtsa.dot.gov/api/vehicles";
  static final String RECALLS_BASE_URL = "https://api.nhtsa.gov/recalls";
  static final String TOMTOM_ROUTING_BASE_URL = "https://api.tomtom.com/routing";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private EngineDefaults() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code run}, {@code score} or {@code route})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "score", "route" -> buildScoreDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("tomtomApiKey", "");
    map.put("tomtomBaseUrl", TOMTOM_BASE_URL);
    map.put("tomtomRoutingBaseUrl", TOMTOM_ROUTING_BASE_URL);
    map.put("nhtsaBaseUrl", NHTSA_BASE_URL);
    map.put("vpicBaseUrl", VPIC_BASE_URL);
    map.put("recallsBaseUrl", RECALLS_BASE_URL);
    map.put("httpTimeoutMs", "15000");
    map.put("tomtom.minSpacingMs", "1000");
    map.put("nhtsa.minSpacingMs", "500");
    map.put("batchSize", "100");
    map.put("batchCooldownMs", "5000");
    map.put("parallelism", "4");
    map.put("callTimeoutMs", "20000");
    map.put("sink", SinkType.NDJSON.name().toLowerCase(Locale.ROOT));
    map.put("sink.dir", defaultSinkDirectory().toString());
    map.put("kafkaBootstrap", "");
    map.put("kafka.topicPrefix", "drivewise");
    map.put("cache.maxDistanceKm", "15");
    map.put("cache.maxTrafficAge", "PT1H");
    map.put("cache.maxVehicleAge", "P7D");
    FusionWeights weights = FusionWeights.defaults();
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      map.put("fusion.weight." + factor, Double.toString(weights.weight(factor)));
    }
    map.put("fusion.weight.traffic", Double.toString(weights.trafficWeight()));
    map.put("fusion.trafficScale", Double.toString(weights.trafficScale()));
    map.put("fusion.vehicleScale", Double.toString(weights.vehicleScale()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("grid.density", "5");
    map.put("grid.radiusKm", "25");
    map.put("incidents.radiusKm", "10");
    map.put("regions", joinRegions());
    map.put("vehicles", "");
    for (JobKind kind : JobKind.values()) {
      map.put(kind.cadenceKey(), kind.defaultCadence().toString());
    }
    map.put("shutdownGraceMs", "30000");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildScoreDefaults() {
    // Scoring and route lookups read only the common keys; sweep geometry and cadences keep their defaults.
    return new LinkedHashMap<>();
  }

  private static String joinRegions() {
    StringJoiner joiner = new StringJoiner(";");
    for (Region region : Region.DEFAULT_CITIES) {
      joiner.add(region.name() + ":" + region.center().latitude() + "," + region.center().longitude());
    }
    return joiner.toString();
  }

  private static Path defaultSinkDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".drivewise", "out");
  }
}
