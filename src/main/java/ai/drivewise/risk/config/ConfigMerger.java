package ai.drivewise.risk.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, environment, YAML and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  /** Environment variables recognised as configuration, mapped to their flat key. */
  static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
      "TOMTOM_API_KEY", "tomtomApiKey",
      "NHTSA_BASE_URL", "nhtsaBaseUrl",
      "KAFKA_BOOTSTRAP", "kafkaBootstrap");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > environment > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param environment process environment (only {@link #ENVIRONMENT_KEYS} are read)
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    if (environment != null) {
      for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
        String value = environment.get(entry.getKey());
        if (value != null && !value.isBlank()) {
          merged.put(entry.getValue(), value.trim());
        }
      }
    }
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    SinkType sink = SinkType.fromString(effective.get("sink"), SinkType.NDJSON);
    if (sink == SinkType.KAFKA && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when sink=kafka");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
