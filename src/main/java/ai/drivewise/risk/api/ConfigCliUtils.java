package ai.drivewise.risk.api;

import ai.drivewise.risk.config.ConfigMerger;
import ai.drivewise.risk.config.EngineDefaults;
import ai.drivewise.risk.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers for mixing CLI arguments with YAML, environment and default configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective flat configuration for a mode. Removes {@code config} from {@code kv}.
   *
   * @throws IllegalArgumentException if the config file is missing or invalid, or the merge fails validation
   * @throws IOException if the config file cannot be read
   */
  static Map<String, String> resolveEffectiveConfig(
      String mode, Map<String, String> kv, Map<String, String> environment, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, environment, kv, EngineDefaults.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
