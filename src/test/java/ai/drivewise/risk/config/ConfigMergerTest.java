package ai.drivewise.risk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("batchSize", "100", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("batchSize", "50", "parallelism", "2");
    Map<String, String> cli = Map.of("batchSize", "25", "parallelism", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.of(yaml), Map.of(), cli, defaults, warnings::add);

    assertEquals("25", merged.get("batchSize"));
    assertEquals("8", merged.get("parallelism"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: batchSize"));
  }

  @Test
  void environmentSitsBetweenDefaultsAndYaml() {
    Map<String, String> defaults = Map.of("tomtomApiKey", "", "kafkaBootstrap", "");
    Map<String, String> env = Map.of("TOMTOM_API_KEY", " env-key ", "KAFKA_BOOTSTRAP", "env:9092");
    Map<String, String> yaml = Map.of("kafkaBootstrap", "yaml:9092");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.of(yaml), env, Map.of(), defaults, msg -> {});

    assertEquals("env-key", merged.get("tomtomApiKey"));
    assertEquals("yaml:9092", merged.get("kafkaBootstrap"));
  }

  @Test
  void blankEnvironmentValuesAreIgnored() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "score", Optional.empty(), Map.of("TOMTOM_API_KEY", "  "), Map.of(),
        Map.of("tomtomApiKey", "default"), msg -> {});

    assertEquals("default", merged.get("tomtomApiKey"));
  }

  @Test
  void kafkaSinkRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of(), Map.of("sink", "kafka"), Map.of(), msg -> {}));
  }

  @Test
  void unknownSinkIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of(), Map.of("sink", "s3"), Map.of(), msg -> {}));
  }
}
