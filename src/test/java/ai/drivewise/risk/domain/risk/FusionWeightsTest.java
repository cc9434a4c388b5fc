package ai.drivewise.risk.domain.risk;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FusionWeightsTest {
  @Test
  void defaultsSumToOne() {
    FusionWeights weights = FusionWeights.defaults();

    double sum = weights.trafficWeight();
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      sum += weights.weight(factor);
    }
    assertEquals(1d, sum, 1e-9);
    assertEquals(0.25d, weights.weight(BehavioralFactors.SPEEDING), 0d);
    assertEquals(0.05d, weights.trafficScale(), 0d);
    assertEquals(0.05d, weights.vehicleScale(), 0d);
  }

  @Test
  void rejectsWeightsThatDoNotSumToOne() {
    Map<String, Double> weights = new HashMap<>(FusionWeights.defaults().factorWeights());
    weights.put(BehavioralFactors.SPEEDING, 0.5d);

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> new FusionWeights(weights, 0.07d, 0.05d, 0.05d));
    assertTrue(ex.getMessage().contains("sum to 1.0"));
  }

  @Test
  void rejectsUnknownAndMissingFactors() {
    Map<String, Double> missing = new HashMap<>(FusionWeights.defaults().factorWeights());
    missing.remove(BehavioralFactors.WEATHER);
    assertThrows(IllegalArgumentException.class, () -> new FusionWeights(missing, 0.15d, 0.05d, 0.05d));

    Map<String, Double> unknown = new HashMap<>(FusionWeights.defaults().factorWeights());
    unknown.put("phone_use", 0d);
    assertThrows(IllegalArgumentException.class, () -> new FusionWeights(unknown, 0.07d, 0.05d, 0.05d));
  }

  @Test
  void rejectsNegativeScale() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new FusionWeights(FusionWeights.defaults().factorWeights(), 0.07d, -0.1d, 0.05d));
  }

  @Test
  void fromMapOverridesSelectedKeys() {
    Map<String, String> config = Map.of(
        "fusion.weight.speeding", "0.30",
        "fusion.weight.traffic", "0.02",
        "fusion.vehicleScale", "0.1");

    FusionWeights weights = FusionWeights.fromMap(config);

    assertEquals(0.30d, weights.weight(BehavioralFactors.SPEEDING), 0d);
    assertEquals(0.02d, weights.trafficWeight(), 0d);
    assertEquals(0.1d, weights.vehicleScale(), 0d);
    assertEquals(0.05d, weights.trafficScale(), 0d);
  }

  @Test
  void fromMapRejectsNonNumericValues() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> FusionWeights.fromMap(Map.of("fusion.trafficScale", "high")));
    assertTrue(ex.getMessage().contains("fusion.trafficScale"));
  }

  @Test
  void behaviouralFactorsClampAndDropNulls() {
    Map<String, Double> raw = new HashMap<>();
    raw.put(BehavioralFactors.SPEEDING, -2d);
    raw.put(BehavioralFactors.WEATHER, 3d);
    raw.put(BehavioralFactors.DISTRACTION, null);
    BehavioralFactors factors = new BehavioralFactors(raw);

    assertEquals(0d, factors.clamped(BehavioralFactors.SPEEDING), 0d);
    assertEquals(1d, factors.clamped(BehavioralFactors.WEATHER), 0d);
    assertEquals(0d, factors.clamped(BehavioralFactors.DISTRACTION), 0d);
    assertFalse(factors.scores().containsKey(BehavioralFactors.DISTRACTION));
  }
}
