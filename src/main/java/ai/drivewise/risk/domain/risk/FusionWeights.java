package ai.drivewise.risk.domain.risk;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Slot weights and adjustment scales used by {@link RiskFusionEngine}.
 * <p><strong>Why:</strong> Keeps calibration out of the algorithm so operators can tune it through configuration.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold one weight per behavioural factor plus the {@code traffic} slot.</li>
 *   <li>Reject negative weights and slot weights whose sum drifts from {@code 1.0}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @implNote The {@code traffic} weight only participates in the sum check; the traffic slot itself is filled by
 * {@code congestionLevel * trafficScale}.
 * @param factorWeights weight per behavioural factor name
 * @param trafficWeight weight reserved for the traffic slot
 * @param trafficScale multiplier applied to the congestion level
 * @param vehicleScale risk subtracted per star above three
 * @since 0.1.0
 */
public record FusionWeights(
    Map<String, Double> factorWeights, double trafficWeight, double trafficScale, double vehicleScale) {
  static final double SUM_TOLERANCE = 1e-6d;

  public FusionWeights {
    Objects.requireNonNull(factorWeights, "factorWeights");
    factorWeights = Map.copyOf(factorWeights);
    double sum = requireWeight("traffic", trafficWeight);
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      Double weight = factorWeights.get(factor);
      if (weight == null) {
        throw new IllegalArgumentException("missing fusion weight for " + factor);
      }
      sum += requireWeight(factor, weight);
    }
    for (String name : factorWeights.keySet()) {
      if (!BehavioralFactors.KNOWN_FACTORS.contains(name)) {
        throw new IllegalArgumentException("unknown fusion weight: " + name);
      }
    }
    if (Math.abs(sum - 1.0d) > SUM_TOLERANCE) {
      throw new IllegalArgumentException("fusion weights must sum to 1.0 (was " + sum + ")");
    }
    requireWeight("trafficScale", trafficScale);
    requireWeight("vehicleScale", vehicleScale);
  }

  /**
   * Calibrated defaults.
   *
   * @return speeding 0.25, hard braking 0.20, acceleration 0.15, distraction 0.15, time of day 0.10,
   *     weather 0.08, traffic 0.07; both scales 0.05
   */
  public static FusionWeights defaults() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put(BehavioralFactors.SPEEDING, 0.25d);
    weights.put(BehavioralFactors.HARD_BRAKING, 0.20d);
    weights.put(BehavioralFactors.ACCELERATION, 0.15d);
    weights.put(BehavioralFactors.DISTRACTION, 0.15d);
    weights.put(BehavioralFactors.TIME_OF_DAY, 0.10d);
    weights.put(BehavioralFactors.WEATHER, 0.08d);
    return new FusionWeights(weights, 0.07d, 0.05d, 0.05d);
  }

  /**
   * Applies {@code fusion.weight.<factor>}, {@code fusion.weight.traffic}, {@code fusion.trafficScale} and
   * {@code fusion.vehicleScale} overrides on top of {@link #defaults()}.
   *
   * @param config flattened configuration
   * @return validated weights
   * @throws IllegalArgumentException if a value is not numeric or the result is invalid
   */
  public static FusionWeights fromMap(Map<String, String> config) {
    FusionWeights defaults = defaults();
    Map<String, Double> weights = new LinkedHashMap<>(defaults.factorWeights());
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      weights.put(factor, parse(config, "fusion.weight." + factor, weights.get(factor)));
    }
    return new FusionWeights(
        weights,
        parse(config, "fusion.weight.traffic", defaults.trafficWeight()),
        parse(config, "fusion.trafficScale", defaults.trafficScale()),
        parse(config, "fusion.vehicleScale", defaults.vehicleScale()));
  }

  /**
   * Weight for a behavioural factor.
   *
   * @param factor factor name
   * @return weight, {@code 0} for unknown names
   */
  public double weight(String factor) {
    return factorWeights.getOrDefault(factor, 0d);
  }

  private static double parse(Map<String, String> config, String key, double fallback) {
    String raw = config == null ? null : config.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was '" + raw + "')", ex);
    }
  }

  private static double requireWeight(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value < 0d) {
      throw new IllegalArgumentException(name + " must be a non-negative number (was " + value + ")");
    }
    return value;
  }
}
