package ai.drivewise.risk.domain.risk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Behavioural factor scores for one subject, keyed by factor name.
 *
 * <p>Values are stored as supplied; {@link #clamped(String)} normalizes them to {@code [0, 1]} at fusion time so
 * adversarial inputs cannot push the score out of range. Names outside {@link #KNOWN_FACTORS} are kept for
 * auditing but ignored by fusion.</p>
 *
 * @param scores factor name to raw score
 * @since 0.1.0
 */
public record BehavioralFactors(Map<String, Double> scores) {
  public static final String SPEEDING = "speeding";
  public static final String HARD_BRAKING = "hard_braking";
  public static final String ACCELERATION = "acceleration";
  public static final String DISTRACTION = "distraction";
  public static final String TIME_OF_DAY = "time_of_day";
  public static final String WEATHER = "weather";

  /** Factors that contribute to the behavioural baseline, in breakdown order. */
  public static final List<String> KNOWN_FACTORS =
      List.of(SPEEDING, HARD_BRAKING, ACCELERATION, DISTRACTION, TIME_OF_DAY, WEATHER);

  public BehavioralFactors {
    Objects.requireNonNull(scores, "scores");
    Map<String, Double> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : scores.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    scores = Map.copyOf(copy);
  }

  /**
   * Factors with every score unset.
   *
   * @return empty factors
   */
  public static BehavioralFactors none() {
    return new BehavioralFactors(Map.of());
  }

  /**
   * Returns the named score clamped to {@code [0, 1]}; missing or NaN scores read as {@code 0}.
   *
   * @param name factor name
   * @return clamped score
   */
  public double clamped(String name) {
    Double raw = scores.get(name);
    if (raw == null || raw.isNaN()) {
      return 0d;
    }
    return Math.max(0d, Math.min(1d, raw));
  }
}
