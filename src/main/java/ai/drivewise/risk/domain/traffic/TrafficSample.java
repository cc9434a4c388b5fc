package ai.drivewise.risk.domain.traffic;

import ai.drivewise.risk.domain.geo.Coordinate;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Point-in-time traffic observation for one coordinate.
 * <p><strong>Role:</strong> Produced by traffic flow sources, consumed by sinks, the signal cache and fusion.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param sampleId unique identifier referenced by risk scores
 * @param coordinate sampled location
 * @param currentSpeed observed speed in km/h; {@code >= 0}
 * @param freeFlowSpeed free-flow speed in km/h; {@code >= 0}
 * @param congestionLevel bucketed congestion in {@code [0, 1]}
 * @param roadClosed whether the segment is reported closed
 * @param confidence upstream confidence in {@code [0, 1]}
 * @param collectedAt collection timestamp
 * @param sourceTag live or fallback origin
 * @since 0.1.0
 */
public record TrafficSample(
    String sampleId,
    Coordinate coordinate,
    double currentSpeed,
    double freeFlowSpeed,
    double congestionLevel,
    boolean roadClosed,
    double confidence,
    Instant collectedAt,
    TrafficSourceTag sourceTag) {

  /** Current speed substituted when the upstream call fails. */
  public static final double FALLBACK_CURRENT_SPEED = 45d;
  /** Free-flow speed substituted when the upstream call fails. */
  public static final double FALLBACK_FREE_FLOW_SPEED = 50d;
  /** Congestion substituted when the upstream call fails. */
  public static final double FALLBACK_CONGESTION = 0.1d;
  /** Confidence substituted when the upstream call fails. */
  public static final double FALLBACK_CONFIDENCE = 0.5d;

  public TrafficSample {
    Objects.requireNonNull(sampleId, "sampleId");
    Objects.requireNonNull(coordinate, "coordinate");
    Objects.requireNonNull(collectedAt, "collectedAt");
    Objects.requireNonNull(sourceTag, "sourceTag");
    requireNonNegative("currentSpeed", currentSpeed);
    requireNonNegative("freeFlowSpeed", freeFlowSpeed);
    requireUnit("congestionLevel", congestionLevel);
    requireUnit("confidence", confidence);
  }

  /**
   * Builds a live sample, deriving the congestion level from the speeds.
   *
   * @param coordinate sampled location
   * @param currentSpeed observed speed
   * @param freeFlowSpeed free-flow speed
   * @param roadClosed closure flag
   * @param confidence upstream confidence, clamped into {@code [0, 1]}
   * @param collectedAt collection timestamp
   * @return live-tagged sample
   */
  public static TrafficSample live(
      Coordinate coordinate,
      double currentSpeed,
      double freeFlowSpeed,
      boolean roadClosed,
      double confidence,
      Instant collectedAt) {
    double current = Math.max(0d, currentSpeed);
    double freeFlow = Math.max(0d, freeFlowSpeed);
    return new TrafficSample(
        newId(),
        coordinate,
        current,
        freeFlow,
        CongestionLevels.fromSpeeds(current, freeFlow),
        roadClosed,
        Double.isNaN(confidence) ? 0d : Math.max(0d, Math.min(1d, confidence)),
        collectedAt,
        TrafficSourceTag.LIVE);
  }

  /**
   * Builds the conservative fallback sample used when live data is unavailable.
   *
   * @param coordinate requested location
   * @param collectedAt substitution timestamp
   * @return fallback-tagged sample
   */
  public static TrafficSample fallback(Coordinate coordinate, Instant collectedAt) {
    return new TrafficSample(
        newId(),
        coordinate,
        FALLBACK_CURRENT_SPEED,
        FALLBACK_FREE_FLOW_SPEED,
        FALLBACK_CONGESTION,
        false,
        FALLBACK_CONFIDENCE,
        collectedAt,
        TrafficSourceTag.FALLBACK);
  }

  private static String newId() {
    return "ts-" + UUID.randomUUID();
  }

  private static void requireNonNegative(String name, double value) {
    if (Double.isNaN(value) || value < 0d) {
      throw new IllegalArgumentException(name + " must be >= 0 (was " + value + ")");
    }
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0d || value > 1d) {
      throw new IllegalArgumentException(name + " must be between 0 and 1 (was " + value + ")");
    }
  }
}
