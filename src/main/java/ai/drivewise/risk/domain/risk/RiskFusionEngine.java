package ai.drivewise.risk.domain.risk;

import ai.drivewise.risk.domain.risk.RiskScore.InputsUsed;
import ai.drivewise.risk.domain.risk.RiskScore.Provenance;
import ai.drivewise.risk.domain.risk.RiskScore.TrafficProvenance;
import ai.drivewise.risk.domain.risk.RiskScore.VehicleProvenance;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.traffic.TrafficSourceTag;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Deterministic fusion of behavioural, traffic and vehicle-safety signals into one score.
 * <p><strong>Why:</strong> Downstream pricing needs a bounded, reproducible number whose inputs can be audited.</p>
 * <p><strong>Role:</strong> Domain service invoked by the risk scoring use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Weight the clamped behavioural factors into a baseline.</li>
 *   <li>Add {@code congestionLevel * trafficScale} for the traffic slot.</li>
 *   <li>Subtract {@code max(0, (rating - 3) * vehicleScale)} for rated vehicles.</li>
 *   <li>Clamp the result to {@code [0, 1]} and derive confidence from how the signals were obtained.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Performance:</strong> Constant time per call.</p>
 *
 * @since 0.1.0
 */
public final class RiskFusionEngine {
  static final double BASE_CONFIDENCE = 0.95d;
  static final double TRAFFIC_FALLBACK_PENALTY = 0.08d;
  static final double VEHICLE_ERROR_PENALTY = 0.05d;
  static final double MIN_CONFIDENCE = 0.5d;
  private static final int NEUTRAL_RATING = 3;

  private final FusionWeights weights;

  /**
   * Creates an engine with the calibrated default weights.
   */
  public RiskFusionEngine() {
    this(FusionWeights.defaults());
  }

  /**
   * Creates an engine with explicit weights.
   *
   * @param weights validated weights; must not be {@code null}
   */
  public RiskFusionEngine(FusionWeights weights) {
    this.weights = Objects.requireNonNull(weights, "weights");
  }

  /**
   * Fuses the signals, stamping the score with the current time.
   *
   * @param subjectId subject the score is computed for
   * @param factors behavioural factors; must not be {@code null}
   * @param traffic latest traffic sample near the subject; may be {@code null}
   * @param vehicle latest safety record for the subject's vehicle; may be {@code null}
   * @return fused score
   */
  public RiskScore fuse(
      String subjectId, BehavioralFactors factors, TrafficSample traffic, VehicleSafetyRecord vehicle) {
    return fuse(subjectId, factors, traffic, vehicle, Instant.now());
  }

  /**
   * Fuses the signals.
   *
   * @param subjectId subject the score is computed for
   * @param factors behavioural factors; must not be {@code null}
   * @param traffic latest traffic sample near the subject; may be {@code null}
   * @param vehicle latest safety record for the subject's vehicle; may be {@code null}
   * @param computedAt timestamp recorded on the score
   * @return fused score with breakdown, confidence and provenance
   */
  public RiskScore fuse(
      String subjectId,
      BehavioralFactors factors,
      TrafficSample traffic,
      VehicleSafetyRecord vehicle,
      Instant computedAt) {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(factors, "factors");
    Objects.requireNonNull(computedAt, "computedAt");

    Map<String, Double> breakdown = new LinkedHashMap<>();
    double baseline = 0d;
    for (String factor : BehavioralFactors.KNOWN_FACTORS) {
      double value = factors.clamped(factor);
      breakdown.put(factor, value);
      baseline += weights.weight(factor) * value;
    }

    double trafficAdjustment = traffic == null ? 0d : traffic.congestionLevel() * weights.trafficScale();
    double vehicleAdjustment = vehicleAdjustment(vehicle);
    breakdown.put(RiskScore.TRAFFIC_SLOT, trafficAdjustment);
    breakdown.put(RiskScore.VEHICLE_SLOT, vehicleAdjustment);

    double overall = clamp(baseline + trafficAdjustment - vehicleAdjustment, 0d, 1d);

    TrafficProvenance trafficProvenance = trafficProvenance(traffic);
    VehicleProvenance vehicleProvenance = vehicleProvenance(vehicle);
    double confidence = BASE_CONFIDENCE;
    if (trafficProvenance == TrafficProvenance.FALLBACK) {
      confidence -= TRAFFIC_FALLBACK_PENALTY;
    }
    if (vehicleProvenance == VehicleProvenance.ERROR_FALLBACK) {
      confidence -= VEHICLE_ERROR_PENALTY;
    }
    confidence = clamp(confidence, MIN_CONFIDENCE, BASE_CONFIDENCE);

    InputsUsed inputs = new InputsUsed(
        Optional.ofNullable(traffic).map(TrafficSample::sampleId),
        Optional.ofNullable(vehicle).map(VehicleSafetyRecord::recordId));
    return new RiskScore(
        subjectId,
        overall,
        breakdown,
        confidence,
        computedAt,
        inputs,
        new Provenance(trafficProvenance, vehicleProvenance));
  }

  /**
   * Weights in use.
   *
   * @return fusion weights
   */
  public FusionWeights weights() {
    return weights;
  }

  private double vehicleAdjustment(VehicleSafetyRecord vehicle) {
    if (vehicle == null || vehicle.overallRating().isEmpty()) {
      return 0d;
    }
    int rating = vehicle.overallRating().getAsInt();
    if (rating < 1 || rating > 5) {
      return 0d;
    }
    return Math.max(0, rating - NEUTRAL_RATING) * weights.vehicleScale();
  }

  private static TrafficProvenance trafficProvenance(TrafficSample traffic) {
    if (traffic == null) {
      return TrafficProvenance.ABSENT;
    }
    return traffic.sourceTag() == TrafficSourceTag.FALLBACK ? TrafficProvenance.FALLBACK : TrafficProvenance.LIVE;
  }

  private static VehicleProvenance vehicleProvenance(VehicleSafetyRecord vehicle) {
    if (vehicle == null) {
      return VehicleProvenance.ABSENT;
    }
    return switch (vehicle.sourceTag()) {
      case LIVE -> vehicle.overallRating().isPresent() ? VehicleProvenance.LIVE : VehicleProvenance.UNRATED;
      case DEFAULT -> VehicleProvenance.DEFAULT;
      case ERROR_FALLBACK -> VehicleProvenance.ERROR_FALLBACK;
    };
  }

  private static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) {
      return min;
    }
    return Math.max(min, Math.min(max, value));
  }
}
