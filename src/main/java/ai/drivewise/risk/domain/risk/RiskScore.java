package ai.drivewise.risk.domain.risk;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fused risk score for one subject.
 *
 * @param subjectId user or vehicle the score belongs to
 * @param overall fused score in {@code [0, 1]}
 * @param breakdown per-slot contribution: clamped behavioural inputs plus {@code traffic} and
 *     {@code vehicle_safety} adjustments
 * @param confidence confidence in {@code [0, 1]}
 * @param computedAt fusion timestamp
 * @param inputs identifiers of the signals that were fused
 * @param provenance how each external signal was obtained
 * @since 0.1.0
 */
public record RiskScore(
    String subjectId,
    double overall,
    Map<String, Double> breakdown,
    double confidence,
    Instant computedAt,
    InputsUsed inputs,
    Provenance provenance) {

  /** Breakdown key for the traffic adjustment. */
  public static final String TRAFFIC_SLOT = "traffic";
  /** Breakdown key for the vehicle adjustment. */
  public static final String VEHICLE_SLOT = "vehicle_safety";

  public RiskScore {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(computedAt, "computedAt");
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(provenance, "provenance");
    if (Double.isNaN(overall) || overall < 0d || overall > 1d) {
      throw new IllegalArgumentException("overall must be between 0 and 1 (was " + overall + ")");
    }
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("confidence must be between 0 and 1 (was " + confidence + ")");
    }
    breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(breakdown, "breakdown")));
  }

  /**
   * Identifiers of the traffic sample and vehicle record used, when present.
   *
   * @param trafficSampleId sample identifier
   * @param vehicleRecordId vehicle record identifier
   */
  public record InputsUsed(Optional<String> trafficSampleId, Optional<String> vehicleRecordId) {
    public InputsUsed {
      trafficSampleId = Objects.requireNonNullElse(trafficSampleId, Optional.<String>empty());
      vehicleRecordId = Objects.requireNonNullElse(vehicleRecordId, Optional.<String>empty());
    }
  }

  /**
   * Substitution trail for the external signals.
   *
   * @param traffic traffic provenance
   * @param vehicle vehicle provenance
   */
  public record Provenance(TrafficProvenance traffic, VehicleProvenance vehicle) {
    public Provenance {
      Objects.requireNonNull(traffic, "traffic");
      Objects.requireNonNull(vehicle, "vehicle");
    }
  }

  /** Origin of the traffic signal. */
  public enum TrafficProvenance {
    LIVE,
    FALLBACK,
    ABSENT
  }

  /** Origin of the vehicle signal. */
  public enum VehicleProvenance {
    LIVE,
    DEFAULT,
    ERROR_FALLBACK,
    /** Record present but without an overall rating. */
    UNRATED,
    ABSENT
  }
}
