package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import java.util.Objects;
import java.util.Optional;

/**
 * On-demand scoring request.
 *
 * @param subjectId driver or policy identifier
 * @param factors behavioural factor scores
 * @param location where the subject drives, used to find nearby traffic
 * @param vehicle the subject's vehicle
 * @since 0.1.0
 */
public record ScoreRequest(
    String subjectId, BehavioralFactors factors, Optional<Coordinate> location, Optional<VehicleQuery> vehicle) {
  public ScoreRequest {
    Objects.requireNonNull(subjectId, "subjectId");
    if (subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId must not be blank");
    }
    factors = Objects.requireNonNullElse(factors, BehavioralFactors.none());
    location = Objects.requireNonNullElse(location, Optional.empty());
    vehicle = Objects.requireNonNullElse(vehicle, Optional.empty());
  }
}
