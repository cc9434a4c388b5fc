package ai.drivewise.risk.domain.traffic;

import ai.drivewise.risk.domain.geo.Coordinate;
import java.time.Instant;
import java.util.Objects;

/**
 * Traffic incident reported near a region centre.
 *
 * @param id upstream incident identifier
 * @param category upstream icon category code
 * @param description free-text description; may be empty
 * @param severity magnitude of delay reported upstream; {@code >= 0}
 * @param coordinate incident location
 * @param delaySeconds reported delay in seconds; {@code >= 0}
 * @param roadNumber first road number reported, or {@code "Unknown"}
 * @param collectedAt collection timestamp
 * @since 0.1.0
 */
public record Incident(
    String id,
    int category,
    String description,
    int severity,
    Coordinate coordinate,
    long delaySeconds,
    String roadNumber,
    Instant collectedAt) {

  /** Road number used when the upstream record lists none. */
  public static final String UNKNOWN_ROAD = "Unknown";

  public Incident {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(coordinate, "coordinate");
    Objects.requireNonNull(collectedAt, "collectedAt");
    description = description == null ? "" : description;
    roadNumber = roadNumber == null || roadNumber.isBlank() ? UNKNOWN_ROAD : roadNumber;
    if (severity < 0) {
      throw new IllegalArgumentException("severity must be >= 0 (was " + severity + ")");
    }
    if (delaySeconds < 0) {
      throw new IllegalArgumentException("delaySeconds must be >= 0 (was " + delaySeconds + ")");
    }
  }
}
