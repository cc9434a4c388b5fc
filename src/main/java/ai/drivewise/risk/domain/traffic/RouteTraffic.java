package ai.drivewise.risk.domain.traffic;

import ai.drivewise.risk.domain.geo.Coordinate;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Traffic summary for a driven route between two points.
 *
 * @param origin route start
 * @param destination route end
 * @param distanceMeters route length; {@code >= 0}
 * @param travelTimeSeconds expected travel time with current traffic; {@code >= 0}
 * @param trafficDelaySeconds part of the travel time caused by traffic; {@code >= 0}
 * @param congestionLevel bucketed congestion in {@code [0, 1]}, see {@link #congestionFor}
 * @param points route geometry as reported upstream; may be empty
 * @param collectedAt collection timestamp
 * @since 0.1.0
 */
public record RouteTraffic(
    Coordinate origin,
    Coordinate destination,
    long distanceMeters,
    long travelTimeSeconds,
    long trafficDelaySeconds,
    double congestionLevel,
    List<Coordinate> points,
    Instant collectedAt) {

  public RouteTraffic {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(collectedAt, "collectedAt");
    points = List.copyOf(points);
    if (distanceMeters < 0 || travelTimeSeconds < 0 || trafficDelaySeconds < 0) {
      throw new IllegalArgumentException("route distance, time and delay must be >= 0");
    }
    if (!(congestionLevel >= 0d && congestionLevel <= 1d)) {
      throw new IllegalArgumentException("congestionLevel must be within [0, 1] (was " + congestionLevel + ")");
    }
  }

  /**
   * Buckets a route the same way as a flow segment: the average speed with traffic is compared with the speed the
   * route would allow without the traffic delay.
   *
   * @param distanceMeters route length
   * @param travelTimeSeconds travel time with traffic
   * @param trafficDelaySeconds delay caused by traffic
   * @return congestion level
   */
  public static double congestionFor(long distanceMeters, long travelTimeSeconds, long trafficDelaySeconds) {
    if (distanceMeters <= 0 || travelTimeSeconds <= 0) {
      return 0.0d;
    }
    double current = distanceMeters / (double) travelTimeSeconds * 3.6d;
    long freeFlowSeconds = travelTimeSeconds - Math.max(0L, trafficDelaySeconds);
    double freeFlow = freeFlowSeconds > 0 ? distanceMeters / (double) freeFlowSeconds * 3.6d : current;
    return CongestionLevels.fromSpeeds(current, freeFlow);
  }
}
