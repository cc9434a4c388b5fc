package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import java.util.Optional;

/**
 * Port returning the traffic summary for a route.
 *
 * <p>Unlike {@link TrafficFlowSource} there is no conservative substitute for a route, so failures yield an empty
 * result.</p>
 *
 * @since 0.1.0
 */
public interface RouteTrafficSource {
  /**
   * Calculates the route from {@code origin} to {@code destination} under current traffic; never throws for
   * upstream failures.
   *
   * @param origin route start; must not be {@code null}
   * @param destination route end; must not be {@code null}
   * @return route summary, or empty when the upstream found no route or failed
   */
  Optional<RouteTraffic> route(Coordinate origin, Coordinate destination);
}
