package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.RateGate;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.RouteTrafficSource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up live traffic along a route on demand, taking a slot on the TomTom gate the sweeps use.
 *
 * @since 0.1.0
 */
public final class RouteTrafficUseCase {
  private static final Logger log = LoggerFactory.getLogger(RouteTrafficUseCase.class);

  private final RouteTrafficSource source;
  private final RateGate gate;
  private final MetricsPort metrics;

  public RouteTrafficUseCase(RouteTrafficSource source, RateGate gate, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Calculates the route between two points.
   *
   * @param origin route start
   * @param destination route end
   * @return route summary, or empty when no route was found, the upstream failed or the wait was interrupted
   */
  public Optional<RouteTraffic> lookup(Coordinate origin, Coordinate destination) {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(destination, "destination");
    try {
      gate.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("route.interrupted");
      log.info("Interrupted waiting for the route gate");
      return Optional.empty();
    }
    Optional<RouteTraffic> route = source.route(origin, destination);
    route.ifPresent(found -> log.debug("Route {} -> {}: {} m, {} s delay, congestion {}",
        origin.toQueryValue(), destination.toQueryValue(), found.distanceMeters(), found.trafficDelaySeconds(),
        found.congestionLevel()));
    return route;
  }
}
