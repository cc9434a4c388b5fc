package ai.drivewise.risk.infrastructure.source;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.TrafficFlowSource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import java.util.Objects;

/**
 * Traffic source used when no TomTom key is configured: every lookup yields the fallback sample.
 *
 * @since 0.1.0
 */
public final class FallbackTrafficFlowSource implements TrafficFlowSource {
  private final ClockPort clock;

  public FallbackTrafficFlowSource(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public TrafficSample fetch(Coordinate coordinate) {
    return TrafficSample.fallback(Objects.requireNonNull(coordinate, "coordinate"), clock.now());
  }
}
