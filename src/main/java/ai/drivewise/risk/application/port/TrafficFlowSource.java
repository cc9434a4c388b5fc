package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;

/**
 * <strong>What:</strong> Port returning the current traffic flow at a coordinate.
 * <p><strong>Why:</strong> Fusion always needs a traffic value, so failures are absorbed here instead of in every
 * caller.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a {@code LIVE} sample when the upstream call succeeds.</li>
 *   <li>Return the conservative {@code FALLBACK} sample on any transport or parse failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are invoked concurrently by poller workers.</p>
 *
 * @since 0.1.0
 */
public interface TrafficFlowSource {
  /**
   * Fetches the traffic sample for {@code coordinate}; never throws for upstream failures.
   *
   * @param coordinate sampled location; must not be {@code null}
   * @return live or fallback sample
   */
  TrafficSample fetch(Coordinate coordinate);
}
