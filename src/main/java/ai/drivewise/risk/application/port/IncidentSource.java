package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.Incident;
import java.util.List;

/**
 * Port returning traffic incidents around a coordinate.
 *
 * <p>Incidents are best-effort context: a failed fetch returns an empty list. Implementations log and count the
 * failure so "none found" and "fetch failed" remain distinguishable in telemetry.</p>
 *
 * @since 0.1.0
 */
public interface IncidentSource {
  /**
   * Fetches incidents within {@code radiusKm} of {@code center}; never throws for upstream failures.
   *
   * @param center search centre
   * @param radiusKm search radius in kilometres
   * @return incidents, possibly empty
   */
  List<Incident> fetch(Coordinate center, double radiusKm);

  /**
   * Source used when incidents are disabled.
   */
  IncidentSource NONE = (center, radiusKm) -> List.of();
}
