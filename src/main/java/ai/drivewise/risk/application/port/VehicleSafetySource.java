package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;

/**
 * <strong>What:</strong> Port rating a vehicle's crash safety.
 * <p><strong>Responsibilities:</strong> Apply the three-tier fallback:
 * <ol>
 *   <li>explicit numeric rating: {@code LIVE};</li>
 *   <li>lookup succeeded without a rating: {@code DEFAULT} with rating 4;</li>
 *   <li>lookup failed: {@code ERROR_FALLBACK} with rating 3.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Implementations are invoked concurrently by poller workers.</p>
 *
 * @since 0.1.0
 */
public interface VehicleSafetySource {
  /**
   * Rates the vehicle; never throws for upstream failures.
   *
   * @param query vehicle to rate; must not be {@code null}
   * @return tagged safety record
   */
  VehicleSafetyRecord rate(VehicleQuery query);
}
