package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import java.util.Collection;
import java.util.Optional;

/**
 * Latest-value store bridging periodic sweeps and on-demand scoring.
 *
 * <p>Sweeps write what they collected; scoring reads the newest sample nearest to the subject and the newest
 * record for the subject's vehicle.</p>
 *
 * @since 0.1.0
 */
public interface SignalCachePort {
  /**
   * Stores traffic samples, replacing older samples at the same coordinate.
   *
   * @param samples samples to store
   */
  void putTraffic(Collection<TrafficSample> samples);

  /**
   * Stores vehicle records, replacing older records with the same key.
   *
   * @param records records to store
   */
  void putVehicles(Collection<VehicleSafetyRecord> records);

  /**
   * Returns the stored sample closest to {@code location} within {@code maxDistanceKm}.
   *
   * @param location subject location
   * @param maxDistanceKm search radius in kilometres
   * @return nearest sample, or empty when none is close enough
   */
  Optional<TrafficSample> nearestTraffic(Coordinate location, double maxDistanceKm);

  /**
   * Returns the stored record for a vehicle key.
   *
   * @param vehicleKey key from {@code VehicleQuery.key()}
   * @return latest record, or empty
   */
  Optional<VehicleSafetyRecord> vehicle(String vehicleKey);
}
