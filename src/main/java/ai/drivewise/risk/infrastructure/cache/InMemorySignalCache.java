package ai.drivewise.risk.infrastructure.cache;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.SignalCachePort;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.traffic.TrafficSourceTag;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Latest-signal cache held in memory.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>One traffic sample per sampled point (rounded to 4 decimals); a fallback sample does not replace a live
 *       one for the same point while the live one is younger than {@code maxTrafficAge}.</li>
 *   <li>Traffic samples older than {@code maxTrafficAge} are ignored by lookups.</li>
 *   <li>One vehicle record per vehicle key; an error-fallback record does not replace a live or default one
 *       younger than {@code maxVehicleAge}.</li>
 *   <li>Vehicle records older than {@code maxVehicleAge} are ignored by lookups.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by concurrent maps; nearest lookup scans a weakly consistent view.</p>
 *
 * @since 0.1.0
 */
public final class InMemorySignalCache implements SignalCachePort {
  /** Default age after which cached traffic is ignored. */
  public static final Duration DEFAULT_MAX_TRAFFIC_AGE = Duration.ofHours(1);
  /** Default age after which a cached vehicle record is ignored. */
  public static final Duration DEFAULT_MAX_VEHICLE_AGE = Duration.ofDays(7);

  private final ConcurrentMap<String, TrafficSample> traffic = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, VehicleSafetyRecord> vehicles = new ConcurrentHashMap<>();
  private final ClockPort clock;
  private final Duration maxTrafficAge;
  private final Duration maxVehicleAge;

  public InMemorySignalCache(ClockPort clock, Duration maxTrafficAge) {
    this(clock, maxTrafficAge, DEFAULT_MAX_VEHICLE_AGE);
  }

  public InMemorySignalCache(ClockPort clock, Duration maxTrafficAge, Duration maxVehicleAge) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxTrafficAge = requirePositive(maxTrafficAge, "maxTrafficAge");
    this.maxVehicleAge = requirePositive(maxVehicleAge, "maxVehicleAge");
  }

  @Override
  public void putTraffic(Collection<TrafficSample> samples) {
    for (TrafficSample sample : samples) {
      traffic.merge(pointKey(sample.coordinate()), sample, this::preferTraffic);
    }
  }

  @Override
  public void putVehicles(Collection<VehicleSafetyRecord> records) {
    for (VehicleSafetyRecord record : records) {
      vehicles.merge(record.key(), record, this::preferVehicle);
    }
  }

  @Override
  public Optional<TrafficSample> nearestTraffic(Coordinate location, double maxDistanceKm) {
    Objects.requireNonNull(location, "location");
    TrafficSample best = null;
    double bestDistance = Double.MAX_VALUE;
    for (TrafficSample sample : traffic.values()) {
      if (olderThan(sample.collectedAt(), maxTrafficAge)) {
        continue;
      }
      double distance = location.distanceKm(sample.coordinate());
      if (distance <= maxDistanceKm && distance < bestDistance) {
        best = sample;
        bestDistance = distance;
      }
    }
    return Optional.ofNullable(best);
  }

  @Override
  public Optional<VehicleSafetyRecord> vehicle(String vehicleKey) {
    VehicleSafetyRecord record = vehicles.get(Objects.requireNonNull(vehicleKey, "vehicleKey"));
    if (record == null || olderThan(record.collectedAt(), maxVehicleAge)) {
      return Optional.empty();
    }
    return Optional.of(record);
  }

  int trafficSize() {
    return traffic.size();
  }

  private TrafficSample preferTraffic(TrafficSample current, TrafficSample incoming) {
    if (incoming.sourceTag() == TrafficSourceTag.FALLBACK
        && current.sourceTag() == TrafficSourceTag.LIVE
        && !olderThan(current.collectedAt(), maxTrafficAge)) {
      return current;
    }
    return incoming;
  }

  private VehicleSafetyRecord preferVehicle(VehicleSafetyRecord current, VehicleSafetyRecord incoming) {
    if (incoming.sourceTag() == VehicleSourceTag.ERROR_FALLBACK
        && current.sourceTag() != VehicleSourceTag.ERROR_FALLBACK
        && !olderThan(current.collectedAt(), maxVehicleAge)) {
      return current;
    }
    return incoming;
  }

  private boolean olderThan(Instant collectedAt, Duration maxAge) {
    return collectedAt.isBefore(clock.now().minus(maxAge));
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  private static String pointKey(Coordinate coordinate) {
    return Math.round(coordinate.latitude() * 10_000d) + ":" + Math.round(coordinate.longitude() * 10_000d);
  }
}
