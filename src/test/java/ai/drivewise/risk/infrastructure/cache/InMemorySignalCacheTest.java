package ai.drivewise.risk.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import ai.drivewise.risk.testutil.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySignalCacheTest {
  private static final Coordinate POINT = new Coordinate(40.7128, -74.0060);

  private MutableClock clock;
  private InMemorySignalCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    cache = new InMemorySignalCache(clock, Duration.ofHours(1));
  }

  @Test
  void returnsNearestSampleWithinRadius() {
    TrafficSample near = TrafficSample.live(new Coordinate(40.72, -74.0), 40d, 50d, false, 1d, clock.now());
    TrafficSample far = TrafficSample.live(new Coordinate(40.9, -74.0), 40d, 50d, false, 1d, clock.now());
    cache.putTraffic(List.of(far, near));

    assertEquals(Optional.of(near), cache.nearestTraffic(POINT, 15d));
    assertTrue(cache.nearestTraffic(new Coordinate(34.05, -118.24), 15d).isEmpty());
  }

  @Test
  void staleSamplesAreIgnored() {
    cache.putTraffic(List.of(TrafficSample.live(POINT, 40d, 50d, false, 1d, clock.now())));

    clock.advance(Duration.ofMinutes(61));

    assertTrue(cache.nearestTraffic(POINT, 15d).isEmpty());
  }

  @Test
  void liveSampleIsNotReplacedByFallbackAtSamePoint() {
    TrafficSample live = TrafficSample.live(POINT, 20d, 50d, false, 1d, clock.now());
    cache.putTraffic(List.of(live));
    cache.putTraffic(List.of(TrafficSample.fallback(POINT, clock.now())));

    assertEquals(Optional.of(live), cache.nearestTraffic(POINT, 1d));
    assertEquals(1, cache.trafficSize());

    TrafficSample newer = TrafficSample.live(POINT, 45d, 50d, false, 1d, clock.now());
    cache.putTraffic(List.of(newer));
    assertEquals(Optional.of(newer), cache.nearestTraffic(POINT, 1d));
  }

  @Test
  void errorFallbackDoesNotOverwriteBetterVehicleRecord() {
    VehicleQuery query = VehicleQuery.of(2022, "Tesla", "Model 3");
    VehicleSafetyRecord defaulted = VehicleSafetyRecord.substitute(query, VehicleSourceTag.DEFAULT, 1, clock.now());
    cache.putVehicles(List.of(defaulted));
    cache.putVehicles(List.of(
        VehicleSafetyRecord.substitute(query, VehicleSourceTag.ERROR_FALLBACK, 0, clock.now())));

    assertEquals(Optional.of(defaulted), cache.vehicle(query.key()));
    assertTrue(cache.vehicle("UNKNOWN").isEmpty());
  }

  @Test
  void fallbackReplacesLiveSampleOnceItHasAgedOut() {
    cache.putTraffic(List.of(TrafficSample.live(POINT, 20d, 50d, false, 1d, clock.now())));
    clock.advance(Duration.ofHours(2));
    TrafficSample fallback = TrafficSample.fallback(POINT, clock.now());

    cache.putTraffic(List.of(fallback));

    assertEquals(Optional.of(fallback), cache.nearestTraffic(POINT, 1d));
  }

  @Test
  void errorFallbackReplacesVehicleRecordOnceItHasAgedOut() {
    VehicleQuery query = VehicleQuery.of(2020, "Honda", "Civic");
    cache.putVehicles(List.of(VehicleSafetyRecord.substitute(query, VehicleSourceTag.DEFAULT, 1, clock.now())));
    clock.advance(InMemorySignalCache.DEFAULT_MAX_VEHICLE_AGE.plusHours(1));

    assertTrue(cache.vehicle(query.key()).isEmpty());

    VehicleSafetyRecord fallback =
        VehicleSafetyRecord.substitute(query, VehicleSourceTag.ERROR_FALLBACK, 0, clock.now());
    cache.putVehicles(List.of(fallback));
    assertEquals(Optional.of(fallback), cache.vehicle(query.key()));
  }

  @Test
  void rejectsNonPositiveAge() {
    assertThrows(IllegalArgumentException.class, () -> new InMemorySignalCache(clock, Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> new InMemorySignalCache(clock, Duration.ofHours(1), Duration.ofSeconds(-1)));
  }
}
