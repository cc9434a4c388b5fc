package ai.drivewise.risk.domain.traffic;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.geo.Coordinate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RouteTrafficTest {
  private static final Coordinate A = new Coordinate(37.7749, -122.4194);
  private static final Coordinate B = new Coordinate(37.8044, -122.2712);

  @Test
  void congestionFollowsTheShareOfTravelTimeLostToTraffic() {
    assertEquals(0.0d, RouteTraffic.congestionFor(10_000, 1000, 0), 0d);
    assertEquals(0.0d, RouteTraffic.congestionFor(10_000, 1000, 100), 0d);
    assertEquals(0.3d, RouteTraffic.congestionFor(10_000, 1000, 200), 0d);
    assertEquals(0.6d, RouteTraffic.congestionFor(10_000, 1000, 400), 0d);
    assertEquals(1.0d, RouteTraffic.congestionFor(10_000, 1000, 600), 0d);
  }

  @Test
  void degenerateRoutesAreNotCongested() {
    assertEquals(0.0d, RouteTraffic.congestionFor(0, 0, 0), 0d);
    assertEquals(0.0d, RouteTraffic.congestionFor(500, 0, 0), 0d);
    assertEquals(0.0d, RouteTraffic.congestionFor(500, 60, 60), 0d);
  }

  @Test
  void rejectsNegativeDurationsAndCopiesPoints() {
    Instant now = Instant.parse("2024-05-01T12:00:00Z");
    assertThrows(IllegalArgumentException.class, () -> new RouteTraffic(A, B, 100, -1, 0, 0d, List.of(), now));
    assertThrows(IllegalArgumentException.class, () -> new RouteTraffic(A, B, 100, 10, 0, 1.5d, List.of(), now));

    RouteTraffic route = new RouteTraffic(A, B, 100, 10, 0, 0d, new ArrayList<>(List.of(A, B)), now);
    assertThrows(UnsupportedOperationException.class, () -> route.points().add(A));
  }
}
