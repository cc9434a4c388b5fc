package ai.drivewise.risk.infrastructure.source.tomtom;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import ai.drivewise.risk.infrastructure.http.HttpStatusException;
import ai.drivewise.risk.testutil.FakeJsonHttpClient;
import ai.drivewise.risk.testutil.MutableClock;
import ai.drivewise.risk.testutil.RecordingMetrics;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TomTomRouteTrafficSourceTest {
  private static final URI BASE = URI.create("https://api.tomtom.com/routing");
  private static final Coordinate FROM = new Coordinate(37.7749, -122.4194);
  private static final Coordinate TO = new Coordinate(37.8044, -122.2712);

  private FakeJsonHttpClient http;
  private RecordingMetrics metrics;
  private MutableClock clock;
  private TomTomRouteTrafficSource source;

  @BeforeEach
  void setUp() {
    http = new FakeJsonHttpClient();
    metrics = new RecordingMetrics();
    clock = new MutableClock();
    source = new TomTomRouteTrafficSource(http, BASE, "secret-key", clock, metrics);
  }

  @Test
  void parsesSummaryAndGeometryOfTheFirstRoute() {
    http.respond("calculateRoute", """
        {"routes": [
          {"summary": {"lengthInMeters": 19000, "travelTimeInSeconds": 1500, "trafficDelayInSeconds": 300},
           "legs": [{"points": [{"latitude": 37.7749, "longitude": -122.4194},
                                {"latitude": 37.7983, "longitude": -122.3778},
                                {"latitude": 37.8044, "longitude": -122.2712}]}]},
          {"summary": {"lengthInMeters": 25000, "travelTimeInSeconds": 1600, "trafficDelayInSeconds": 0}}]}
        """);

    RouteTraffic route = source.route(FROM, TO).orElseThrow();

    assertEquals(19000L, route.distanceMeters());
    assertEquals(1500L, route.travelTimeSeconds());
    assertEquals(300L, route.trafficDelaySeconds());
    assertEquals(0.3d, route.congestionLevel(), 0d);
    assertEquals(3, route.points().size());
    assertEquals(new Coordinate(37.7983, -122.3778), route.points().get(1));
    assertEquals(clock.now(), route.collectedAt());
    assertEquals(1, metrics.count("source.route.live"));
  }

  @Test
  void requestCarriesBothEndpointsKeyAndTraffic() {
    URI uri = source.routeUri(FROM, TO);

    assertEquals("/routing/1/calculateRoute/37.7749,-122.4194:37.8044,-122.2712/json", uri.getPath());
    assertEquals("key=secret-key&traffic=true&travelMode=car", uri.getQuery());
  }

  @Test
  void responseWithoutRoutesIsEmpty() {
    http.respond("calculateRoute", "{\"formatVersion\": \"0.0.12\", \"routes\": []}");

    assertEquals(Optional.empty(), source.route(FROM, TO));
    assertEquals(1, metrics.count("source.route.empty"));
  }

  @Test
  void upstreamErrorIsEmptyAndCounted() {
    http.fail("calculateRoute", new HttpStatusException(403, "HTTP 403 Forbidden"));

    assertEquals(Optional.empty(), source.route(FROM, TO));
    assertEquals(1, metrics.count("source.route.error"));
  }

  @Test
  void routeWithoutLegsHasNoGeometry() {
    http.respond("calculateRoute", """
        {"routes": [{"summary": {"lengthInMeters": 800, "travelTimeInSeconds": 60, "trafficDelayInSeconds": 0}}]}
        """);

    RouteTraffic route = source.route(FROM, TO).orElseThrow();

    assertEquals(List.of(), route.points());
    assertEquals(0.0d, route.congestionLevel(), 0d);
  }
}
