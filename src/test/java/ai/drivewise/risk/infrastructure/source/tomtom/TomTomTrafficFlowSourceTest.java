package ai.drivewise.risk.infrastructure.source.tomtom;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.traffic.TrafficSourceTag;
import ai.drivewise.risk.infrastructure.http.HttpStatusException;
import ai.drivewise.risk.testutil.FakeJsonHttpClient;
import ai.drivewise.risk.testutil.MutableClock;
import ai.drivewise.risk.testutil.RecordingMetrics;
import java.net.URI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TomTomTrafficFlowSourceTest {
  private static final URI BASE = URI.create("https://api.tomtom.com/traffic");
  private static final Coordinate POINT = new Coordinate(47.6062, -122.3321);

  private FakeJsonHttpClient http;
  private RecordingMetrics metrics;
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    http = new FakeJsonHttpClient();
    metrics = new RecordingMetrics();
    clock = new MutableClock();
  }

  @Test
  void parsesFlowSegment() {
    http.respond("flowSegmentData", """
        {"flowSegmentData": {"frc": "FRC2", "currentSpeed": 30, "freeFlowSpeed": 60,
          "confidence": 0.87, "roadClosure": false}}
        """);

    TrafficSample sample = flows().fetch(POINT);

    assertEquals(TrafficSourceTag.LIVE, sample.sourceTag());
    assertEquals(30d, sample.currentSpeed(), 0d);
    assertEquals(60d, sample.freeFlowSpeed(), 0d);
    assertEquals(0.6d, sample.congestionLevel(), 0d);
    assertEquals(0.87d, sample.confidence(), 1e-9);
    assertEquals(clock.now(), sample.collectedAt());
    assertEquals(1, metrics.count("source.traffic.live"));
  }

  @Test
  void requestCarriesKeyPointAndUnit() {
    URI uri = flows().flowUri(POINT);

    assertEquals("/traffic/services/4/flowSegmentData/absolute/10/json", uri.getPath());
    assertEquals("key=secret-key&point=47.6062,-122.3321&unit=KMPH", uri.getQuery());
  }

  @Test
  void upstreamErrorYieldsFallback() {
    http.fail("flowSegmentData", new HttpStatusException(429, "HTTP 429 Too Many Requests"));

    TrafficSample sample = flows().fetch(POINT);

    assertEquals(TrafficSourceTag.FALLBACK, sample.sourceTag());
    assertEquals(0.1d, sample.congestionLevel(), 0d);
    assertEquals(POINT, sample.coordinate());
    assertEquals(1, metrics.count("source.traffic.fallback"));
  }

  @Test
  void missingSpeedsYieldFallback() {
    http.respond("flowSegmentData", "{\"flowSegmentData\": {\"currentSpeed\": 12}}");

    assertEquals(TrafficSourceTag.FALLBACK, flows().fetch(POINT).sourceTag());
  }

  @Test
  void unexpectedShapeYieldsFallback() {
    http.respond("flowSegmentData", "{\"error\": \"Point too far from nearest existing segment.\"}");

    assertEquals(TrafficSourceTag.FALLBACK, flows().fetch(POINT).sourceTag());
  }

  @Test
  void closedRoadIsReported() {
    http.respond("flowSegmentData", """
        {"flowSegmentData": {"currentSpeed": 0, "freeFlowSpeed": 80, "roadClosure": true}}
        """);

    TrafficSample sample = flows().fetch(POINT);

    assertTrue(sample.roadClosed());
    assertEquals(1.0d, sample.congestionLevel(), 0d);
    assertEquals(1.0d, sample.confidence(), 0d);
  }

  private TomTomTrafficFlowSource flows() {
    return new TomTomTrafficFlowSource(http, BASE, "secret-key", clock, metrics);
  }
}
