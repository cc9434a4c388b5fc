package ai.drivewise.risk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.drivewise.risk.application.pipeline.ScoreRequest;
import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.application.schedule.JobKind;
import ai.drivewise.risk.application.schedule.JobStatus;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.infrastructure.refresh.LoggingModelRefreshAdapter;
import ai.drivewise.risk.testutil.FakeJsonHttpClient;
import ai.drivewise.risk.testutil.MutableClock;
import ai.drivewise.risk.testutil.RecordingMetrics;
import ai.drivewise.risk.testutil.RecordingPersistence;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void schedulesOnlyEnabledJobs() throws SinkException {
    EngineConfig config = EngineConfig.fromMap(Map.of("regions", "Toronto:43.65,-79.38"));
    RecordingPersistence sink = new RecordingPersistence();

    try (CompositionRoot root = root(config, sink)) {
      List<JobStatus> statuses = root.scheduler().statuses();
      assertEquals(1, statuses.size());
      assertEquals(JobKind.MODEL_REFRESH, statuses.get(0).kind());
      assertEquals(4, root.jobPlan().size());
    }
    assertTrue(sink.closed);
  }

  @Test
  void enablesEveryJobWhenSourcesAreConfigured() throws SinkException {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "tomtomApiKey", "abc",
        "vehicles", "2020:Honda:Civic",
        "regions", "Toronto:43.65,-79.38"));

    try (CompositionRoot root = root(config, new RecordingPersistence())) {
      assertEquals(4, root.scheduler().statuses().size());
    }
  }

  @Test
  void scoringWithoutApiKeyUsesFallbackTraffic() throws SinkException {
    EngineConfig config = EngineConfig.fromMap(Map.of("regions", "Toronto:43.65,-79.38"));
    RecordingPersistence sink = new RecordingPersistence();

    try (CompositionRoot root = root(config, sink)) {
      RiskScore score = root.scoringUseCase().score(new ScoreRequest(
          "driver-1",
          new BehavioralFactors(Map.of(BehavioralFactors.SPEEDING, 0.5d)),
          Optional.of(new Coordinate(43.65, -79.38)),
          Optional.empty()));

      assertEquals(RiskScore.TrafficProvenance.FALLBACK, score.provenance().traffic());
      assertEquals(1, sink.scores.size());
    }
  }

  @Test
  void routeTrafficIsWiredOnlyWithAnApiKey() throws SinkException {
    EngineConfig keyless = EngineConfig.fromMap(Map.of("regions", "Toronto:43.65,-79.38"));
    try (CompositionRoot root = root(keyless, new RecordingPersistence())) {
      assertTrue(root.routeTraffic().isEmpty());
    }

    FakeJsonHttpClient http = new FakeJsonHttpClient().respond("calculateRoute", """
        {"routes": [{"summary": {"lengthInMeters": 4200, "travelTimeInSeconds": 600, "trafficDelayInSeconds": 0}}]}
        """);
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "tomtomApiKey", "abc",
        "regions", "Toronto:43.65,-79.38",
        "tomtomRoutingBaseUrl", "https://routing.example.test/routing"));
    try (CompositionRoot root = root(config, new RecordingPersistence(), http)) {
      RouteTraffic route = root.routeTraffic().orElseThrow()
          .lookup(new Coordinate(43.65, -79.38), new Coordinate(43.70, -79.42))
          .orElseThrow();

      assertEquals(4200L, route.distanceMeters());
      assertEquals("routing.example.test", http.requests.get(0).getHost());
    }
  }

  @Test
  void closeSurfacesSinkFailure() {
    EngineConfig config = EngineConfig.fromMap(Map.of("regions", "Toronto:43.65,-79.38"));
    CompositionRoot root = root(config, new FailingCloseSink());

    SinkException ex = assertThrows(SinkException.class, root::close);
    assertEquals("disk gone", ex.getMessage());
  }

  private static CompositionRoot root(EngineConfig config, PersistencePort sink) {
    return root(config, sink, new FakeJsonHttpClient());
  }

  private static CompositionRoot root(EngineConfig config, PersistencePort sink, FakeJsonHttpClient http) {
    return new CompositionRoot(
        config,
        new RecordingMetrics(),
        new MutableClock(),
        http,
        sink,
        new LoggingModelRefreshAdapter());
  }

  private static final class FailingCloseSink implements PersistencePort {
    @Override
    public void persistTraffic(List<TrafficSample> samples) {}

    @Override
    public void persistIncidents(List<Incident> incidents) {}

    @Override
    public void persistVehicles(List<VehicleSafetyRecord> records) {}

    @Override
    public void persistRiskScores(List<RiskScore> scores) {}

    @Override
    public void close() throws SinkException {
      throw new SinkException("disk gone");
    }
  }
}
