package ai.drivewise.risk.domain.risk;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.RiskScore.TrafficProvenance;
import ai.drivewise.risk.domain.risk.RiskScore.VehicleProvenance;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.traffic.TrafficSourceTag;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class RiskFusionEngineTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Coordinate WHERE = new Coordinate(37.7749, -122.4194);

  private final RiskFusionEngine engine = new RiskFusionEngine();

  @Test
  void fusesBehaviourTrafficAndVehicle() {
    BehavioralFactors factors = new BehavioralFactors(Map.of(BehavioralFactors.SPEEDING, 0.8d));
    TrafficSample traffic = TrafficSample.live(WHERE, 25d, 50d, false, 0.9d, NOW);
    VehicleSafetyRecord vehicle = liveRecord(5);

    RiskScore score = engine.fuse("driver-1", factors, traffic, vehicle, NOW);

    assertEquals(0.6d, traffic.congestionLevel(), 1e-9);
    assertEquals(0.13d, score.overall(), 1e-9);
    assertEquals(0.8d, score.breakdown().get(BehavioralFactors.SPEEDING), 1e-9);
    assertEquals(0.03d, score.breakdown().get(RiskScore.TRAFFIC_SLOT), 1e-9);
    assertEquals(0.10d, score.breakdown().get(RiskScore.VEHICLE_SLOT), 1e-9);
    assertEquals(0.95d, score.confidence(), 1e-9);
    assertEquals(NOW, score.computedAt());
    assertEquals(Optional.of(traffic.sampleId()), score.inputs().trafficSampleId());
    assertEquals(Optional.of(vehicle.recordId()), score.inputs().vehicleRecordId());
    assertEquals(TrafficProvenance.LIVE, score.provenance().traffic());
    assertEquals(VehicleProvenance.LIVE, score.provenance().vehicle());
  }

  @Test
  void breakdownListsFactorsThenTrafficThenVehicle() {
    RiskScore score = engine.fuse("s", BehavioralFactors.none(), null, null, NOW);

    List<String> keys = List.copyOf(score.breakdown().keySet());
    assertEquals(BehavioralFactors.KNOWN_FACTORS, keys.subList(0, 6));
    assertEquals(List.of(RiskScore.TRAFFIC_SLOT, RiskScore.VEHICLE_SLOT), keys.subList(6, 8));
  }

  @Test
  void missingSignalsContributeNothingAndKeepFullConfidence() {
    RiskScore score = engine.fuse("s", BehavioralFactors.none(), null, null, NOW);

    assertEquals(0d, score.overall(), 0d);
    assertEquals(0.95d, score.confidence(), 1e-9);
    assertTrue(score.inputs().trafficSampleId().isEmpty());
    assertTrue(score.inputs().vehicleRecordId().isEmpty());
    assertEquals(TrafficProvenance.ABSENT, score.provenance().traffic());
    assertEquals(VehicleProvenance.ABSENT, score.provenance().vehicle());
  }

  @Test
  void substitutedInputsLowerConfidence() {
    TrafficSample fallback = TrafficSample.fallback(WHERE, NOW);
    VehicleSafetyRecord errored = VehicleSafetyRecord.substitute(
        VehicleQuery.of(2020, "Honda", "Civic"), VehicleSourceTag.ERROR_FALLBACK, 0, NOW);

    RiskScore score = engine.fuse("s", BehavioralFactors.none(), fallback, errored, NOW);

    assertEquals(0.95d - 0.08d - 0.05d, score.confidence(), 1e-9);
    assertEquals(TrafficProvenance.FALLBACK, score.provenance().traffic());
    assertEquals(VehicleProvenance.ERROR_FALLBACK, score.provenance().vehicle());
    assertEquals(0d, score.breakdown().get(RiskScore.VEHICLE_SLOT), 0d);
  }

  @Test
  void defaultVehicleDoesNotPenaliseConfidence() {
    VehicleSafetyRecord defaulted = VehicleSafetyRecord.substitute(
        VehicleQuery.of(2020, "Honda", "Civic"), VehicleSourceTag.DEFAULT, 0, NOW);

    RiskScore score = engine.fuse("s", BehavioralFactors.none(), null, defaulted, NOW);

    assertEquals(0.95d, score.confidence(), 1e-9);
    assertEquals(VehicleProvenance.DEFAULT, score.provenance().vehicle());
    assertEquals(0.05d, score.breakdown().get(RiskScore.VEHICLE_SLOT), 1e-9);
  }

  @Test
  void unratedLiveRecordIsReportedAsUnrated() {
    VehicleSafetyRecord unrated = record(OptionalInt.empty());

    RiskScore score = engine.fuse("s", BehavioralFactors.none(), null, unrated, NOW);

    assertEquals(VehicleProvenance.UNRATED, score.provenance().vehicle());
    assertEquals(0d, score.breakdown().get(RiskScore.VEHICLE_SLOT), 0d);
  }

  @Test
  void overallIsClampedToUnitRange() {
    Map<String, Double> maxed = Map.of(
        BehavioralFactors.SPEEDING, 5d,
        BehavioralFactors.HARD_BRAKING, 1d,
        BehavioralFactors.ACCELERATION, 1d,
        BehavioralFactors.DISTRACTION, 1d,
        BehavioralFactors.TIME_OF_DAY, 1d,
        BehavioralFactors.WEATHER, 1d);
    TrafficSample jammed = TrafficSample.live(WHERE, 1d, 50d, true, 1d, NOW);

    RiskScore high = engine.fuse("s", new BehavioralFactors(maxed), jammed, null, NOW);
    RiskScore low = engine.fuse("s", BehavioralFactors.none(), null, liveRecord(5), NOW);

    assertEquals(1d, high.breakdown().get(BehavioralFactors.SPEEDING), 0d);
    assertEquals(0.93d + 0.05d, high.overall(), 1e-9);
    assertEquals(0d, low.overall(), 0d);
  }

  @Test
  void customWeightsAreApplied() {
    Map<String, Double> weights = Map.of(
        BehavioralFactors.SPEEDING, 1d,
        BehavioralFactors.HARD_BRAKING, 0d,
        BehavioralFactors.ACCELERATION, 0d,
        BehavioralFactors.DISTRACTION, 0d,
        BehavioralFactors.TIME_OF_DAY, 0d,
        BehavioralFactors.WEATHER, 0d);
    RiskFusionEngine custom = new RiskFusionEngine(new FusionWeights(weights, 0d, 0.5d, 0d));
    TrafficSample traffic = TrafficSample.live(WHERE, 50d, 50d, false, 1d, NOW);

    RiskScore score = custom.fuse(
        "s", new BehavioralFactors(Map.of(BehavioralFactors.SPEEDING, 0.4d)), traffic, liveRecord(5), NOW);

    assertEquals(0.4d, score.overall(), 1e-9);
  }

  @Test
  void fusionIsDeterministicForIdenticalInputs() {
    BehavioralFactors factors = new BehavioralFactors(Map.of(BehavioralFactors.DISTRACTION, 0.3d));
    TrafficSample traffic = TrafficSample.live(WHERE, 30d, 50d, false, 0.9d, NOW);

    RiskScore first = engine.fuse("s", factors, traffic, null, NOW);
    RiskScore second = engine.fuse("s", factors, traffic, null, NOW);

    assertEquals(first, second);
  }

  private static VehicleSafetyRecord liveRecord(int rating) {
    return record(OptionalInt.of(rating));
  }

  private static VehicleSafetyRecord record(OptionalInt rating) {
    return new VehicleSafetyRecord(
        "vs-test",
        "HONDA",
        "CIVIC",
        2020,
        Optional.empty(),
        rating,
        OptionalInt.empty(),
        OptionalInt.empty(),
        OptionalInt.empty(),
        0,
        "2020 Honda Civic 4 DR FWD",
        OptionalLong.of(12345L),
        NOW,
        VehicleSourceTag.LIVE);
  }

  @Test
  void trafficTagDrivesProvenance() {
    TrafficSample live = TrafficSample.live(WHERE, 40d, 50d, false, 1d, NOW);
    assertEquals(TrafficSourceTag.LIVE, live.sourceTag());
    assertEquals(
        TrafficProvenance.LIVE, engine.fuse("s", BehavioralFactors.none(), live, null, NOW).provenance().traffic());
  }
}
