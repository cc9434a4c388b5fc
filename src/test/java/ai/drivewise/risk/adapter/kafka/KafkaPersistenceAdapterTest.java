package ai.drivewise.risk.adapter.kafka;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.risk.RiskFusionEngine;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import ai.drivewise.risk.testutil.MutableClock;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.Test;

class KafkaPersistenceAdapterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Coordinate POINT = new Coordinate(33.4484, -112.0740);

  @Test
  void publishesEachStreamToItsVersionedTopic() throws SinkException {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaPersistenceAdapter adapter = new KafkaPersistenceAdapter(producer, "drivewise");
    TrafficSample sample = TrafficSample.live(POINT, 50d, 60d, false, 1d, NOW);
    VehicleSafetyRecord vehicle = VehicleSafetyRecord.substitute(
        VehicleQuery.of(2018, "Mazda", "CX-5"), VehicleSourceTag.DEFAULT, 0, NOW);
    RiskScore score = new RiskFusionEngine().fuse("driver-42", BehavioralFactors.none(), sample, vehicle, NOW);

    adapter.persistTraffic(List.of(sample));
    adapter.persistVehicles(List.of(vehicle));
    adapter.persistRiskScores(List.of(score));
    adapter.flush();

    List<ProducerRecord<String, byte[]>> history = producer.history();
    assertEquals(3, history.size());
    assertEquals("drivewise.traffic.v1", history.get(0).topic());
    assertEquals(sample.sampleId(), history.get(0).key());
    assertEquals("drivewise.vehicles.v1", history.get(1).topic());
    assertEquals("2018|MAZDA|CX-5", history.get(1).key());
    assertEquals("drivewise.risk-scores.v1", history.get(2).topic());
    assertEquals("driver-42", history.get(2).key());
    String json = new String(history.get(2).value(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"type\":\"risk_score\""));
    assertTrue(json.contains("\"vehicleProvenance\":\"DEFAULT\""));
  }

  @Test
  void asyncSendFailureSurfacesOnNextCall() throws SinkException {
    MockProducer<String, byte[]> producer = MockProducerFactory.manual();
    KafkaPersistenceAdapter adapter = new KafkaPersistenceAdapter(producer, "drivewise");

    adapter.persistTraffic(List.of(TrafficSample.fallback(POINT, NOW)));
    assertTrue(producer.errorNext(new TimeoutException("broker unavailable")));

    SinkException ex = assertThrows(
        SinkException.class, () -> adapter.persistTraffic(List.of(TrafficSample.fallback(POINT, NOW))));
    assertInstanceOf(TimeoutException.class, ex.getCause());
    adapter.persistTraffic(List.of(TrafficSample.fallback(POINT, NOW)));
  }

  @Test
  void closeClosesProducer() throws SinkException {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaPersistenceAdapter adapter = new KafkaPersistenceAdapter(producer, "fleet");

    adapter.close();

    assertTrue(producer.closed());
  }

  @Test
  void rejectsInvalidTopicPrefix() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new KafkaPersistenceAdapter(MockProducerFactory.autoCompleting(), "bad topic!"));
  }

  @Test
  void modelRefreshPublishesProcedureSynchronously() throws SinkException {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaModelRefreshAdapter adapter = new KafkaModelRefreshAdapter(producer, "drivewise", new MutableClock());

    adapter.trigger("update_risk_scores");

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("drivewise.model-refresh.v1", record.topic());
    assertEquals("update_risk_scores", record.key());
    assertTrue(new String(record.value(), StandardCharsets.UTF_8).contains("\"procedure\":\"update_risk_scores\""));
  }

  @Test
  void modelRefreshFailureIsReported() {
    MockProducer<String, byte[]> producer = MockProducerFactory.manual();
    KafkaModelRefreshAdapter adapter = new KafkaModelRefreshAdapter(producer, "drivewise", new MutableClock());
    Thread failer = new Thread(() -> {
      long deadline = System.nanoTime() + 5_000_000_000L;
      while (!producer.errorNext(new TimeoutException("no leader")) && System.nanoTime() < deadline) {
        Thread.onSpinWait();
      }
    });
    failer.start();

    SinkException ex = assertThrows(SinkException.class, () -> adapter.trigger("update_safety_scores"));

    assertInstanceOf(TimeoutException.class, ex.getCause());
  }
}
