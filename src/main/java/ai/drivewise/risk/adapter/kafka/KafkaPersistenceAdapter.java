package ai.drivewise.risk.adapter.kafka;

import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.infrastructure.persistence.RecordJsonWriter;
import ai.drivewise.risk.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link PersistencePort} publishing each record as JSON.
 * <p><strong>Topics:</strong> {@code <prefix>.traffic.v1}, {@code <prefix>.incidents.v1},
 * {@code <prefix>.vehicles.v1} and {@code <prefix>.risk-scores.v1}.</p>
 * <p><strong>Keys:</strong> sample id, incident id, vehicle key and subject id, so updates for one vehicle or
 * subject stay ordered within a partition.</p>
 * <p><strong>Failure handling:</strong> Sends are asynchronous. A failed send is remembered and surfaces as a
 * {@link SinkException} from the next {@link #flush()}, so the sweep that produced the record fails.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaPersistenceAdapter implements PersistencePort {
  private static final Logger log = LoggerFactory.getLogger(KafkaPersistenceAdapter.class);

  private final Producer<String, byte[]> producer;
  private final String trafficTopic;
  private final String incidentsTopic;
  private final String vehiclesTopic;
  private final String riskScoresTopic;
  private final RecordJsonWriter json = new RecordJsonWriter();
  private final AtomicReference<Exception> sendFailure = new AtomicReference<>();

  /**
   * Creates the sink with its own producer.
   *
   * @param bootstrapServers comma-separated {@code host:port} list
   * @param topicPrefix topic prefix, e.g. {@code drivewise}
   */
  public KafkaPersistenceAdapter(String bootstrapServers, String topicPrefix) {
    this(KafkaProducers.create(bootstrapServers, "drivewise-sink"), topicPrefix);
  }

  KafkaPersistenceAdapter(Producer<String, byte[]> producer, String topicPrefix) {
    this.producer = Objects.requireNonNull(producer, "producer");
    String prefix = Strings.sanitizeTopic("kafka.topicPrefix", topicPrefix);
    this.trafficTopic = prefix + ".traffic.v1";
    this.incidentsTopic = prefix + ".incidents.v1";
    this.vehiclesTopic = prefix + ".vehicles.v1";
    this.riskScoresTopic = prefix + ".risk-scores.v1";
  }

  @Override
  public void persistTraffic(List<TrafficSample> samples) throws SinkException {
    publish(trafficTopic, samples, TrafficSample::sampleId, json::traffic);
  }

  @Override
  public void persistIncidents(List<Incident> incidents) throws SinkException {
    publish(incidentsTopic, incidents, Incident::id, json::incident);
  }

  @Override
  public void persistVehicles(List<VehicleSafetyRecord> records) throws SinkException {
    publish(vehiclesTopic, records, VehicleSafetyRecord::key, json::vehicle);
  }

  @Override
  public void persistRiskScores(List<RiskScore> scores) throws SinkException {
    publish(riskScoresTopic, scores, RiskScore::subjectId, json::riskScore);
  }

  @Override
  public void flush() throws SinkException {
    try {
      producer.flush();
    } catch (KafkaException ex) {
      throw new SinkException("Kafka flush failed", ex);
    }
    rethrowSendFailure();
  }

  @Override
  public void close() throws SinkException {
    try {
      producer.flush();
      producer.close(Duration.ofSeconds(5));
    } catch (KafkaException ex) {
      throw new SinkException("Kafka producer did not close cleanly", ex);
    }
    rethrowSendFailure();
  }

  private <T> void publish(String topic, List<T> records, Function<T, String> key, Function<T, byte[]> encoder)
      throws SinkException {
    rethrowSendFailure();
    for (T record : records) {
      ProducerRecord<String, byte[]> message = new ProducerRecord<>(topic, key.apply(record), encoder.apply(record));
      try {
        producer.send(message, (metadata, error) -> {
          if (error != null && sendFailure.compareAndSet(null, error)) {
            log.error("Kafka send to {} failed", topic, error);
          }
        });
      } catch (KafkaException ex) {
        throw new SinkException("Kafka send to " + topic + " failed", ex);
      }
    }
  }

  private void rethrowSendFailure() throws SinkException {
    Exception failure = sendFailure.getAndSet(null);
    if (failure != null) {
      throw new SinkException("earlier Kafka send failed", failure);
    }
  }
}
