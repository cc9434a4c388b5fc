package ai.drivewise.risk.adapter.kafka;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.ModelRefreshPort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.infrastructure.persistence.RecordJsonWriter;
import ai.drivewise.risk.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;

/**
 * {@link ModelRefreshPort} publishing refresh requests to {@code <prefix>.model-refresh.v1}, keyed by procedure.
 * Each trigger waits for the broker acknowledgement.
 *
 * @since 0.1.0
 */
public final class KafkaModelRefreshAdapter implements ModelRefreshPort {
  static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final ClockPort clock;
  private final RecordJsonWriter json = new RecordJsonWriter();

  public KafkaModelRefreshAdapter(String bootstrapServers, String topicPrefix, ClockPort clock) {
    this(KafkaProducers.create(bootstrapServers, "drivewise-refresh"), topicPrefix, clock);
  }

  KafkaModelRefreshAdapter(Producer<String, byte[]> producer, String topicPrefix, ClockPort clock) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafka.topicPrefix", topicPrefix) + ".model-refresh.v1";
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void trigger(String procedure) throws SinkException {
    Objects.requireNonNull(procedure, "procedure");
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(topic, procedure, json.modelRefresh(procedure, clock.now()));
    try {
      producer.send(record).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SinkException("interrupted while triggering " + procedure, ex);
    } catch (ExecutionException ex) {
      throw new SinkException("failed to trigger " + procedure, ex.getCause() == null ? ex : ex.getCause());
    } catch (TimeoutException ex) {
      throw new SinkException("timed out triggering " + procedure + " after " + SEND_TIMEOUT.toSeconds() + " s", ex);
    } catch (KafkaException ex) {
      throw new SinkException("failed to trigger " + procedure, ex);
    }
  }

  @Override
  public void close() throws SinkException {
    try {
      producer.close(Duration.ofSeconds(5));
    } catch (KafkaException ex) {
      throw new SinkException("Kafka producer did not close cleanly", ex);
    }
  }
}
