package ai.drivewise.risk.application.port;

import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import java.util.List;

/**
 * <strong>What:</strong> Append-only sink for collected signals and computed scores.
 * <p><strong>Why:</strong> Lets sweeps emit batches to files, Kafka or nowhere without binding to a vendor API.</p>
 * <p><strong>Role:</strong> Output port implemented by the NDJSON, Kafka and no-op adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist each batch in order; empty batches are no-ops.</li>
 *   <li>Flush buffered records so a cancelled sweep still lands its partial results.</li>
 *   <li>Release underlying resources during shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from concurrently running jobs.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link SinkException}; callers count
 * {@code sweep.*.sink.error}.</p>
 *
 * @since 0.1.0
 */
public interface PersistencePort extends AutoCloseable {
  /**
   * Persists traffic samples.
   *
   * @param samples batch to append; must not be {@code null}
   * @throws SinkException if the sink rejects the write
   */
  void persistTraffic(List<TrafficSample> samples) throws SinkException;

  /**
   * Persists incidents.
   *
   * @param incidents batch to append; must not be {@code null}
   * @throws SinkException if the sink rejects the write
   */
  void persistIncidents(List<Incident> incidents) throws SinkException;

  /**
   * Persists vehicle safety records.
   *
   * @param records batch to append; must not be {@code null}
   * @throws SinkException if the sink rejects the write
   */
  void persistVehicles(List<VehicleSafetyRecord> records) throws SinkException;

  /**
   * Persists risk scores.
   *
   * @param scores batch to append; must not be {@code null}
   * @throws SinkException if the sink rejects the write
   */
  void persistRiskScores(List<RiskScore> scores) throws SinkException;

  /**
   * Flushes buffered state to the underlying store.
   *
   * @throws SinkException if flushing fails
   */
  default void flush() throws SinkException {}

  /**
   * Closes the sink.
   *
   * @throws SinkException if pending writes cannot complete
   */
  @Override
  default void close() throws SinkException {}
}
