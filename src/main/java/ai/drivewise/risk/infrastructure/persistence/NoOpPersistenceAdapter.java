package ai.drivewise.risk.infrastructure.persistence;

import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink selected with {@code sink=none}: records are counted in debug logs and dropped.
 *
 * @since 0.1.0
 */
public final class NoOpPersistenceAdapter implements PersistencePort {
  private static final Logger log = LoggerFactory.getLogger(NoOpPersistenceAdapter.class);

  @Override
  public void persistTraffic(List<TrafficSample> samples) {
    log.debug("Dropping {} traffic samples", samples.size());
  }

  @Override
  public void persistIncidents(List<Incident> incidents) {
    log.debug("Dropping {} incidents", incidents.size());
  }

  @Override
  public void persistVehicles(List<VehicleSafetyRecord> records) {
    log.debug("Dropping {} vehicle records", records.size());
  }

  @Override
  public void persistRiskScores(List<RiskScore> scores) {
    log.debug("Dropping {} risk scores", scores.size());
  }
}
