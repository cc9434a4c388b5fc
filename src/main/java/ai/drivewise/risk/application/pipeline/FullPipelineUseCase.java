package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.port.SinkException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite {@code FULL_PIPELINE} job: a traffic snapshot at every region centre followed by an incident
 * sweep. The incident sweep is skipped once the snapshot has been cancelled.
 *
 * @since 0.1.0
 */
public final class FullPipelineUseCase {
  private static final Logger log = LoggerFactory.getLogger(FullPipelineUseCase.class);
  private static final String NAME = "full";

  private final TrafficSweepUseCase citySnapshot;
  private final IncidentSweepUseCase incidents;

  /**
   * Creates the composite.
   *
   * @param citySnapshot traffic sweep configured with density {@code 0}
   * @param incidents incident sweep
   */
  public FullPipelineUseCase(TrafficSweepUseCase citySnapshot, IncidentSweepUseCase incidents) {
    this.citySnapshot = Objects.requireNonNull(citySnapshot, "citySnapshot");
    this.incidents = Objects.requireNonNull(incidents, "incidents");
  }

  /**
   * Runs the snapshot, then the incident sweep.
   *
   * @param cancellation shared by both stages
   * @return combined report
   * @throws SinkException if either stage cannot persist its records
   */
  public SweepReport run(CancellationSignal cancellation) throws SinkException {
    SweepReport snapshot = citySnapshot.run(cancellation);
    if (snapshot.cancelled() || cancellation.isCancelled()) {
      log.info("Full pipeline cancelled after city snapshot");
      return snapshot.plus(NAME, new SweepReport(NAME, 0, 0, 0, 0, true));
    }
    SweepReport combined = snapshot.plus(NAME, incidents.run(cancellation));
    log.info("Full pipeline completed: {}", combined);
    return combined;
  }
}
