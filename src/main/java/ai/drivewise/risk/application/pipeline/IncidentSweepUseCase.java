package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.poll.PollResult;
import ai.drivewise.risk.application.poll.PollSettings;
import ai.drivewise.risk.application.poll.RateLimitedPoller;
import ai.drivewise.risk.application.port.IncidentSource;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.domain.geo.Region;
import ai.drivewise.risk.domain.traffic.Incident;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects incidents around each region centre. Shares the traffic poller because both endpoints sit
 * behind the same TomTom key.
 *
 * @since 0.1.0
 */
public final class IncidentSweepUseCase {
  private static final Logger log = LoggerFactory.getLogger(IncidentSweepUseCase.class);
  private static final String NAME = "incidents";

  private final IncidentSource source;
  private final PersistencePort sink;
  private final RateLimitedPoller poller;
  private final PollSettings settings;
  private final List<Region> regions;
  private final double radiusKm;
  private final MetricsPort metrics;

  public IncidentSweepUseCase(
      IncidentSource source,
      PersistencePort sink,
      RateLimitedPoller poller,
      PollSettings settings,
      List<Region> regions,
      double radiusKm,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.poller = Objects.requireNonNull(poller, "poller");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.regions = List.copyOf(regions);
    this.radiusKm = radiusKm;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs one incident sweep.
   *
   * @param cancellation stops new regions from being polled
   * @return sweep summary; {@code succeeded} counts regions, {@code persisted} counts incidents
   * @throws SinkException if the incidents cannot be persisted
   */
  public SweepReport run(CancellationSignal cancellation) throws SinkException {
    PollResult<Region, List<Incident>> result =
        poller.run(regions, region -> source.fetch(region.center(), radiusKm), settings, cancellation);

    List<Incident> incidents = new ArrayList<>();
    result.succeeded().forEach(incidents::addAll);
    if (!incidents.isEmpty()) {
      try {
        sink.persistIncidents(incidents);
        sink.flush();
        metrics.observe("sweep." + NAME + ".records", incidents.size());
      } catch (SinkException ex) {
        metrics.increment("sweep." + NAME + ".sink.error");
        throw ex;
      }
    }
    log.info("Incident sweep stored {} incidents from {} regions", incidents.size(), result.succeeded().size());
    return new SweepReport(
        NAME, regions.size(), result.succeeded().size(), result.failed().size(), incidents.size(),
        result.cancelled());
  }
}
