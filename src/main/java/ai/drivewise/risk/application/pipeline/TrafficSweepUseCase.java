package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.poll.PollFailure;
import ai.drivewise.risk.application.poll.PollResult;
import ai.drivewise.risk.application.poll.PollSettings;
import ai.drivewise.risk.application.poll.RateLimitedPoller;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SignalCachePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.application.port.TrafficFlowSource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.geo.GeoGridSampler;
import ai.drivewise.risk.domain.geo.Region;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.traffic.TrafficSourceTag;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Samples traffic flow over a grid around every configured region.
 * <p><strong>Role:</strong> Body of the {@code TRAFFIC_SWEEP} job; also reused with density {@code 0} for the
 * city snapshot inside the full pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expand each region with {@link GeoGridSampler} and poll every point through one poller run.</li>
 *   <li>Persist and cache whatever succeeded, including partial results of a cancelled run.</li>
 *   <li>Surface sink failures as {@link SinkException}; unit failures only reach the report.</li>
 * </ul>
 * <p><strong>Observability:</strong> {@code sweep.<name>.records}, {@code sweep.<name>.fallback},
 * {@code sweep.<name>.sink.error}.</p>
 *
 * @since 0.1.0
 */
public final class TrafficSweepUseCase {
  private static final Logger log = LoggerFactory.getLogger(TrafficSweepUseCase.class);

  private final String name;
  private final TrafficFlowSource source;
  private final PersistencePort sink;
  private final SignalCachePort cache;
  private final RateLimitedPoller poller;
  private final PollSettings settings;
  private final List<Region> regions;
  private final double radiusKm;
  private final int density;
  private final MetricsPort metrics;

  /**
   * Creates the sweep.
   *
   * @param name sweep name for logs and metrics, e.g. {@code traffic}
   * @param source traffic flow source
   * @param sink persistence sink
   * @param cache latest-signal cache
   * @param poller poller bound to the traffic upstream
   * @param settings pacing for the traffic upstream
   * @param regions regions to sweep
   * @param radiusKm grid radius
   * @param density grid density; {@code 0} samples only region centres
   * @param metrics metrics sink
   */
  public TrafficSweepUseCase(
      String name,
      TrafficFlowSource source,
      PersistencePort sink,
      SignalCachePort cache,
      RateLimitedPoller poller,
      PollSettings settings,
      List<Region> regions,
      double radiusKm,
      int density,
      MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.source = Objects.requireNonNull(source, "source");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.poller = Objects.requireNonNull(poller, "poller");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.regions = List.copyOf(regions);
    this.radiusKm = radiusKm;
    this.density = density;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs one sweep.
   *
   * @param cancellation stops new grid points from being polled
   * @return sweep summary
   * @throws SinkException if the collected samples cannot be persisted
   */
  public SweepReport run(CancellationSignal cancellation) throws SinkException {
    List<Coordinate> points = new ArrayList<>();
    for (Region region : regions) {
      points.addAll(GeoGridSampler.sample(region.center(), radiusKm, density));
    }
    log.info("Traffic sweep {} polling {} points across {} regions", name, points.size(), regions.size());

    PollResult<Coordinate, TrafficSample> result =
        poller.run(points, source::fetch, settings, cancellation);
    for (PollFailure<Coordinate> failure : result.failed()) {
      log.debug("Traffic point {} failed: {}", failure.unit(), failure.error().toString());
    }
    long fallbacks = result.succeeded().stream()
        .filter(sample -> sample.sourceTag() == TrafficSourceTag.FALLBACK)
        .count();
    for (long i = 0; i < fallbacks; i++) {
      metrics.increment("sweep." + name + ".fallback");
    }

    List<TrafficSample> samples = result.succeeded();
    cache.putTraffic(samples);
    persist(samples);
    log.info("Traffic sweep {} stored {} samples ({} fallback, {} failed)",
        name, samples.size(), fallbacks, result.failed().size());
    return new SweepReport(
        name, points.size(), samples.size(), result.failed().size(), samples.size(), result.cancelled());
  }

  private void persist(List<TrafficSample> samples) throws SinkException {
    if (samples.isEmpty()) {
      return;
    }
    try {
      sink.persistTraffic(samples);
      sink.flush();
      metrics.observe("sweep." + name + ".records", samples.size());
    } catch (SinkException ex) {
      metrics.increment("sweep." + name + ".sink.error");
      throw ex;
    }
  }
}
