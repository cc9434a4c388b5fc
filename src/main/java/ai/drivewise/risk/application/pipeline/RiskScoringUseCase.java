package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.RateGate;
import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SignalCachePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.application.port.TrafficFlowSource;
import ai.drivewise.risk.application.port.VehicleSafetySource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.RiskFusionEngine;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes a risk score for one subject on demand.
 * <p><strong>Why:</strong> Sweeps keep the signal cache warm; scoring should not wait for an upstream call
 * when a recent nearby sample exists.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve traffic from the cache within {@code maxDistanceKm}, else fetch it live when a source is wired.</li>
 *   <li>Resolve the vehicle record from the cache by key, else rate it live when a source is wired.</li>
 *   <li>Take a slot on the upstream's shared {@link RateGate} before every live lookup, so on-demand scoring and
 *       the sweeps share one spacing budget per upstream.</li>
 *   <li>Fuse with {@link RiskFusionEngine} and persist the score; a sink failure is logged, not thrown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the collaborators are.</p>
 *
 * @since 0.1.0
 */
public final class RiskScoringUseCase {
  private static final Logger log = LoggerFactory.getLogger(RiskScoringUseCase.class);

  /** Default radius for matching a cached traffic sample to a subject's location. */
  public static final double DEFAULT_MAX_DISTANCE_KM = 15d;

  private final RiskFusionEngine engine;
  private final SignalCachePort cache;
  private final Optional<TrafficFlowSource> liveTraffic;
  private final RateGate trafficGate;
  private final Optional<VehicleSafetySource> liveVehicles;
  private final RateGate vehicleGate;
  private final PersistencePort sink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final double maxDistanceKm;

  /**
   * Creates the use case.
   *
   * @param engine fusion engine
   * @param cache latest-signal cache
   * @param liveTraffic traffic source used on a cache miss; empty disables live lookups
   * @param trafficGate gate shared with the traffic sweeps
   * @param liveVehicles vehicle source used on a cache miss; empty disables live lookups
   * @param vehicleGate gate shared with the vehicle sweep
   * @param sink sink receiving computed scores
   * @param clock clock for score timestamps
   * @param metrics metrics sink
   * @param maxDistanceKm cache match radius
   */
  public RiskScoringUseCase(
      RiskFusionEngine engine,
      SignalCachePort cache,
      Optional<TrafficFlowSource> liveTraffic,
      RateGate trafficGate,
      Optional<VehicleSafetySource> liveVehicles,
      RateGate vehicleGate,
      PersistencePort sink,
      ClockPort clock,
      MetricsPort metrics,
      double maxDistanceKm) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.liveTraffic = Objects.requireNonNull(liveTraffic, "liveTraffic");
    this.trafficGate = Objects.requireNonNull(trafficGate, "trafficGate");
    this.liveVehicles = Objects.requireNonNull(liveVehicles, "liveVehicles");
    this.vehicleGate = Objects.requireNonNull(vehicleGate, "vehicleGate");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (!(maxDistanceKm > 0d)) {
      throw new IllegalArgumentException("maxDistanceKm must be positive");
    }
    this.maxDistanceKm = maxDistanceKm;
  }

  /**
   * Scores one subject.
   *
   * @param request scoring request
   * @return fused score
   */
  public RiskScore score(ScoreRequest request) {
    Objects.requireNonNull(request, "request");
    TrafficSample traffic = request.location().flatMap(this::resolveTraffic).orElse(null);
    VehicleSafetyRecord vehicle = request.vehicle().flatMap(this::resolveVehicle).orElse(null);

    RiskScore score = engine.fuse(request.subjectId(), request.factors(), traffic, vehicle, clock.now());
    metrics.increment("fusion.scores");
    try {
      sink.persistRiskScores(List.of(score));
    } catch (SinkException ex) {
      metrics.increment("fusion.sink.error");
      log.warn("Failed to persist risk score for {}", request.subjectId(), ex);
    }
    log.debug("Scored {} overall={} confidence={}", score.subjectId(), score.overall(), score.confidence());
    return score;
  }

  private Optional<TrafficSample> resolveTraffic(Coordinate location) {
    Optional<TrafficSample> cached = cache.nearestTraffic(location, maxDistanceKm);
    if (cached.isPresent()) {
      metrics.increment("fusion.cache.traffic.hit");
      return cached;
    }
    metrics.increment("fusion.cache.traffic.miss");
    if (liveTraffic.isEmpty() || !acquire(trafficGate, "traffic")) {
      return Optional.empty();
    }
    TrafficSample sample = liveTraffic.get().fetch(location);
    cache.putTraffic(List.of(sample));
    return Optional.of(sample);
  }

  private Optional<VehicleSafetyRecord> resolveVehicle(VehicleQuery query) {
    Optional<VehicleSafetyRecord> cached = cache.vehicle(query.key());
    if (cached.isPresent()) {
      metrics.increment("fusion.cache.vehicle.hit");
      return cached;
    }
    metrics.increment("fusion.cache.vehicle.miss");
    if (liveVehicles.isEmpty() || !acquire(vehicleGate, "vehicle")) {
      return Optional.empty();
    }
    VehicleSafetyRecord record = liveVehicles.get().rate(query);
    cache.putVehicles(List.of(record));
    return Optional.of(record);
  }

  private boolean acquire(RateGate gate, String signal) {
    try {
      gate.acquire();
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("fusion.live." + signal + ".interrupted");
      log.info("Interrupted waiting for the {} gate; scoring without a live lookup", signal);
      return false;
    }
  }
}
