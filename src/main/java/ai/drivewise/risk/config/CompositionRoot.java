package ai.drivewise.risk.config;

import ai.drivewise.risk.adapter.kafka.KafkaModelRefreshAdapter;
import ai.drivewise.risk.adapter.kafka.KafkaPersistenceAdapter;
import ai.drivewise.risk.application.pipeline.FullPipelineUseCase;
import ai.drivewise.risk.application.pipeline.IncidentSweepUseCase;
import ai.drivewise.risk.application.pipeline.ModelRefreshUseCase;
import ai.drivewise.risk.application.pipeline.RiskScoringUseCase;
import ai.drivewise.risk.application.pipeline.RouteTrafficUseCase;
import ai.drivewise.risk.application.pipeline.TrafficSweepUseCase;
import ai.drivewise.risk.application.pipeline.VehicleSweepUseCase;
import ai.drivewise.risk.application.poll.MonotonicSpacingGate;
import ai.drivewise.risk.application.poll.PollSettings;
import ai.drivewise.risk.application.poll.RateGate;
import ai.drivewise.risk.application.poll.RateLimitedPoller;
import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.IncidentSource;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.ModelRefreshPort;
import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.application.port.TrafficFlowSource;
import ai.drivewise.risk.application.port.VehicleSafetySource;
import ai.drivewise.risk.application.schedule.JobScheduler;
import ai.drivewise.risk.application.schedule.ScheduledJob;
import ai.drivewise.risk.domain.risk.RiskFusionEngine;
import ai.drivewise.risk.infrastructure.cache.InMemorySignalCache;
import ai.drivewise.risk.infrastructure.http.JdkJsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ai.drivewise.risk.infrastructure.persistence.NdjsonPersistenceAdapter;
import ai.drivewise.risk.infrastructure.persistence.NoOpPersistenceAdapter;
import ai.drivewise.risk.infrastructure.refresh.LoggingModelRefreshAdapter;
import ai.drivewise.risk.infrastructure.source.FallbackTrafficFlowSource;
import ai.drivewise.risk.infrastructure.source.nhtsa.NhtsaVehicleSafetySource;
import ai.drivewise.risk.infrastructure.source.tomtom.TomTomIncidentSource;
import ai.drivewise.risk.infrastructure.source.tomtom.TomTomRouteTrafficSource;
import ai.drivewise.risk.infrastructure.source.tomtom.TomTomTrafficFlowSource;
import ai.drivewise.risk.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires engine use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link EngineConfig} into runnable jobs.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning sources, pollers, sinks and the scheduler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one rate gate per upstream so every sweep hitting TomTom or NHTSA shares its spacing.</li>
 *   <li>Build the sweep, refresh and scoring use cases over the shared signal cache.</li>
 *   <li>Build the route traffic lookup when a TomTom key is configured.</li>
 *   <li>Register the enabled jobs from {@link JobPlan} with a {@link JobScheduler}.</li>
 *   <li>Close sinks and metrics on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on a single thread during startup; the built graph is
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Supplies the metrics port to every use case and adapter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String TRAFFIC_SWEEP_NAME = "traffic";
  static final String CITY_SNAPSHOT_NAME = "city_snapshot";

  private final EngineConfig config;
  private final MetricsPort metrics;
  private final PersistencePort sink;
  private final ModelRefreshPort refresh;
  private final InMemorySignalCache cache;
  private final List<JobPlan> jobPlan;
  private final JobScheduler scheduler;
  private final RiskScoringUseCase scoringUseCase;
  private final Optional<RouteTrafficUseCase> routeTraffic;

  /**
   * Creates a composition root with production adapters.
   *
   * @param config validated engine configuration
   */
  public CompositionRoot(EngineConfig config) {
    this(config, new SystemClockAdapter());
  }

  private CompositionRoot(EngineConfig config, ClockPort clock) {
    this(
        config,
        new OpenTelemetryMetricsAdapter(),
        clock,
        new JdkJsonHttpClient(config.httpTimeout()),
        createSink(config),
        createRefresh(config, clock));
  }

  /**
   * Creates a composition root over explicit adapters.
   *
   * @param config validated engine configuration
   * @param metrics metrics sink
   * @param clock record clock
   * @param http JSON client shared by the upstream sources
   * @param sink persistence sink; closed by {@link #close()}
   * @param refresh model refresh trigger; closed by {@link #close()}
   */
  CompositionRoot(
      EngineConfig config,
      MetricsPort metrics,
      ClockPort clock,
      JsonHttpClient http,
      PersistencePort sink,
      ModelRefreshPort refresh) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(http, "http");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.refresh = Objects.requireNonNull(refresh, "refresh");
    this.cache = new InMemorySignalCache(clock, config.cacheMaxTrafficAge(), config.cacheMaxVehicleAge());
    this.jobPlan = JobPlan.of(config);

    RateGate tomtomGate = new MonotonicSpacingGate(config.tomtomMinSpacing());
    RateGate nhtsaGate = new MonotonicSpacingGate(config.nhtsaMinSpacing());
    PollSettings tomtomSettings = pollSettings(tomtomGate);
    PollSettings nhtsaSettings = pollSettings(nhtsaGate);
    RateLimitedPoller tomtomPoller = new RateLimitedPoller("tomtom", metrics);
    RateLimitedPoller nhtsaPoller = new RateLimitedPoller("nhtsa", metrics);

    TrafficFlowSource traffic = config.tomtomApiKey()
        .<TrafficFlowSource>map(key ->
            new TomTomTrafficFlowSource(http, config.tomtomBaseUrl(), key, clock, metrics))
        .orElseGet(() -> new FallbackTrafficFlowSource(clock));
    Optional<IncidentSource> incidents = config.tomtomApiKey()
        .map(key -> new TomTomIncidentSource(http, config.tomtomBaseUrl(), key, clock, metrics));
    VehicleSafetySource vehicles =
        new NhtsaVehicleSafetySource(
            http, config.nhtsaBaseUrl(), config.vpicBaseUrl(), config.recallsBaseUrl(), clock, metrics);

    List<ScheduledJob> jobs = new ArrayList<>();
    for (JobPlan entry : jobPlan) {
      if (!entry.enabled()) {
        log.warn("Job {} disabled: {}", entry.kind(), entry.note());
        continue;
      }
      jobs.add(switch (entry.kind()) {
        case TRAFFIC_SWEEP -> {
          TrafficSweepUseCase sweep = new TrafficSweepUseCase(
              TRAFFIC_SWEEP_NAME, traffic, sink, cache, tomtomPoller, tomtomSettings,
              config.regions(), config.gridRadiusKm(), config.gridDensity(), metrics);
          yield new ScheduledJob(entry.kind(), entry.cadence(), sweep::run);
        }
        case VEHICLE_SWEEP -> {
          VehicleSweepUseCase sweep = new VehicleSweepUseCase(
              vehicles, sink, cache, nhtsaPoller, nhtsaSettings, config::vehicles, metrics);
          yield new ScheduledJob(entry.kind(), entry.cadence(), sweep::run);
        }
        case MODEL_REFRESH -> {
          ModelRefreshUseCase useCase = new ModelRefreshUseCase(refresh, metrics);
          yield new ScheduledJob(entry.kind(), entry.cadence(), useCase::run);
        }
        case FULL_PIPELINE -> {
          TrafficSweepUseCase snapshot = new TrafficSweepUseCase(
              CITY_SNAPSHOT_NAME, traffic, sink, cache, tomtomPoller, tomtomSettings,
              config.regions(), config.gridRadiusKm(), 0, metrics);
          IncidentSweepUseCase incidentSweep = new IncidentSweepUseCase(
              incidents.orElseThrow(), sink, tomtomPoller, tomtomSettings,
              config.regions(), config.incidentRadiusKm(), metrics);
          FullPipelineUseCase pipeline = new FullPipelineUseCase(snapshot, incidentSweep);
          yield new ScheduledJob(entry.kind(), entry.cadence(), pipeline::run);
        }
      });
    }
    this.scheduler = new JobScheduler(jobs, metrics, clock);
    this.scoringUseCase = new RiskScoringUseCase(
        new RiskFusionEngine(config.fusionWeights()),
        cache,
        Optional.of(traffic),
        tomtomGate,
        Optional.of(vehicles),
        nhtsaGate,
        sink,
        clock,
        metrics,
        config.cacheMaxDistanceKm());
    this.routeTraffic = config.tomtomApiKey()
        .map(key -> new RouteTrafficUseCase(
            new TomTomRouteTrafficSource(http, config.tomtomRoutingBaseUrl(), key, clock, metrics),
            tomtomGate,
            metrics));
    log.info("Composition root ready: {} jobs enabled, sink {}", jobs.size(), config.sink());
  }

  /**
   * Returns the job plan derived from the configuration.
   *
   * @return one entry per job kind
   */
  public List<JobPlan> jobPlan() {
    return jobPlan;
  }

  /**
   * Returns the scheduler holding every enabled job. The caller starts and stops it.
   *
   * @return scheduler
   */
  public JobScheduler scheduler() {
    return scheduler;
  }

  /**
   * Returns the on-demand scoring use case sharing the sweep cache.
   *
   * @return scoring use case
   */
  public RiskScoringUseCase scoringUseCase() {
    return scoringUseCase;
  }

  /**
   * Returns the route traffic lookup. It shares the TomTom gate with the sweeps.
   *
   * @return lookup, or empty when no TomTom key is configured
   */
  public Optional<RouteTrafficUseCase> routeTraffic() {
    return routeTraffic;
  }

  /**
   * Exposes the configuration the graph was built from.
   *
   * @return engine configuration
   */
  public EngineConfig config() {
    return config;
  }

  MetricsPort metrics() {
    return metrics;
  }

  InMemorySignalCache cache() {
    return cache;
  }

  /**
   * Flushes and closes the sink, the refresh trigger and the metrics exporter.
   *
   * @throws SinkException if the sink or refresh trigger cannot close cleanly
   */
  @Override
  public void close() throws SinkException {
    SinkException failure = null;
    try {
      sink.close();
    } catch (SinkException ex) {
      failure = ex;
    }
    try {
      refresh.close();
    } catch (SinkException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.flush();
      otel.close();
    }
    if (failure != null) {
      throw failure;
    }
  }

  private PollSettings pollSettings(RateGate gate) {
    return new PollSettings(
        gate, config.batchSize(), config.batchCooldown(), config.parallelism(), config.callTimeout());
  }

  private static PersistencePort createSink(EngineConfig config) {
    return switch (config.sink()) {
      case NDJSON -> new NdjsonPersistenceAdapter(config.sinkDirectory());
      case KAFKA -> new KafkaPersistenceAdapter(config.kafkaBootstrap().orElseThrow(), config.kafkaTopicPrefix());
      case NONE -> new NoOpPersistenceAdapter();
    };
  }

  private static ModelRefreshPort createRefresh(EngineConfig config, ClockPort clock) {
    if (config.sink() == SinkType.KAFKA) {
      return new KafkaModelRefreshAdapter(
          config.kafkaBootstrap().orElseThrow(), config.kafkaTopicPrefix(), clock);
    }
    return new LoggingModelRefreshAdapter();
  }
}
