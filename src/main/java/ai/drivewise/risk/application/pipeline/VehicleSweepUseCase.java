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
import ai.drivewise.risk.application.port.VehicleSafetySource;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Refreshes safety ratings for the vehicle worklist.
 * <p><strong>Role:</strong> Body of the {@code VEHICLE_SWEEP} job.</p>
 * <p>The worklist is read on every run so configuration reloads or a database-backed supplier are picked
 * up without restarting the scheduler. Records of every tier are persisted; the tier counts are logged.</p>
 *
 * @since 0.1.0
 */
public final class VehicleSweepUseCase {
  private static final Logger log = LoggerFactory.getLogger(VehicleSweepUseCase.class);
  private static final String NAME = "vehicle";

  private final VehicleSafetySource source;
  private final PersistencePort sink;
  private final SignalCachePort cache;
  private final RateLimitedPoller poller;
  private final PollSettings settings;
  private final Supplier<List<VehicleQuery>> worklist;
  private final MetricsPort metrics;

  /**
   * Creates the sweep.
   *
   * @param source vehicle safety source
   * @param sink persistence sink
   * @param cache latest-signal cache
   * @param poller poller bound to the NHTSA upstream
   * @param settings pacing for the NHTSA upstream
   * @param worklist supplier of vehicles to rate
   * @param metrics metrics sink
   */
  public VehicleSweepUseCase(
      VehicleSafetySource source,
      PersistencePort sink,
      SignalCachePort cache,
      RateLimitedPoller poller,
      PollSettings settings,
      Supplier<List<VehicleQuery>> worklist,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.poller = Objects.requireNonNull(poller, "poller");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.worklist = Objects.requireNonNull(worklist, "worklist");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs one sweep over the current worklist.
   *
   * @param cancellation stops new vehicles from being polled
   * @return sweep summary
   * @throws SinkException if the collected records cannot be persisted
   */
  public SweepReport run(CancellationSignal cancellation) throws SinkException {
    List<VehicleQuery> vehicles = List.copyOf(worklist.get());
    if (vehicles.isEmpty()) {
      log.info("Vehicle sweep has an empty worklist; nothing to do");
      return new SweepReport(NAME, 0, 0, 0, 0, false);
    }
    log.info("Vehicle sweep rating {} vehicles", vehicles.size());

    PollResult<VehicleQuery, VehicleSafetyRecord> result =
        poller.run(vehicles, source::rate, settings, cancellation);
    for (PollFailure<VehicleQuery> failure : result.failed()) {
      log.debug("Vehicle {} failed: {}", failure.unit().key(), failure.error().toString());
    }

    Map<VehicleSourceTag, Integer> tiers = new EnumMap<>(VehicleSourceTag.class);
    for (VehicleSafetyRecord record : result.succeeded()) {
      tiers.merge(record.sourceTag(), 1, Integer::sum);
    }

    List<VehicleSafetyRecord> records = result.succeeded();
    cache.putVehicles(records);
    if (!records.isEmpty()) {
      try {
        sink.persistVehicles(records);
        sink.flush();
        metrics.observe("sweep." + NAME + ".records", records.size());
      } catch (SinkException ex) {
        metrics.increment("sweep." + NAME + ".sink.error");
        throw ex;
      }
    }
    log.info("Vehicle sweep stored {} records {}; {} failed", records.size(), tiers, result.failed().size());
    return new SweepReport(
        NAME, vehicles.size(), records.size(), result.failed().size(), records.size(), result.cancelled());
  }
}
