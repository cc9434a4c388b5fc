package ai.drivewise.risk.application.schedule;

import java.time.Duration;
import java.util.Locale;

/**
 * Periodic jobs run by the engine with their default cadences.
 *
 * @since 0.1.0
 */
public enum JobKind {
  /** Grid traffic sampling around every region. */
  TRAFFIC_SWEEP("cadence.trafficSweep", Duration.ofMinutes(15)),
  /** Safety ratings for the vehicle worklist. */
  VEHICLE_SWEEP("cadence.vehicleSweep", Duration.ofHours(6)),
  /** Downstream score-refresh procedures. */
  MODEL_REFRESH("cadence.modelRefresh", Duration.ofHours(1)),
  /** City snapshot plus incident sweep. */
  FULL_PIPELINE("cadence.fullPipeline", Duration.ofMinutes(30));

  private final String cadenceKey;
  private final Duration defaultCadence;

  JobKind(String cadenceKey, Duration defaultCadence) {
    this.cadenceKey = cadenceKey;
    this.defaultCadence = defaultCadence;
  }

  /**
   * Configuration key overriding this job's cadence.
   *
   * @return key such as {@code cadence.trafficSweep}
   */
  public String cadenceKey() {
    return cadenceKey;
  }

  /**
   * Cadence used when no override is configured.
   *
   * @return default cadence
   */
  public Duration defaultCadence() {
    return defaultCadence;
  }

  /**
   * Lower-case label used in thread names, MDC values and log lines.
   *
   * @return label such as {@code traffic_sweep}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
