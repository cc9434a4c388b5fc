package ai.drivewise.risk.config;

import ai.drivewise.risk.application.schedule.JobKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One line of the job plan: whether a job will be scheduled and at which cadence.
 *
 * @param kind job kind
 * @param cadence configured cadence
 * @param enabled {@code false} when a prerequisite such as the TomTom key is missing
 * @param note operator-facing explanation
 * @since 0.1.0
 */
public record JobPlan(JobKind kind, Duration cadence, boolean enabled, String note) {

  public JobPlan {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(cadence, "cadence");
    note = note == null ? "" : note;
  }

  /**
   * Derives the plan for every job kind from the configuration.
   *
   * @param config engine configuration
   * @return one entry per {@link JobKind}, in declaration order
   */
  public static List<JobPlan> of(EngineConfig config) {
    Objects.requireNonNull(config, "config");
    List<JobPlan> plan = new ArrayList<>();
    for (JobKind kind : JobKind.values()) {
      Duration cadence = config.cadence(kind);
      plan.add(switch (kind) {
        case TRAFFIC_SWEEP -> config.hasTomTomKey()
            ? new JobPlan(kind, cadence, true, config.regions().size() + " regions, density "
                + config.gridDensity() + ", radius " + config.gridRadiusKm() + " km")
            : new JobPlan(kind, cadence, false, "tomtomApiKey not set");
        case FULL_PIPELINE -> config.hasTomTomKey()
            ? new JobPlan(kind, cadence, true, "city snapshot and incidents within "
                + config.incidentRadiusKm() + " km")
            : new JobPlan(kind, cadence, false, "tomtomApiKey not set");
        case VEHICLE_SWEEP -> config.vehicles().isEmpty()
            ? new JobPlan(kind, cadence, false, "no vehicles configured")
            : new JobPlan(kind, cadence, true, config.vehicles().size() + " vehicles");
        case MODEL_REFRESH -> new JobPlan(kind, cadence, true, "sink " + config.sink());
      });
    }
    return List.copyOf(plan);
  }
}
