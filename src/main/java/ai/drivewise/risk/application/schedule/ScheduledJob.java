package ai.drivewise.risk.application.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * A job registered with {@link JobScheduler}.
 *
 * @param kind job kind
 * @param cadence interval between ticks
 * @param body work executed per tick
 * @since 0.1.0
 */
public record ScheduledJob(JobKind kind, Duration cadence, JobBody body) {
  public ScheduledJob {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(cadence, "cadence");
    Objects.requireNonNull(body, "body");
    if (cadence.isZero() || cadence.isNegative()) {
      throw new IllegalArgumentException(kind + " cadence must be positive (was " + cadence + ")");
    }
  }

  /**
   * Registers {@code body} with the kind's default cadence.
   *
   * @param kind job kind
   * @param body work executed per tick
   * @return job definition
   */
  public static ScheduledJob withDefaultCadence(JobKind kind, JobBody body) {
    return new ScheduledJob(kind, kind.defaultCadence(), body);
  }
}
