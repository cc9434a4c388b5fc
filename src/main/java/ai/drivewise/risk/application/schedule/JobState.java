package ai.drivewise.risk.application.schedule;

/**
 * Lifecycle of a job slot.
 *
 * @since 0.1.0
 */
public enum JobState {
  /** Waiting for the next tick. */
  IDLE,
  /** Body executing on the job's worker. */
  RUNNING,
  /** Stop requested while the body was executing. */
  CANCELLING
}
