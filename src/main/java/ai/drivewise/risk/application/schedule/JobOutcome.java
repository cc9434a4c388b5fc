package ai.drivewise.risk.application.schedule;

/**
 * Result of the most recent execution of a job.
 *
 * @since 0.1.0
 */
public enum JobOutcome {
  NEVER_RUN,
  SUCCEEDED,
  FAILED,
  CANCELLED
}
