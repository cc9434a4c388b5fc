package ai.drivewise.risk.application.pipeline;

/**
 * Summary of one sweep, logged by the scheduler and printed by the CLI.
 *
 * @param sweep sweep name
 * @param attempted units handed to the poller
 * @param succeeded units that produced a result
 * @param failed units recorded as failures
 * @param persisted records written to the sink
 * @param cancelled whether the sweep stopped early
 * @since 0.1.0
 */
public record SweepReport(String sweep, int attempted, int succeeded, int failed, int persisted, boolean cancelled) {
  /**
   * Combines two reports of a composite job.
   *
   * @param name name of the composite
   * @param other report to add
   * @return summed report; cancelled if either part was
   */
  public SweepReport plus(String name, SweepReport other) {
    return new SweepReport(
        name,
        attempted + other.attempted,
        succeeded + other.succeeded,
        failed + other.failed,
        persisted + other.persisted,
        cancelled || other.cancelled);
  }
}
