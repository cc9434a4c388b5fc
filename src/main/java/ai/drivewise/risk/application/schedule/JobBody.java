package ai.drivewise.risk.application.schedule;

import ai.drivewise.risk.application.poll.CancellationSignal;

/**
 * Work executed on each tick of a job.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface JobBody {
  /**
   * Runs the job once.
   *
   * @param cancellation raised when the scheduler stops
   * @throws Exception on failure; the tick is marked failed and the next tick proceeds normally
   */
  void run(CancellationSignal cancellation) throws Exception;
}
