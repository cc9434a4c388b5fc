package ai.drivewise.risk.application.poll;

/**
 * Admission gate shared by every caller of one upstream rate-limit domain.
 *
 * <p>Implementations guarantee that the instants returned by {@link #acquire()} are never closer than the
 * configured spacing, regardless of how many threads or pollers share the gate.</p>
 *
 * @since 0.1.0
 */
public interface RateGate {
  /**
   * Blocks until the caller may start its upstream call.
   *
   * @return granted slot on the {@link System#nanoTime()} scale; the call starts at or after this instant
   * @throws InterruptedException if interrupted while waiting; the slot is forfeited
   */
  long acquire() throws InterruptedException;

  /**
   * Gate that admits every caller immediately.
   */
  RateGate UNLIMITED = System::nanoTime;
}
