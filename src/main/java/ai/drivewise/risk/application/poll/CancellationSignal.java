package ai.drivewise.risk.application.poll;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between the scheduler and the job it runs.
 *
 * <p>Pollers check the flag before issuing each unit and wait on it during batch cooldowns, so a shutdown stops
 * new upstream calls without interrupting the call in flight.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Raises the signal; idempotent.
   */
  public void cancel() {
    latch.countDown();
  }

  /**
   * Reports whether the signal was raised.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits up to {@code timeout} for the signal.
   *
   * @param timeout maximum wait
   * @return {@code true} if the signal was raised before the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
