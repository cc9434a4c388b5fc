package ai.drivewise.risk.application.poll;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Lock-free ticket gate spacing upstream calls by a minimum interval.
 * <p><strong>Why:</strong> Per-worker sleeps stop holding once several workers or several sweeps hit the same
 * API key; a shared ticket keeps the spacing global.</p>
 * <p><strong>Role:</strong> One instance per upstream rate-limit domain (TomTom key, NHTSA host), shared by every
 * poller that calls it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reserve the next free slot with a compare-and-set on a monotonic clock value.</li>
 *   <li>Sleep outside any lock until the reserved slot arrives.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for any number of concurrent callers.</p>
 * <p><strong>Performance:</strong> One CAS per acquisition in the uncontended case.</p>
 *
 * @implNote Slots are compared by subtraction so the gate tolerates {@link System#nanoTime()} wrap-around.
 * @since 0.1.0
 */
public final class MonotonicSpacingGate implements RateGate {
  private final long spacingNanos;
  private final AtomicLong nextFreeSlot;

  /**
   * Creates a gate.
   *
   * @param minSpacing minimum interval between granted slots; zero disables spacing
   * @throws IllegalArgumentException if {@code minSpacing} is negative
   */
  public MonotonicSpacingGate(Duration minSpacing) {
    Objects.requireNonNull(minSpacing, "minSpacing");
    if (minSpacing.isNegative()) {
      throw new IllegalArgumentException("minSpacing must be >= 0 (was " + minSpacing + ")");
    }
    this.spacingNanos = minSpacing.toNanos();
    this.nextFreeSlot = new AtomicLong(System.nanoTime());
  }

  @Override
  public long acquire() throws InterruptedException {
    while (true) {
      long now = System.nanoTime();
      long next = nextFreeSlot.get();
      long slot = next - now > 0 ? next : now;
      if (nextFreeSlot.compareAndSet(next, slot + spacingNanos)) {
        long remaining = slot - System.nanoTime();
        while (remaining > 0) {
          TimeUnit.NANOSECONDS.sleep(remaining);
          remaining = slot - System.nanoTime();
        }
        return slot;
      }
    }
  }

  /**
   * Configured spacing.
   *
   * @return minimum interval between slots
   */
  public Duration minSpacing() {
    return Duration.ofNanos(spacingNanos);
  }
}
