package ai.drivewise.risk.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to sources and use cases.
 * <p><strong>Why:</strong> Collection and computation timestamps become deterministic in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; poller workers read the clock concurrently.</p>
 *
 * @implNote Spacing between upstream calls uses {@link System#nanoTime()} instead; this port only stamps records.
 * @since 0.1.0
 * @see ai.drivewise.risk.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant at millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
