package ai.drivewise.risk.infrastructure.time;

import ai.drivewise.risk.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link Clock}; the system UTC clock unless one is supplied.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /** Creates an adapter over the system UTC clock. */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over {@code clock}, typically a fixed clock in tests.
   *
   * @param clock source of time
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }

  @Override
  public Instant now() {
    return clock.instant();
  }
}
