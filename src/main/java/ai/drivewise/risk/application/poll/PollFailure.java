package ai.drivewise.risk.application.poll;

import java.util.Objects;

/**
 * Unit that did not produce a result, kept with its cause so it can be retried.
 *
 * @param unit originating unit
 * @param error failure cause; {@link java.util.concurrent.TimeoutException} for expired calls and
 *     {@link java.util.concurrent.CancellationException} for units never issued
 * @param <U> unit type
 * @since 0.1.0
 */
public record PollFailure<U>(U unit, Throwable error) {
  public PollFailure {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(error, "error");
  }
}
