package ai.drivewise.risk.application.poll;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a poller run: every input unit appears exactly once, either as a result or as a failure.
 *
 * @param succeeded results in completion order
 * @param failed failures in completion order; unordered relative to {@code succeeded}
 * @param cancelled whether the run stopped issuing units early
 * @param <U> unit type
 * @param <R> result type
 * @since 0.1.0
 */
public record PollResult<U, R>(List<R> succeeded, List<PollFailure<U>> failed, boolean cancelled) {
  public PollResult {
    succeeded = List.copyOf(Objects.requireNonNull(succeeded, "succeeded"));
    failed = List.copyOf(Objects.requireNonNull(failed, "failed"));
  }

  /**
   * Number of units the run accounted for.
   *
   * @return {@code succeeded().size() + failed().size()}
   */
  public int total() {
    return succeeded.size() + failed.size();
  }
}
