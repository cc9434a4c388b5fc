package ai.drivewise.risk.application.poll;

/**
 * Per-unit upstream call executed by {@link RateLimitedPoller}.
 *
 * @param <U> unit type
 * @param <R> result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface UnitCall<U, R> {
  /**
   * Performs the call for one unit.
   *
   * @param unit unit to process
   * @return non-null result
   * @throws Exception on any failure; recorded against the unit
   */
  R call(U unit) throws Exception;
}
