package ai.drivewise.risk.application.port;

/**
 * <strong>What:</strong> Port abstracting counter and histogram emission for the risk engine.
 * <p><strong>Why:</strong> Sweeps, pollers and the scheduler record outcomes without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count events such as {@code poller.unit.failure} or {@code scheduler.job.skipped}.</li>
 *   <li>Record observations such as {@code poller.gate.waitNanos}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from poller workers and
 * scheduler threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 *
 * @implNote Keys use dotted lower-case names; adapters may sanitize them.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, in the unit named by the key suffix
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
