package ai.drivewise.risk.domain.traffic;

/**
 * Origin of a {@link TrafficSample}.
 *
 * @since 0.1.0
 */
public enum TrafficSourceTag {
  /** Parsed from a successful upstream flow response. */
  LIVE,
  /** Conservative defaults substituted after an upstream failure. */
  FALLBACK
}
