package ai.drivewise.risk.domain.traffic;

/**
 * <strong>What:</strong> Four-bucket step function mapping a speed ratio to a congestion level.
 * <p><strong>Why:</strong> Downstream weighting was calibrated against these exact buckets; a continuous curve
 * would shift every fused score.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class CongestionLevels {
  /** Ratio at or above which traffic is free flowing. */
  public static final double FREE_FLOW_RATIO = 0.85d;
  /** Ratio at or above which congestion is light. */
  public static final double LIGHT_RATIO = 0.65d;
  /** Ratio at or above which congestion is moderate. */
  public static final double MODERATE_RATIO = 0.45d;

  private CongestionLevels() {}

  /**
   * Derives the congestion level for the supplied speeds.
   *
   * @param currentSpeed observed speed in km/h
   * @param freeFlowSpeed reference free-flow speed in km/h; non-positive values yield {@code 0.0}
   * @return one of {@code 0.0}, {@code 0.3}, {@code 0.6} or {@code 1.0}
   */
  public static double fromSpeeds(double currentSpeed, double freeFlowSpeed) {
    if (!(freeFlowSpeed > 0d)) {
      return 0.0d;
    }
    double ratio = currentSpeed / freeFlowSpeed;
    if (ratio >= FREE_FLOW_RATIO) {
      return 0.0d;
    }
    if (ratio >= LIGHT_RATIO) {
      return 0.3d;
    }
    if (ratio >= MODERATE_RATIO) {
      return 0.6d;
    }
    return 1.0d;
  }
}
