package ai.drivewise.risk.application.pipeline;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.ModelRefreshPort;
import ai.drivewise.risk.application.port.SinkException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Triggers the downstream score-refresh procedures.
 * <p><strong>Role:</strong> Body of the {@code MODEL_REFRESH} job.</p>
 * <p>Every procedure is attempted even when an earlier one fails; the first failure is rethrown with the
 * later ones attached as suppressed exceptions.</p>
 *
 * @since 0.1.0
 */
public final class ModelRefreshUseCase {
  private static final Logger log = LoggerFactory.getLogger(ModelRefreshUseCase.class);

  /** Recomputes behavioural risk scores. */
  public static final String UPDATE_RISK_SCORES = "update_risk_scores";
  /** Recomputes vehicle safety scores. */
  public static final String UPDATE_SAFETY_SCORES = "update_safety_scores";
  /** Procedures in trigger order. */
  public static final List<String> PROCEDURES = List.of(UPDATE_RISK_SCORES, UPDATE_SAFETY_SCORES);

  private final ModelRefreshPort refresh;
  private final MetricsPort metrics;

  public ModelRefreshUseCase(ModelRefreshPort refresh, MetricsPort metrics) {
    this.refresh = Objects.requireNonNull(refresh, "refresh");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Triggers every procedure not yet reached when cancellation arrives.
   *
   * @param cancellation checked before each procedure
   * @return number of procedures triggered successfully
   * @throws SinkException if any trigger failed
   */
  public int run(CancellationSignal cancellation) throws SinkException {
    SinkException first = null;
    int triggered = 0;
    for (String procedure : PROCEDURES) {
      if (cancellation.isCancelled()) {
        log.info("Model refresh cancelled before {}", procedure);
        break;
      }
      try {
        refresh.trigger(procedure);
        triggered++;
        metrics.increment("refresh." + procedure + ".ok");
        log.info("Triggered model refresh procedure {}", procedure);
      } catch (SinkException ex) {
        metrics.increment("refresh." + procedure + ".error");
        log.error("Model refresh procedure {} failed", procedure, ex);
        if (first == null) {
          first = ex;
        } else {
          first.addSuppressed(ex);
        }
      }
    }
    if (first != null) {
      throw first;
    }
    return triggered;
  }
}
