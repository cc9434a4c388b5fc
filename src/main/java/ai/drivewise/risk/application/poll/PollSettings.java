package ai.drivewise.risk.application.poll;

import java.time.Duration;
import java.util.Objects;

/**
 * Pacing and bounds for one poller run.
 *
 * @param gate shared rate gate for the upstream being called; acquired by the worker right before each call
 * @param batchSize units issued before the cooldown applies; {@code >= 1}
 * @param batchCooldown pause between batches; {@code >= 0}
 * @param parallelism maximum concurrent calls; {@code >= 1}
 * @param callTimeout per-call budget measured from the moment the call starts, after the gate; also bounds how
 *     long a unit may wait for a free worker; positive
 * @since 0.1.0
 */
public record PollSettings(
    RateGate gate, int batchSize, Duration batchCooldown, int parallelism, Duration callTimeout) {

  public PollSettings {
    Objects.requireNonNull(gate, "gate");
    Objects.requireNonNull(batchCooldown, "batchCooldown");
    Objects.requireNonNull(callTimeout, "callTimeout");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1 (was " + batchSize + ")");
    }
    if (batchCooldown.isNegative()) {
      throw new IllegalArgumentException("batchCooldown must be >= 0 (was " + batchCooldown + ")");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1 (was " + parallelism + ")");
    }
    if (callTimeout.isZero() || callTimeout.isNegative()) {
      throw new IllegalArgumentException("callTimeout must be positive (was " + callTimeout + ")");
    }
  }
}
