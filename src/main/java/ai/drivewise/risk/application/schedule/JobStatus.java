package ai.drivewise.risk.application.schedule;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a job slot.
 *
 * @param kind job kind
 * @param state slot state
 * @param lastStart start of the most recent execution, if any
 * @param lastOutcome outcome of the most recent finished execution
 * @param runs executions started
 * @param skipped ticks skipped because the previous execution was still running
 * @param failures executions that ended with an exception
 * @since 0.1.0
 */
public record JobStatus(
    JobKind kind,
    JobState state,
    Optional<Instant> lastStart,
    JobOutcome lastOutcome,
    long runs,
    long skipped,
    long failures) {}
