package ai.drivewise.risk.application.schedule;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs each registered job on its own cadence, once immediately on start.
 * <p><strong>Why:</strong> A six-hour vehicle sweep must never delay the fifteen-minute traffic sweep, and an
 * overrunning job must not pile up queued executions.</p>
 * <p><strong>Role:</strong> Application service driven by the {@code run} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fire ticks from a single ticker thread at fixed rate per job.</li>
 *   <li>Hand each tick to the job's dedicated worker when its slot is {@link JobState#IDLE}; otherwise skip it.</li>
 *   <li>Record job failures without affecting later ticks.</li>
 *   <li>On {@link #stop(Duration, Duration)} raise the shared cancellation signal, wait for the grace period,
 *       interrupt remaining work, then wait a bounded drain period for it to unwind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Slot state transitions are CAS based; {@link #start()} and
 * {@link #stop(Duration, Duration)} are synchronized. A scheduler instance runs once.</p>
 * <p><strong>Observability:</strong> {@code scheduler.job.started|completed|skipped|failed}; the MDC key
 * {@code job} carries the job label while its body runs.</p>
 *
 * @since 0.1.0
 */
public final class JobScheduler {
  private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
  static final String MDC_JOB = "job";

  private final List<Slot> slots;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CancellationSignal cancellation = new CancellationSignal();

  private ScheduledExecutorService ticker;
  private boolean started;
  private volatile boolean stopping;

  /**
   * Creates a scheduler.
   *
   * @param jobs jobs to run; at most one per kind
   * @param metrics metrics sink
   * @param clock clock used for status timestamps
   */
  public JobScheduler(List<ScheduledJob> jobs, MetricsPort metrics, ClockPort clock) {
    Objects.requireNonNull(jobs, "jobs");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    Set<JobKind> seen = EnumSet.noneOf(JobKind.class);
    List<Slot> built = new ArrayList<>();
    for (ScheduledJob job : jobs) {
      if (!seen.add(job.kind())) {
        throw new IllegalArgumentException("duplicate job " + job.kind());
      }
      built.add(new Slot(job));
    }
    this.slots = List.copyOf(built);
  }

  /**
   * Starts ticking. Every job runs once immediately.
   *
   * @throws IllegalStateException if the scheduler was already started
   */
  public synchronized void start() {
    if (started) {
      throw new IllegalStateException("scheduler already started");
    }
    started = true;
    ticker = ExecutorFactories.newTicker("drivewise-ticker");
    for (Slot slot : slots) {
      slot.worker = ExecutorFactories.newWorkerPool(1, "job-" + slot.job.kind().label(), null);
      ticker.scheduleAtFixedRate(
          () -> tick(slot), 0L, slot.job.cadence().toMillis(), TimeUnit.MILLISECONDS);
      log.info("Scheduled {} every {}", slot.job.kind(), slot.job.cadence());
    }
  }

  /**
   * Stops the scheduler without waiting for interrupted jobs to return.
   *
   * @param grace time allowed for running jobs to finish and flush
   * @return {@code true} if every job finished within the grace period
   * @see #stop(Duration, Duration)
   */
  public boolean stop(Duration grace) {
    return stop(grace, Duration.ZERO);
  }

  /**
   * Stops the scheduler. Running jobs see their cancellation signal raised; after {@code grace} they are
   * interrupted, and the call then waits up to {@code drain} for the interrupted jobs to return, so that whatever
   * they were still writing reaches the sink before the caller closes it.
   *
   * @param grace time allowed for running jobs to finish and flush
   * @param drain time allowed for interrupted jobs to unwind
   * @return {@code true} if every job finished within the grace period
   */
  public synchronized boolean stop(Duration grace, Duration drain) {
    Objects.requireNonNull(grace, "grace");
    Objects.requireNonNull(drain, "drain");
    if (!started || stopping) {
      return true;
    }
    stopping = true;
    log.info("Stopping scheduler (grace {} ms)", grace.toMillis());
    ticker.shutdownNow();
    for (Slot slot : slots) {
      slot.state.compareAndSet(JobState.RUNNING, JobState.CANCELLING);
    }
    cancellation.cancel();
    for (Slot slot : slots) {
      slot.worker.shutdown();
    }

    List<Slot> forced = new ArrayList<>();
    try {
      if (!awaitWorkers(slots, grace, forced)) {
        for (Slot slot : forced) {
          log.warn("Job {} still running after {} ms; interrupting", slot.job.kind(), grace.toMillis());
          slot.worker.shutdownNow();
        }
        List<Slot> stuck = new ArrayList<>();
        if (!awaitWorkers(forced, drain, stuck)) {
          stuck.forEach(slot -> log.warn("Job {} did not return within {} ms of being interrupted",
              slot.job.kind(), drain.toMillis()));
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      slots.forEach(slot -> slot.worker.shutdownNow());
      log.info("Scheduler stopped (forced)");
      return false;
    }
    boolean clean = forced.isEmpty();
    log.info("Scheduler stopped{}", clean ? "" : " (forced)");
    return clean;
  }

  private static boolean awaitWorkers(List<Slot> targets, Duration budget, List<Slot> unfinished)
      throws InterruptedException {
    long deadline = System.nanoTime() + budget.toNanos();
    for (Slot slot : targets) {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      if (!slot.worker.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
        unfinished.add(slot);
      }
    }
    return unfinished.isEmpty();
  }

  /**
   * Snapshot of every job slot in registration order.
   *
   * @return job statuses
   */
  public List<JobStatus> statuses() {
    List<JobStatus> out = new ArrayList<>(slots.size());
    for (Slot slot : slots) {
      out.add(new JobStatus(
          slot.job.kind(),
          slot.state.get(),
          Optional.ofNullable(slot.lastStart),
          slot.lastOutcome,
          slot.runs.get(),
          slot.skipped.get(),
          slot.failures.get()));
    }
    return out;
  }

  private void tick(Slot slot) {
    if (stopping) {
      return;
    }
    JobKind kind = slot.job.kind();
    if (!slot.state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
      slot.skipped.incrementAndGet();
      metrics.increment("scheduler.job.skipped");
      log.warn("Skipping {} tick; previous run is still {}", kind, slot.state.get());
      return;
    }
    try {
      slot.worker.execute(() -> execute(slot));
    } catch (RejectedExecutionException ex) {
      slot.state.set(JobState.IDLE);
      log.debug("Tick for {} rejected during shutdown", kind);
    }
  }

  private void execute(Slot slot) {
    JobKind kind = slot.job.kind();
    MDC.put(MDC_JOB, kind.label());
    Instant startedAt = clock.now();
    slot.lastStart = startedAt;
    slot.runs.incrementAndGet();
    metrics.increment("scheduler.job.started");
    log.info("Job {} started", kind);
    try {
      slot.job.body().run(cancellation);
      slot.lastOutcome = cancellation.isCancelled() ? JobOutcome.CANCELLED : JobOutcome.SUCCEEDED;
      metrics.increment("scheduler.job.completed");
      log.info("Job {} finished in {} ms ({})",
          kind, clock.nowMillis() - startedAt.toEpochMilli(), slot.lastOutcome);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      slot.lastOutcome = JobOutcome.CANCELLED;
      log.warn("Job {} interrupted", kind);
    } catch (Exception ex) {
      slot.failures.incrementAndGet();
      slot.lastOutcome = JobOutcome.FAILED;
      metrics.increment("scheduler.job.failed");
      log.error("Job {} failed", kind, ex);
    } finally {
      slot.state.set(JobState.IDLE);
      MDC.remove(MDC_JOB);
    }
  }

  private static final class Slot {
    private final ScheduledJob job;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile Instant lastStart;
    private volatile JobOutcome lastOutcome = JobOutcome.NEVER_RUN;
    private volatile ExecutorService worker;

    private Slot(ScheduledJob job) {
      this.job = job;
    }
  }
}
