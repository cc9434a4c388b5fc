package ai.drivewise.risk.application.poll;

import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs an upstream call over a list of units with rate limiting, batching, bounded
 * parallelism and per-unit failure isolation.
 * <p><strong>Why:</strong> One bad coordinate or VIN must not lose the rest of a sweep, and concurrent workers must
 * still respect the upstream's spacing contract.</p>
 * <p><strong>Role:</strong> Application service used by the traffic, incident and vehicle sweeps.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Issue units in batches of {@code batchSize}, pausing {@code batchCooldown} between batches.</li>
 *   <li>Acquire a {@link RateGate} slot on the worker thread immediately before each call, so spacing holds
 *       however the pool schedules queued units.</li>
 *   <li>Keep at most {@code parallelism} calls in flight on a per-run worker pool.</li>
 *   <li>Cancel calls running longer than {@code callTimeout} after they start, and units left waiting for a
 *       worker for {@code callTimeout}, recording both as {@link TimeoutException} failures.</li>
 *   <li>On cancellation or interrupt, stop issuing, let in-flight calls finish or expire, and record every unit
 *       never issued as a {@link CancellationException} failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #run} call owns its pool; one instance may serve concurrent runs.</p>
 * <p><strong>Performance:</strong> Worker threads are created per run; sweeps are minutes apart.</p>
 * <p><strong>Observability:</strong> Emits {@code poller.<name>.unit.success|failure|timeout|cancelled},
 * {@code poller.<name>.gate.waitNanos} and {@code poller.<name>.run.durationNanos}.</p>
 *
 * @since 0.1.0
 */
public final class RateLimitedPoller {
  private static final Logger log = LoggerFactory.getLogger(RateLimitedPoller.class);

  private final String name;
  private final MetricsPort metrics;

  /**
   * Creates a poller.
   *
   * @param name short name used for worker threads and metric keys, e.g. {@code traffic}
   * @param metrics metrics sink; must not be {@code null}
   */
  public RateLimitedPoller(String name, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs {@code call} over every unit.
   *
   * <p>Never throws for unit failures. If the calling thread is interrupted the run behaves as cancelled and the
   * interrupt flag is restored before returning.</p>
   *
   * @param units units to process in order
   * @param call per-unit call
   * @param settings pacing and bounds
   * @param cancellation signal that stops new units from being issued
   * @param <U> unit type
   * @param <R> result type
   * @return result accounting for every unit exactly once
   */
  public <U, R> PollResult<U, R> run(
      List<U> units, UnitCall<U, R> call, PollSettings settings, CancellationSignal cancellation) {
    Objects.requireNonNull(units, "units");
    Objects.requireNonNull(call, "call");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(cancellation, "cancellation");

    long started = System.nanoTime();
    Run<U, R> run = new Run<>(settings, cancellation);
    if (units.isEmpty()) {
      return new PollResult<>(List.of(), List.of(), false);
    }

    ExecutorService pool = ExecutorFactories.newWorkerPool(
        Math.min(settings.parallelism(), units.size()), "poll-" + name, null);
    CompletionService<R> completions = new ExecutorCompletionService<>(pool);
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    try {
      int index = 0;
      while (index < units.size() && !run.stopped()) {
        int batchEnd = Math.min(units.size(), index + settings.batchSize());
        for (; index < batchEnd; index++) {
          if (run.checkCancelled()) {
            break;
          }
          while (run.inFlight.size() >= settings.parallelism()) {
            run.awaitOne(completions);
          }
          if (run.checkCancelled()) {
            break;
          }
          InFlight<U> pending = new InFlight<>(units.get(index), System.nanoTime());
          Future<R> future = completions.submit(() -> invoke(call, pending, settings.gate(), mdc));
          run.inFlight.put(future, pending);
        }
        while (!run.inFlight.isEmpty()) {
          run.awaitOne(completions);
        }
        if (index < units.size() && !run.stopped()) {
          run.cooldown();
        }
      }
      for (int i = index; i < units.size(); i++) {
        run.failed.add(new PollFailure<>(units.get(i),
            new CancellationException("poll cancelled before unit was issued")));
        metrics.increment(key("unit.cancelled"));
      }
    } finally {
      pool.shutdownNow();
      if (run.interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    metrics.observe(key("run.durationNanos"), System.nanoTime() - started);
    log.info("Poller {} finished: {} succeeded, {} failed of {} units{}",
        name, run.succeeded.size(), run.failed.size(), units.size(), run.stopped() ? " (cancelled)" : "");
    return new PollResult<>(run.succeeded, run.failed, run.stopped());
  }

  private <U, R> R invoke(UnitCall<U, R> call, InFlight<U> pending, RateGate gate, Map<String, String> mdc)
      throws Exception {
    pending.running = true;
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try {
      long before = System.nanoTime();
      gate.acquire();
      metrics.observe(key("gate.waitNanos"), System.nanoTime() - before);
      pending.callStartedNanos = System.nanoTime();
      pending.callStarted = true;
      R result = call.call(pending.unit);
      if (result == null) {
        throw new IllegalStateException("call returned null for unit " + pending.unit);
      }
      return result;
    } finally {
      MDC.clear();
    }
  }

  private String key(String suffix) {
    return "poller." + name + "." + suffix;
  }

  /** Unit handed to the pool; the worker flips the flags as it picks the unit up and starts the call. */
  private static final class InFlight<U> {
    private final U unit;
    private final long submittedNanos;
    private volatile boolean running;
    private volatile boolean callStarted;
    private volatile long callStartedNanos;

    private InFlight(U unit, long submittedNanos) {
      this.unit = unit;
      this.submittedNanos = submittedNanos;
    }

    /** Returns the nanoTime deadline, or {@code null} while the worker is waiting on the gate. */
    Long deadline(long timeoutNanos) {
      if (callStarted) {
        return callStartedNanos + timeoutNanos;
      }
      if (!running) {
        return submittedNanos + timeoutNanos;
      }
      return null;
    }
  }

  private final class Run<U, R> {
    private final PollSettings settings;
    private final CancellationSignal cancellation;
    private final Map<Future<R>, InFlight<U>> inFlight = new LinkedHashMap<>();
    private final List<R> succeeded = new ArrayList<>();
    private final List<PollFailure<U>> failed = new ArrayList<>();
    private boolean cancelled;
    private boolean interrupted;

    private Run(PollSettings settings, CancellationSignal cancellation) {
      this.settings = settings;
      this.cancellation = cancellation;
    }

    boolean stopped() {
      return cancelled || interrupted;
    }

    boolean checkCancelled() {
      if (Thread.interrupted()) {
        markInterrupted();
      }
      if (!cancelled && cancellation.isCancelled()) {
        cancelled = true;
        log.info("Poller {} cancelled; no further units will be issued", name);
      }
      return stopped();
    }

    void cooldown() {
      if (settings.batchCooldown().isZero()) {
        return;
      }
      log.debug("Poller {} cooling down for {} ms", name, settings.batchCooldown().toMillis());
      try {
        if (cancellation.await(settings.batchCooldown())) {
          checkCancelled();
        }
      } catch (InterruptedException ex) {
        markInterrupted();
      }
    }

    void awaitOne(CompletionService<R> completions) {
      long now = System.nanoTime();
      long timeout = settings.callTimeout().toNanos();
      long earliest = timeout;
      for (InFlight<U> pending : inFlight.values()) {
        Long deadline = pending.deadline(timeout);
        if (deadline != null) {
          earliest = Math.min(earliest, deadline - now);
        }
      }
      Future<R> done = null;
      if (earliest > 0) {
        try {
          done = completions.poll(earliest, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
          markInterrupted();
          return;
        }
      }
      if (done == null) {
        expireOverdue();
        return;
      }
      InFlight<U> pending = inFlight.remove(done);
      if (pending != null) {
        collect(done, pending);
      }
    }

    private void collect(Future<R> done, InFlight<U> pending) {
      try {
        succeeded.add(done.get());
        metrics.increment(key("unit.success"));
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        failed.add(new PollFailure<>(pending.unit, cause));
        metrics.increment(key("unit.failure"));
        log.debug("Poller {} unit {} failed: {}", name, pending.unit, cause.toString());
      } catch (CancellationException ex) {
        failed.add(new PollFailure<>(pending.unit, ex));
        metrics.increment(key("unit.failure"));
      } catch (InterruptedException ex) {
        markInterrupted();
        failed.add(new PollFailure<>(pending.unit, ex));
        metrics.increment(key("unit.failure"));
      }
    }

    private void expireOverdue() {
      long now = System.nanoTime();
      long timeoutMillis = settings.callTimeout().toMillis();
      Iterator<Map.Entry<Future<R>, InFlight<U>>> it = inFlight.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<Future<R>, InFlight<U>> entry = it.next();
        InFlight<U> pending = entry.getValue();
        boolean queued = !pending.running;
        Long deadline = pending.deadline(settings.callTimeout().toNanos());
        if (deadline == null || deadline - now > 0) {
          continue;
        }
        Future<R> future = entry.getKey();
        if (future.isDone()) {
          it.remove();
          collect(future, pending);
          continue;
        }
        future.cancel(true);
        it.remove();
        String reason = queued
            ? "no worker free within " + timeoutMillis + " ms"
            : "call exceeded " + timeoutMillis + " ms";
        failed.add(new PollFailure<>(pending.unit, new TimeoutException(reason)));
        metrics.increment(key("unit.timeout"));
        log.warn("Poller {} unit {} timed out: {}", name, pending.unit, reason);
      }
    }

    private void markInterrupted() {
      if (!interrupted) {
        log.warn("Poller {} interrupted; draining in-flight calls", name);
      }
      interrupted = true;
    }
  }
}
