package ai.drivewise.risk.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named executors used by pollers and the job scheduler.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOG_UNCAUGHT =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for upstream calls. Callers bound the number of queued tasks themselves.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix, e.g. {@code poll-traffic}
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(defaultPrefix(prefix, "drivewise-worker"), handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-threaded ticker that fires scheduler ticks.
   *
   * @param prefix thread-name prefix
   * @return scheduled executor that drops cancelled ticks from its queue
   */
  public static ScheduledExecutorService newTicker(String prefix) {
    ScheduledThreadPoolExecutor ticker =
        new ScheduledThreadPoolExecutor(1, threadFactory(defaultPrefix(prefix, "drivewise-ticker"), null));
    ticker.setRemoveOnCancelPolicy(true);
    ticker.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return ticker;
  }

  private static ThreadFactory threadFactory(String prefix, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOG_UNCAUGHT);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static String defaultPrefix(String prefix, String fallback) {
    return (prefix == null || prefix.isBlank()) ? fallback : prefix;
  }
}
