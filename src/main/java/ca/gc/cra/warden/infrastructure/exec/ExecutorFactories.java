package ca.gc.cra.warden.infrastructure.exec;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors the security core runs on.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded security loop that runs watcher polls, integrity checks, verification timers,
   * threat scans, event drains and posture assessments.
   *
   * @param prefix thread-name prefix; blank selects {@code warden-security}
   * @return scheduled executor with one daemon thread
   */
  public static ScheduledExecutorService newSecurityLoop(String prefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "warden-security" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
          (t, ex) -> log.error("Uncaught exception on security loop thread {}", t.getName(), ex));
      return thread;
    };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }
}
