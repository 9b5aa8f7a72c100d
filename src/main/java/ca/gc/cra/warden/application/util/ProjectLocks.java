package ca.gc.cra.warden.application.util;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per project id.
 *
 * <p>Quarantine and backup both touch the project root, so they run under the same project lock. Locks of
 * different projects never contend.</p>
 *
 * @since 0.1.0
 */
public final class ProjectLocks {
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code work} while holding the lock for {@code projectId}.
   *
   * @param projectId project to serialize on
   * @param work work to run
   * @param <T> result type
   * @return result of {@code work}
   */
  public <T> T withLock(String projectId, Supplier<T> work) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(work, "work");
    ReentrantLock lock = locks.computeIfAbsent(projectId, id -> new ReentrantLock());
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs {@code work} while holding the lock for {@code projectId}.
   *
   * @param projectId project to serialize on
   * @param work work to run
   */
  public void run(String projectId, Runnable work) {
    Objects.requireNonNull(work, "work");
    withLock(projectId, () -> {
      work.run();
      return null;
    });
  }

  boolean isLocked(String projectId) {
    ReentrantLock lock = locks.get(projectId);
    return lock != null && lock.isLocked();
  }
}
