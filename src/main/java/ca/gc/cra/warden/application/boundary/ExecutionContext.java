package ca.gc.cra.warden.application.boundary;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of the project the agent layer is currently operating in.
 *
 * <p>Scopes belong to the thread that entered them: boundary rules and cross-project checks running on a caller
 * thread only see that thread's project. Scopes nest; closing a scope restores the previously active project.
 * Watcher events are delivered on the security loop, which never enters a scope, so they are attributed through
 * {@link #attributedProject()}.</p>
 *
 * @since 0.1.0
 */
public final class ExecutionContext {
  private final ThreadLocal<Deque<String>> scopes = ThreadLocal.withInitial(ArrayDeque::new);
  private final ConcurrentMap<String, Integer> openScopes = new ConcurrentHashMap<>();

  /**
   * Makes {@code projectId} the active project of the calling thread until the returned scope is closed.
   *
   * @param projectId project the agent operates in
   * @return scope restoring the previous project on close
   * @throws IllegalArgumentException when {@code projectId} is blank
   */
  public Scope enter(String projectId) {
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
    Deque<String> stack = scopes.get();
    synchronized (stack) {
      stack.push(projectId);
    }
    openScopes.merge(projectId, 1, Integer::sum);
    return new Scope(projectId, stack);
  }

  /**
   * Project of the innermost open scope on the calling thread.
   *
   * @return active project, or empty outside any scope
   */
  public Optional<String> activeProject() {
    Deque<String> stack = scopes.get();
    synchronized (stack) {
      return Optional.ofNullable(stack.peek());
    }
  }

  /**
   * Project a change seen by a watcher can be attributed to: the calling thread's own scope, otherwise the single
   * project holding open scopes anywhere in the process.
   *
   * @return attributed project; empty when no scope is open or several projects are active
   */
  public Optional<String> attributedProject() {
    Optional<String> own = activeProject();
    if (own.isPresent()) {
      return own;
    }
    Set<String> open = Set.copyOf(openScopes.keySet());
    return open.size() == 1 ? open.stream().findFirst() : Optional.empty();
  }

  /** Active-project scope; closing it twice has no further effect. */
  public final class Scope implements AutoCloseable {
    private final String projectId;
    private final Deque<String> stack;
    private boolean closed;

    private Scope(String projectId, Deque<String> stack) {
      this.projectId = projectId;
      this.stack = stack;
    }

    public String projectId() {
      return projectId;
    }

    @Override
    public void close() {
      synchronized (stack) {
        if (closed) {
          return;
        }
        closed = true;
        stack.removeFirstOccurrence(projectId);
      }
      openScopes.computeIfPresent(projectId, (id, count) -> count <= 1 ? null : count - 1);
    }
  }
}
