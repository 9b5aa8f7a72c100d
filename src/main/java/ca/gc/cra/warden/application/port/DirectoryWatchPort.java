package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.boundary.FileEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Watches a directory tree and delivers debounced {@link FileEvent}s.
 * <p><strong>Role:</strong> Implemented by the polling watcher; driven by the boundary engine's poll task.</p>
 * <p><strong>Thread-safety:</strong> A handle is polled from one thread at a time.</p>
 *
 * @since 0.1.0
 */
public interface DirectoryWatchPort {
  /**
   * Starts watching {@code root}; the current contents become the baseline and raise no events.
   *
   * @param root directory to watch
   * @param listener receives write-stable changes during {@link WatchHandle#poll()}
   * @return handle used to poll and close the watch
   * @throws IOException when the initial scan fails
   */
  WatchHandle watch(Path root, Consumer<FileEvent> listener) throws IOException;

  /** Active watch on one directory tree. */
  interface WatchHandle extends AutoCloseable {
    Path root();

    /** Rescans the tree and delivers changes that have become write-stable. */
    void poll();

    /**
     * Number of changes detected but not yet delivered because they are still being written.
     *
     * @return changes waiting to become write-stable
     */
    int pendingChanges();

    @Override
    void close();
  }

  /** Watcher that never reports changes. */
  DirectoryWatchPort NONE = (root, listener) -> new WatchHandle() {
    @Override
    public Path root() {
      return root;
    }

    @Override
    public void poll() {}

    @Override
    public int pendingChanges() {
      return 0;
    }

    @Override
    public void close() {}
  };
}
