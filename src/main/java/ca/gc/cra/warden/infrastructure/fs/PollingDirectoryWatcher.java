package ca.gc.cra.warden.infrastructure.fs;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.DirectoryWatchPort;
import ca.gc.cra.warden.domain.boundary.FileEvent;
import ca.gc.cra.warden.domain.boundary.FileEventKind;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Directory watcher that rescans a tree on every poll and reports write-stable changes.
 * <p><strong>Why:</strong> Reacting to a half-written file would judge an artifact that is not finished yet; a
 * change is only delivered once its size and modification time have stayed unchanged for {@code stableMillis}.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link DirectoryWatchPort} for the boundary engine.</p>
 * <p><strong>Thread-safety:</strong> Each handle is polled from the security loop; {@code poll} is synchronized
 * per handle.</p>
 * <p><strong>Performance:</strong> One metadata walk per poll; symbolic links are never followed.</p>
 *
 * @implNote Deletions are delivered on the poll that notices them. Directory modification times are ignored so that
 * adding a child reports the child only.
 * @since 0.1.0
 */
public final class PollingDirectoryWatcher implements DirectoryWatchPort {
  private static final Logger log = LoggerFactory.getLogger(PollingDirectoryWatcher.class);

  private final ClockPort clock;
  private final long stableMillis;

  /**
   * Creates a watcher.
   *
   * @param clock time source used for stability checks
   * @param stableMillis how long a change must stay unchanged before delivery; 0 delivers on the same poll
   */
  public PollingDirectoryWatcher(ClockPort clock, long stableMillis) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (stableMillis < 0) {
      throw new IllegalArgumentException("stableMillis must not be negative");
    }
    this.stableMillis = stableMillis;
  }

  @Override
  public WatchHandle watch(Path root, Consumer<FileEvent> listener) throws IOException {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(listener, "listener");
    Handle handle = new Handle(root.toAbsolutePath().normalize(), listener);
    handle.baseline();
    return handle;
  }

  private record Signature(boolean directory, long size, long modifiedMillis) {
    static Signature of(BasicFileAttributes attrs) {
      if (attrs.isDirectory()) {
        return new Signature(true, 0L, 0L);
      }
      return new Signature(false, attrs.size(), attrs.lastModifiedTime().toMillis());
    }
  }

  private record Pending(Signature signature, long firstSeenMillis) {}

  private final class Handle implements WatchHandle {
    private final Path root;
    private final Consumer<FileEvent> listener;
    private final Map<Path, Signature> known = new HashMap<>();
    private final Map<Path, Pending> pending = new HashMap<>();
    private volatile boolean closed;

    Handle(Path root, Consumer<FileEvent> listener) {
      this.root = root;
      this.listener = listener;
    }

    synchronized void baseline() throws IOException {
      known.putAll(scan());
    }

    @Override
    public Path root() {
      return root;
    }

    @Override
    public synchronized void poll() {
      if (closed) {
        return;
      }
      Map<Path, Signature> current;
      try {
        current = scan();
      } catch (IOException ex) {
        log.warn("Unable to scan watched directory {}", root, ex);
        return;
      }
      long now = clock.nowMillis();
      List<FileEvent> ready = new ArrayList<>();

      Iterator<Map.Entry<Path, Signature>> knownEntries = known.entrySet().iterator();
      while (knownEntries.hasNext()) {
        Map.Entry<Path, Signature> entry = knownEntries.next();
        if (!current.containsKey(entry.getKey())) {
          knownEntries.remove();
          pending.remove(entry.getKey());
          ready.add(new FileEvent(entry.getKey(), FileEventKind.DELETED, clock.now()));
        }
      }
      pending.keySet().removeIf(path -> !current.containsKey(path));

      for (Map.Entry<Path, Signature> entry : current.entrySet()) {
        Path path = entry.getKey();
        Signature signature = entry.getValue();
        Signature previous = known.get(path);
        if (signature.equals(previous)) {
          pending.remove(path);
          continue;
        }
        Pending waiting = pending.get(path);
        if (waiting == null || !waiting.signature().equals(signature)) {
          waiting = new Pending(signature, now);
          pending.put(path, waiting);
        }
        if (now - waiting.firstSeenMillis() >= stableMillis) {
          pending.remove(path);
          known.put(path, signature);
          FileEventKind kind = previous == null ? FileEventKind.CREATED : FileEventKind.MODIFIED;
          ready.add(new FileEvent(path, kind, clock.now()));
        }
      }

      for (FileEvent event : ready) {
        try {
          listener.accept(event);
        } catch (RuntimeException ex) {
          log.warn("Watch listener failed for {} {}", event.kind(), event.path(), ex);
        }
      }
    }

    @Override
    public synchronized int pendingChanges() {
      return pending.size();
    }

    @Override
    public void close() {
      closed = true;
    }

    private Map<Path, Signature> scan() throws IOException {
      Map<Path, Signature> snapshot = new TreeMap<>();
      if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
        return snapshot;
      }
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
          if (!dir.equals(root)) {
            snapshot.put(dir, Signature.of(attrs));
          }
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          snapshot.put(file, Signature.of(attrs));
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
          log.debug("Skipping unreadable entry {}: {}", file, exc.getMessage());
          return FileVisitResult.CONTINUE;
        }
      });
      return snapshot;
    }
  }
}
