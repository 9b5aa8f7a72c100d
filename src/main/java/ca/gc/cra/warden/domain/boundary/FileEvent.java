package ca.gc.cra.warden.domain.boundary;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Debounced filesystem change delivered by a directory watcher.
 *
 * @param path absolute path of the changed entry; never {@code null}
 * @param kind change kind; never {@code null}
 * @param observedAt time the change became write-stable; never {@code null}
 * @since 0.1.0
 */
public record FileEvent(Path path, FileEventKind kind, Instant observedAt) {
  public FileEvent {
    path = Objects.requireNonNull(path, "path");
    kind = Objects.requireNonNull(kind, "kind");
    observedAt = Objects.requireNonNull(observedAt, "observedAt");
  }
}
