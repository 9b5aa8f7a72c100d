package ca.gc.cra.warden.domain.boundary;

/**
 * Raw change kind reported by a directory watcher.
 *
 * @since 0.1.0
 */
public enum FileEventKind {
  CREATED,
  MODIFIED,
  DELETED
}
