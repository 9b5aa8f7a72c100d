package ca.gc.cra.warden.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collection;

/**
 * <strong>What:</strong> Filesystem validation utilities for Warden roots and project directories.
 * <p><strong>Why:</strong> Sandboxes, evidence and audit directories must be real, writable directories that do not
 * overlap protected framework paths.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked directory is judged by its own
 * location before its target is canonicalized.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Rejects raw path text carrying NUL or other control characters.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate path text
   * @return the input
   * @throws IllegalArgumentException if the text is {@code null}, contains NUL or control characters
   */
  public static String requireCleanPathText(String name, String raw) {
    String label = name == null || name.isBlank() ? "path" : name;
    if (raw == null) {
      throw new IllegalArgumentException(label + " must not be null");
    }
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(label + " must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label + " must not contain control characters");
      }
    }
    return raw;
  }

  /**
   * Validates a writable directory, optionally creating it, and confines it to {@code allowedBase}.
   *
   * @param path candidate directory; must not be {@code null}
   * @param allowedBase optional base directory; when non-null, {@code path} must reside within it
   * @param createIfMissing whether to create the directory and its parents when absent
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path escapes {@code allowedBase}, is not a writable directory, or
   *         creation fails
   */
  public static Path validateWritableDir(Path path, Path allowedBase, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    requireCleanPathText("path", path.toString());
    Path normalized = path.toAbsolutePath().normalize();
    Path base = allowedBase == null ? null : allowedBase.toAbsolutePath().normalize();
    ensureWithinBase(normalized, base);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (base != null && Files.exists(base)) {
        ensureWithinBase(real, base.toRealPath());
      }
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures {@code path} lies outside every protected root.
   *
   * @param path candidate path
   * @param protectedRoots roots the path must not fall under
   * @return normalized absolute path
   * @throws IllegalArgumentException if the path lies under a protected root
   */
  public static Path requireOutside(Path path, Collection<Path> protectedRoots) {
    Path normalized = path.toAbsolutePath().normalize();
    for (Path root : protectedRoots) {
      Path protectedRoot = root.toAbsolutePath().normalize();
      if (normalized.startsWith(protectedRoot)) {
        throw new IllegalArgumentException("path " + normalized + " lies under protected path " + protectedRoot);
      }
    }
    return normalized;
  }

  private static void ensureWithinBase(Path candidate, Path base) {
    if (base != null && !candidate.startsWith(base)) {
      throw new IllegalArgumentException("path " + candidate + " escapes allowed base " + base);
    }
  }
}
