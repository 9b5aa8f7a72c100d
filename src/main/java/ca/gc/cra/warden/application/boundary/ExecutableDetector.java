package ca.gc.cra.warden.application.boundary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Locale;
import java.util.Set;

/** Detects executables by extension or POSIX execute bits. */
final class ExecutableDetector {
  private static final Set<String> EXTENSIONS =
      Set.of(".sh", ".bash", ".zsh", ".exe", ".bat", ".cmd", ".ps1", ".com");
  private static final Set<PosixFilePermission> EXECUTE_BITS = Set.of(
      PosixFilePermission.OWNER_EXECUTE,
      PosixFilePermission.GROUP_EXECUTE,
      PosixFilePermission.OTHERS_EXECUTE);

  private ExecutableDetector() {}

  static boolean hasExecutableExtension(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return false;
    }
    String lower = name.toString().toLowerCase(Locale.ROOT);
    int dot = lower.lastIndexOf('.');
    return dot >= 0 && EXTENSIONS.contains(lower.substring(dot));
  }

  static boolean isExecutable(Path path) {
    if (hasExecutableExtension(path)) {
      return true;
    }
    if (!Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
      return false;
    }
    try {
      Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path, LinkOption.NOFOLLOW_LINKS);
      for (PosixFilePermission bit : EXECUTE_BITS) {
        if (permissions.contains(bit)) {
          return true;
        }
      }
      return false;
    } catch (UnsupportedOperationException | IOException ex) {
      return false;
    }
  }
}
