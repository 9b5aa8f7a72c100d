package ca.gc.cra.warden.application.path;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Roots and limits used by {@link PathGuard}.
 *
 * @param frameworkRoot framework installation root; always protected
 * @param wardenHome Warden state directory; always protected
 * @param sandboxRoot parent directory of project sandboxes
 * @param protectedPaths every protected root, framework root and Warden home included
 * @param readOnlyRoots roots readable by every project and exempt from protection for reads
 * @param historyLimit capacity of the traversal attempt ring
 * @since 0.1.0
 */
public record PathGuardSettings(
    Path frameworkRoot,
    Path wardenHome,
    Path sandboxRoot,
    List<Path> protectedPaths,
    List<Path> readOnlyRoots,
    int historyLimit) {

  public PathGuardSettings {
    frameworkRoot = normalize(Objects.requireNonNull(frameworkRoot, "frameworkRoot"));
    wardenHome = normalize(Objects.requireNonNull(wardenHome, "wardenHome"));
    sandboxRoot = normalize(Objects.requireNonNull(sandboxRoot, "sandboxRoot"));
    protectedPaths = normalizeAll(protectedPaths);
    readOnlyRoots = normalizeAll(readOnlyRoots);
    if (historyLimit <= 0) {
      throw new IllegalArgumentException("historyLimit must be positive");
    }
    for (Path protectedPath : protectedPaths) {
      if (sandboxRoot.startsWith(protectedPath)) {
        throw new IllegalArgumentException(
            "sandboxRoot " + sandboxRoot + " must not lie under protected path " + protectedPath);
      }
    }
  }

  /**
   * Builds settings with the standard protected and read-only roots derived from the framework root and Warden
   * home.
   *
   * @param frameworkRoot framework installation root
   * @param wardenHome Warden state directory
   * @param sandboxRoot parent directory of project sandboxes
   * @param additionalProtected further protected roots (system directories, credential stores)
   * @param historyLimit capacity of the traversal attempt ring
   * @return settings
   */
  public static PathGuardSettings of(
      Path frameworkRoot, Path wardenHome, Path sandboxRoot, List<Path> additionalProtected, int historyLimit) {
    Path framework = normalize(frameworkRoot);
    Path home = normalize(wardenHome);
    Set<Path> protectedRoots = new LinkedHashSet<>();
    protectedRoots.add(framework);
    protectedRoots.add(home);
    if (additionalProtected != null) {
      additionalProtected.stream().map(PathGuardSettings::normalize).forEach(protectedRoots::add);
    }
    List<Path> readOnly = new ArrayList<>();
    readOnly.add(framework.resolve("docs"));
    readOnly.add(framework.resolve("examples"));
    readOnly.add(home.resolve("rag"));
    readOnly.add(home.resolve("logs"));
    return new PathGuardSettings(
        framework, home, sandboxRoot, List.copyOf(protectedRoots), readOnly, historyLimit);
  }

  private static List<Path> normalizeAll(List<Path> paths) {
    return paths == null ? List.of() : paths.stream().map(PathGuardSettings::normalize).toList();
  }

  private static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
