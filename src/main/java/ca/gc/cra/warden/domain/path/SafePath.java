package ca.gc.cra.warden.domain.path;

import ca.gc.cra.warden.domain.security.Severity;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single path validation.
 *
 * <p>Carries no identifiers or timestamps so that two validations of the same input against an unchanged
 * filesystem compare equal.</p>
 *
 * @param originalPath caller-supplied input, verbatim; never {@code null}
 * @param sanitizedPath canonical absolute form of the decoded input; never {@code null}
 * @param safe whether the path lies under an allowed root and outside protected paths
 * @param violations human-readable reasons the path was rejected; empty when safe
 * @param recommendedPath safe alternative under the project sandbox, or the sanitized path when safe
 * @param attackType detected attack classification; {@code null} when none
 * @param severity severity of the finding; {@code null} when safe
 * @since 0.1.0
 */
public record SafePath(
    String originalPath,
    String sanitizedPath,
    boolean safe,
    List<String> violations,
    String recommendedPath,
    AttackType attackType,
    Severity severity) {

  public SafePath {
    originalPath = Objects.requireNonNull(originalPath, "originalPath");
    sanitizedPath = Objects.requireNonNull(sanitizedPath, "sanitizedPath");
    recommendedPath = Objects.requireNonNull(recommendedPath, "recommendedPath");
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  /**
   * Unsafe results are always blocked; callers must not perform the operation.
   *
   * @return {@code true} when the path was rejected
   */
  public boolean blocked() {
    return !safe;
  }

  public Optional<AttackType> attack() {
    return Optional.ofNullable(attackType);
  }
}
