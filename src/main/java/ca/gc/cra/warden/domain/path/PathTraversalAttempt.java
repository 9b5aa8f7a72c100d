package ca.gc.cra.warden.domain.path;

import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of an attack-classified path validation.
 *
 * @param id unique attempt identifier; never {@code null}
 * @param timestamp detection time; never {@code null}
 * @param attackType attack classification; never {@code null}
 * @param originalPath caller-supplied input; never {@code null}
 * @param normalizedPath canonical form of the decoded input; never {@code null}
 * @param intendedTarget best guess at what the attacker was after; never {@code null}
 * @param severity computed severity; never {@code null}
 * @param blocked whether the access was refused
 * @param projectId project the validation ran for; may be {@code null}
 * @param evidence decoding stages and matched indicators; never {@code null}
 * @since 0.1.0
 */
public record PathTraversalAttempt(
    String id,
    Instant timestamp,
    AttackType attackType,
    String originalPath,
    String normalizedPath,
    String intendedTarget,
    Severity severity,
    boolean blocked,
    String projectId,
    Map<String, String> evidence) {

  public PathTraversalAttempt {
    id = Objects.requireNonNull(id, "id");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    attackType = Objects.requireNonNull(attackType, "attackType");
    originalPath = Objects.requireNonNull(originalPath, "originalPath");
    normalizedPath = Objects.requireNonNull(normalizedPath, "normalizedPath");
    intendedTarget = Objects.requireNonNull(intendedTarget, "intendedTarget");
    severity = Objects.requireNonNull(severity, "severity");
    evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
  }
}
