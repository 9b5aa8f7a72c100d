package ca.gc.cra.warden.domain.isolation;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Zero-trust isolation boundary owned by one project.
 *
 * @param boundaryId identifier shared with the project's sandbox boundary; never {@code null}
 * @param projectId owning project; never {@code null}
 * @param projectRoot absolute project root; never {@code null}
 * @param securityLevel level the catalog was selected for; never {@code null}
 * @param boundaryType isolation nature; never {@code null}
 * @param enforcementMechanisms active mechanisms; never {@code null}
 * @param verificationChecks checks run by the monitoring loop; never {@code null}
 * @param metrics live counters; never {@code null}
 * @param createdAt creation time; never {@code null}
 * @since 0.1.0
 */
public record ProjectIsolationBoundary(
    String boundaryId,
    String projectId,
    Path projectRoot,
    SecurityLevel securityLevel,
    IsolationBoundaryType boundaryType,
    List<EnforcementMechanism> enforcementMechanisms,
    List<VerificationCheck> verificationChecks,
    BoundaryMetrics metrics,
    Instant createdAt) {

  public ProjectIsolationBoundary {
    boundaryId = Objects.requireNonNull(boundaryId, "boundaryId");
    projectId = Objects.requireNonNull(projectId, "projectId");
    projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
    securityLevel = Objects.requireNonNull(securityLevel, "securityLevel");
    boundaryType = Objects.requireNonNull(boundaryType, "boundaryType");
    enforcementMechanisms = enforcementMechanisms == null ? List.of() : List.copyOf(enforcementMechanisms);
    verificationChecks = verificationChecks == null ? List.of() : List.copyOf(verificationChecks);
    metrics = Objects.requireNonNull(metrics, "metrics");
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Finds the check of the given kind.
   *
   * @param kind verification kind
   * @return matching check when configured
   */
  public Optional<VerificationCheck> check(CheckKind kind) {
    return verificationChecks.stream().filter(check -> check.kind() == kind).findFirst();
  }
}
