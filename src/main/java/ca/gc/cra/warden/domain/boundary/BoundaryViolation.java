package ca.gc.cra.warden.domain.boundary;

import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a boundary rule denying or quarantining an access.
 *
 * @param id unique violation identifier; never {@code null}
 * @param timestamp detection time; never {@code null}
 * @param violationType classification derived from the matched rule; never {@code null}
 * @param boundaryId boundary whose rule matched; never {@code null}
 * @param ruleId matched rule; never {@code null}
 * @param sourcePath source process path; never {@code null}
 * @param targetPath offending target; never {@code null}
 * @param projectId project owning the target; may be {@code null}
 * @param severity severity from the action/boundary table; never {@code null}
 * @param blocked whether enforcement removed or isolated the artifact
 * @param remediationAction description of the enforcement outcome; never {@code null}
 * @param evidence supporting attributes; never {@code null}
 * @since 0.1.0
 */
public record BoundaryViolation(
    String id,
    Instant timestamp,
    ViolationType violationType,
    String boundaryId,
    String ruleId,
    String sourcePath,
    String targetPath,
    String projectId,
    Severity severity,
    boolean blocked,
    String remediationAction,
    Map<String, String> evidence) {

  public BoundaryViolation {
    id = Objects.requireNonNull(id, "id");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    violationType = Objects.requireNonNull(violationType, "violationType");
    boundaryId = Objects.requireNonNull(boundaryId, "boundaryId");
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
    targetPath = Objects.requireNonNull(targetPath, "targetPath");
    severity = Objects.requireNonNull(severity, "severity");
    remediationAction = Objects.requireNonNull(remediationAction, "remediationAction");
    evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
  }

  /**
   * Returns a copy carrying the enforcement outcome.
   *
   * @param wasBlocked whether the artifact was removed or isolated
   * @param remediation description of what enforcement did
   * @param extraEvidence attributes appended to the evidence map
   * @return updated violation
   */
  public BoundaryViolation withEnforcement(
      boolean wasBlocked, String remediation, Map<String, String> extraEvidence) {
    Map<String, String> merged = new LinkedHashMap<>(evidence);
    if (extraEvidence != null) {
      merged.putAll(extraEvidence);
    }
    return new BoundaryViolation(
        id,
        timestamp,
        violationType,
        boundaryId,
        ruleId,
        sourcePath,
        targetPath,
        projectId,
        severity,
        wasBlocked,
        remediation,
        merged);
  }
}
