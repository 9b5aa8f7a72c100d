package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.boundary.BoundaryViolation;
import ca.gc.cra.warden.domain.isolation.DetectionPattern;
import ca.gc.cra.warden.domain.isolation.ThreatDetectionRule;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.path.PathTraversalAttempt;
import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed set of events the path guard, boundary engine and zero-trust layer raise towards
 * the orchestrator.
 * <p><strong>Role:</strong> Payload of the security event channel; each event becomes exactly one incident.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 * <p>Dispatch goes through {@link Visitor}, so adding a variant fails compilation until every consumer handles
 * it.</p>
 *
 * @since 0.1.0
 */
public sealed interface SecurityEvent {

  Instant timestamp();

  /**
   * Project implicated by the event.
   *
   * @return project id, or {@code null} when the event is not project scoped
   */
  String projectId();

  Severity severity();

  <R> R accept(Visitor<R> visitor);

  /**
   * Exhaustive handler over every event variant.
   *
   * @param <R> result type
   */
  interface Visitor<R> {
    R visitTraversalAttempt(TraversalAttemptDetected event);

    R visitUnsafePath(UnsafePathDetected event);

    R visitBoundaryViolation(BoundaryViolationDetected event);

    R visitIntegrityViolation(IntegrityViolationDetected event);

    R visitThreat(ThreatDetected event);

    R visitBoundaryCompromised(BoundaryCompromised event);

    R visitProjectQuarantined(ProjectQuarantined event);

    R visitVerificationAlert(VerificationAlert event);

    R visitUnauthorizedAccess(UnauthorizedAccess event);
  }

  /**
   * Path validation classified an attack.
   *
   * @param attempt recorded attempt
   */
  record TraversalAttemptDetected(PathTraversalAttempt attempt) implements SecurityEvent {
    public TraversalAttemptDetected {
      Objects.requireNonNull(attempt, "attempt");
    }

    @Override
    public Instant timestamp() {
      return attempt.timestamp();
    }

    @Override
    public String projectId() {
      return attempt.projectId();
    }

    @Override
    public Severity severity() {
      return attempt.severity();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTraversalAttempt(this);
    }
  }

  /**
   * Path validation rejected a path without classifying an attack.
   *
   * @param timestamp detection time
   * @param projectId project the validation ran for; may be {@code null}
   * @param originalPath caller input
   * @param normalizedPath canonical target
   * @param operation requested operation
   * @param severity high for protected targets, medium otherwise
   * @param violations rejection reasons
   */
  record UnsafePathDetected(
      Instant timestamp,
      String projectId,
      String originalPath,
      String normalizedPath,
      AccessOperation operation,
      Severity severity,
      List<String> violations) implements SecurityEvent {
    public UnsafePathDetected {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(originalPath, "originalPath");
      Objects.requireNonNull(normalizedPath, "normalizedPath");
      Objects.requireNonNull(operation, "operation");
      Objects.requireNonNull(severity, "severity");
      violations = violations == null ? List.of() : List.copyOf(violations);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnsafePath(this);
    }
  }

  /**
   * A boundary rule denied or quarantined an access.
   *
   * @param violation enforced violation
   */
  record BoundaryViolationDetected(BoundaryViolation violation) implements SecurityEvent {
    public BoundaryViolationDetected {
      Objects.requireNonNull(violation, "violation");
    }

    @Override
    public Instant timestamp() {
      return violation.timestamp();
    }

    @Override
    public String projectId() {
      return violation.projectId();
    }

    @Override
    public Severity severity() {
      return violation.severity();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoundaryViolation(this);
    }
  }

  /**
   * A boundary's content hash changed without any recorded change or enforcement.
   *
   * @param timestamp detection time
   * @param boundaryId tampered boundary
   * @param projectId owning project; may be {@code null}
   * @param rootPath boundary root
   * @param expectedHash previous baseline
   * @param actualHash recomputed hash
   */
  record IntegrityViolationDetected(
      Instant timestamp,
      String boundaryId,
      String projectId,
      String rootPath,
      String expectedHash,
      String actualHash) implements SecurityEvent {
    public IntegrityViolationDetected {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(boundaryId, "boundaryId");
      Objects.requireNonNull(rootPath, "rootPath");
      Objects.requireNonNull(expectedHash, "expectedHash");
      Objects.requireNonNull(actualHash, "actualHash");
    }

    @Override
    public Severity severity() {
      return Severity.CRITICAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIntegrityViolation(this);
    }
  }

  /**
   * A threat detection pattern matched recent project activity.
   *
   * @param timestamp detection time
   * @param projectId affected project
   * @param rule matched rule
   * @param pattern matched pattern
   * @param evidence matched activity, truncated
   */
  record ThreatDetected(
      Instant timestamp,
      String projectId,
      ThreatDetectionRule rule,
      DetectionPattern pattern,
      String evidence) implements SecurityEvent {
    public ThreatDetected {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(projectId, "projectId");
      Objects.requireNonNull(rule, "rule");
      Objects.requireNonNull(pattern, "pattern");
      evidence = evidence == null ? "" : evidence;
    }

    @Override
    public Severity severity() {
      return pattern.severity();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitThreat(this);
    }
  }

  /**
   * A project's isolation integrity score dropped below the compromise threshold.
   *
   * @param timestamp detection time
   * @param projectId affected project
   * @param integrityScore score after the drop
   * @param reason failed check detail
   */
  record BoundaryCompromised(Instant timestamp, String projectId, double integrityScore, String reason)
      implements SecurityEvent {
    public BoundaryCompromised {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(projectId, "projectId");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public Severity severity() {
      return Severity.CRITICAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoundaryCompromised(this);
    }
  }

  /**
   * The zero-trust layer quarantined a project on its own initiative.
   *
   * @param timestamp quarantine time
   * @param projectId quarantined project
   * @param reason triggering check or threat
   */
  record ProjectQuarantined(Instant timestamp, String projectId, String reason) implements SecurityEvent {
    public ProjectQuarantined {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(projectId, "projectId");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public Severity severity() {
      return Severity.HIGH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProjectQuarantined(this);
    }
  }

  /**
   * A verification check with an alert failure action reached its threshold.
   *
   * @param timestamp detection time
   * @param projectId affected project
   * @param checkName failing check
   * @param detail failure detail
   */
  record VerificationAlert(Instant timestamp, String projectId, String checkName, String detail)
      implements SecurityEvent {
    public VerificationAlert {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(projectId, "projectId");
      Objects.requireNonNull(checkName, "checkName");
      Objects.requireNonNull(detail, "detail");
    }

    @Override
    public Severity severity() {
      return Severity.MEDIUM;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVerificationAlert(this);
    }
  }

  /**
   * The per-project access gate refused an access.
   *
   * @param timestamp denial time
   * @param projectId project the access was attempted for
   * @param operation requested operation
   * @param targetPath requested target
   * @param reason denial reason
   */
  record UnauthorizedAccess(
      Instant timestamp, String projectId, AccessOperation operation, String targetPath, String reason)
      implements SecurityEvent {
    public UnauthorizedAccess {
      Objects.requireNonNull(timestamp, "timestamp");
      Objects.requireNonNull(projectId, "projectId");
      Objects.requireNonNull(operation, "operation");
      Objects.requireNonNull(targetPath, "targetPath");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public Severity severity() {
      return Severity.HIGH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnauthorizedAccess(this);
    }
  }
}
