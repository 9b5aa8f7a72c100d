package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.boundary.BoundaryViolation;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.SourceSystem;
import ca.gc.cra.warden.domain.isolation.ThreatCategory;
import ca.gc.cra.warden.domain.path.PathTraversalAttempt;
import ca.gc.cra.warden.domain.security.Severity;
import ca.gc.cra.warden.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every event variant to the incident it creates.
 *
 * @since 0.1.0
 */
final class IncidentMapper implements SecurityEvent.Visitor<IncidentDraft> {
  private static final int PATH_BYTES = 512;

  @Override
  public IncidentDraft visitTraversalAttempt(SecurityEvent.TraversalAttemptDetected event) {
    PathTraversalAttempt attempt = event.attempt();
    Map<String, String> evidence = new LinkedHashMap<>(attempt.evidence());
    evidence.put("attempt_id", attempt.id());
    evidence.put("attack_type", attempt.attackType().wireName());
    evidence.put("original_path", Logs.truncate(attempt.originalPath(), PATH_BYTES));
    evidence.put("normalized_path", Logs.truncate(attempt.normalizedPath(), PATH_BYTES));
    evidence.put("blocked", Boolean.toString(attempt.blocked()));
    return new IncidentDraft(
        IncidentType.PATH_TRAVERSAL_ATTACK,
        attempt.severity(),
        SourceSystem.PATH_GUARD,
        attempt.projectId(),
        attempt.intendedTarget(),
        "Path traversal attempt (" + attempt.attackType().wireName() + ") blocked: "
            + Logs.truncate(attempt.originalPath(), PATH_BYTES),
        evidence);
  }

  @Override
  public IncidentDraft visitUnsafePath(SecurityEvent.UnsafePathDetected event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("original_path", Logs.truncate(event.originalPath(), PATH_BYTES));
    evidence.put("normalized_path", Logs.truncate(event.normalizedPath(), PATH_BYTES));
    evidence.put("operation", event.operation().wireName());
    evidence.put("violations", String.join("; ", event.violations()));
    return new IncidentDraft(
        IncidentType.UNAUTHORIZED_ACCESS,
        event.severity(),
        SourceSystem.PATH_GUARD,
        event.projectId(),
        event.normalizedPath(),
        "Unsafe path rejected for " + event.operation().wireName() + ": " + String.join("; ", event.violations()),
        evidence);
  }

  @Override
  public IncidentDraft visitBoundaryViolation(SecurityEvent.BoundaryViolationDetected event) {
    BoundaryViolation violation = event.violation();
    Map<String, String> evidence = new LinkedHashMap<>(violation.evidence());
    evidence.put("violation_id", violation.id());
    evidence.put("violation_type", violation.violationType().wireName());
    evidence.put("boundary_id", violation.boundaryId());
    evidence.put("rule_id", violation.ruleId());
    evidence.put("source_path", violation.sourcePath());
    evidence.put("blocked", Boolean.toString(violation.blocked()));
    evidence.put("remediation_action", violation.remediationAction());
    return new IncidentDraft(
        IncidentType.BOUNDARY_VIOLATION,
        violation.severity(),
        SourceSystem.BOUNDARY_ENGINE,
        violation.projectId(),
        violation.targetPath(),
        "Boundary violation (" + violation.violationType().wireName() + ") in " + violation.boundaryId()
            + " by rule " + violation.ruleId() + ": " + violation.remediationAction(),
        evidence);
  }

  @Override
  public IncidentDraft visitIntegrityViolation(SecurityEvent.IntegrityViolationDetected event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("boundary_id", event.boundaryId());
    evidence.put("expected_hash", event.expectedHash());
    evidence.put("actual_hash", event.actualHash());
    return new IncidentDraft(
        IncidentType.SYSTEM_COMPROMISE,
        Severity.CRITICAL,
        SourceSystem.BOUNDARY_ENGINE,
        event.projectId(),
        event.rootPath(),
        "Integrity violation: content of boundary " + event.boundaryId() + " changed outside recorded activity",
        evidence);
  }

  @Override
  public IncidentDraft visitThreat(SecurityEvent.ThreatDetected event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("rule_id", event.rule().ruleId());
    evidence.put("threat_category", event.rule().category().wireName());
    evidence.put("pattern_type", event.pattern().patternType().wireName());
    evidence.put("pattern", event.pattern().pattern());
    evidence.put("confidence", Double.toString(event.pattern().confidence()));
    evidence.put("matched_activity", event.evidence());
    return new IncidentDraft(
        incidentTypeFor(event.rule().category()),
        event.pattern().severity(),
        SourceSystem.ZERO_TRUST,
        event.projectId(),
        null,
        "Threat detected by rule " + event.rule().ruleId() + " (" + event.rule().name() + ")",
        evidence);
  }

  static IncidentType incidentTypeFor(ThreatCategory category) {
    return switch (category) {
      case PRIVILEGE_ESCALATION -> IncidentType.PRIVILEGE_ESCALATION;
      case DATA_EXFILTRATION -> IncidentType.DATA_EXFILTRATION;
      case LATERAL_MOVEMENT -> IncidentType.UNAUTHORIZED_ACCESS;
      case PERSISTENCE, CODE_INJECTION, CONFIGURATION_TAMPERING, RESOURCE_EXHAUSTION ->
          IncidentType.POLICY_VIOLATION;
    };
  }

  @Override
  public IncidentDraft visitBoundaryCompromised(SecurityEvent.BoundaryCompromised event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("integrity_score", Double.toString(event.integrityScore()));
    evidence.put("reason", event.reason());
    return new IncidentDraft(
        IncidentType.SYSTEM_COMPROMISE,
        Severity.CRITICAL,
        SourceSystem.ZERO_TRUST,
        event.projectId(),
        null,
        "Isolation boundary of project " + event.projectId() + " compromised: " + event.reason(),
        evidence);
  }

  @Override
  public IncidentDraft visitProjectQuarantined(SecurityEvent.ProjectQuarantined event) {
    return new IncidentDraft(
        IncidentType.SYSTEM_COMPROMISE,
        Severity.HIGH,
        SourceSystem.ZERO_TRUST,
        event.projectId(),
        null,
        "Project " + event.projectId() + " quarantined: " + event.reason(),
        Map.of("reason", event.reason()));
  }

  @Override
  public IncidentDraft visitVerificationAlert(SecurityEvent.VerificationAlert event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("check_name", event.checkName());
    evidence.put("detail", event.detail());
    return new IncidentDraft(
        IncidentType.POLICY_VIOLATION,
        Severity.MEDIUM,
        SourceSystem.ZERO_TRUST,
        event.projectId(),
        null,
        "Verification check " + event.checkName() + " failed: " + event.detail(),
        evidence);
  }

  @Override
  public IncidentDraft visitUnauthorizedAccess(SecurityEvent.UnauthorizedAccess event) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("operation", event.operation().wireName());
    evidence.put("reason", event.reason());
    return new IncidentDraft(
        IncidentType.UNAUTHORIZED_ACCESS,
        Severity.HIGH,
        SourceSystem.ZERO_TRUST,
        event.projectId(),
        event.targetPath(),
        "Access denied for project " + event.projectId() + ": " + event.reason(),
        evidence);
  }
}
