package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.SecurityIncident;
import ca.gc.cra.warden.domain.incident.SecurityPosture;
import ca.gc.cra.warden.domain.incident.SystemHealth;
import ca.gc.cra.warden.domain.isolation.PendingApproval;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the comprehensive security report document.
 *
 * @since 0.1.0
 */
public final class SecurityReportBuilder {
  static final int REPORT_INCIDENTS = 100;

  private final Map<String, Object> report = new LinkedHashMap<>();

  public SecurityReportBuilder(Instant generatedAt) {
    report.put("generated_at", generatedAt.toString());
  }

  public SecurityReportBuilder posture(SecurityPosture posture) {
    report.put("security_posture", postureToMap(posture));
    return this;
  }

  public SecurityReportBuilder section(String name, Map<String, Object> section) {
    report.put(name, section);
    return this;
  }

  public SecurityReportBuilder incidents(List<SecurityIncident> incidents) {
    report.put("recent_incidents", IncidentDocuments.toMaps(incidents));
    return this;
  }

  public SecurityReportBuilder pendingApprovals(List<PendingApproval> approvals) {
    report.put("pending_approvals", approvals.stream().map(approval -> {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("approval_id", approval.approvalId());
      entry.put("project_id", approval.projectId());
      entry.put("rule_id", approval.ruleId());
      entry.put("action", approval.action().wireName());
      entry.put("requested_at", approval.requestedAt().toString());
      entry.put("target", approval.target());
      return entry;
    }).toList());
    return this;
  }

  public SecurityReportBuilder operationsPaused(boolean paused) {
    report.put("operations_paused", paused);
    return this;
  }

  public Map<String, Object> build() {
    return new LinkedHashMap<>(report);
  }

  /**
   * Renders a posture as a JSON-compatible document.
   *
   * @param posture posture to render
   * @return document
   */
  public static Map<String, Object> postureToMap(SecurityPosture posture) {
    SystemHealth health = posture.systemHealth();
    Map<String, Object> systemHealth = new LinkedHashMap<>();
    systemHealth.put("path_protection", health.pathProtection());
    systemHealth.put("boundary_enforcement", health.boundaryEnforcement());
    systemHealth.put("zero_trust", health.zeroTrust());
    systemHealth.put("incident_response", health.incidentResponse());

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("overall_score", posture.overallScore());
    document.put("last_assessment", posture.lastAssessment().toString());
    document.put("compliance_status", posture.complianceStatus().wireName());
    document.put("active_threats", posture.activeThreats());
    document.put("resolved_incidents", posture.resolvedIncidents());
    document.put("system_health", systemHealth);
    document.put("recommendations", posture.recommendations());
    return document;
  }
}
