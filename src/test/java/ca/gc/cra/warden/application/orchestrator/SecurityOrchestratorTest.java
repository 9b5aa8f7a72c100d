package ca.gc.cra.warden.application.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.incident.ComplianceStatus;
import ca.gc.cra.warden.domain.incident.IncidentStatus;
import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import ca.gc.cra.warden.domain.incident.SecurityPosture;
import ca.gc.cra.warden.domain.incident.SourceSystem;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.security.Severity;
import ca.gc.cra.warden.testing.SecurityCoreFixture;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SecurityOrchestratorTest {

  @TempDir Path tempDir;

  private SecurityCoreFixture fixture;
  private SecurityOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    fixture = new SecurityCoreFixture(tempDir);
    orchestrator = fixture.orchestrator();
  }

  @AfterEach
  void tearDown() throws IOException {
    fixture.close();
  }

  @Test
  void crossProjectWriteBecomesBoundaryIncidentThatBlocksTheTarget() throws IOException {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    fixture.drainEvents();
    Path foreign = fixture.sandboxRoot().resolve("proj2/notes.txt");

    try (var scope = fixture.engine().executionContext().enter("proj1")) {
      Files.writeString(foreign, "leak", StandardCharsets.UTF_8);
      fixture.engine().pollWatchers();
    }

    assertEquals(1, orchestrator.processPendingEvents());

    SecurityIncident incident = orchestrator.incidents(10).get(0);
    assertTrue(incident.id().startsWith("INC-"));
    assertEquals(IncidentType.BOUNDARY_VIOLATION, incident.incidentType());
    assertEquals(Severity.HIGH, incident.severity());
    assertEquals(SourceSystem.BOUNDARY_ENGINE, incident.sourceSystem());
    assertEquals("proj1", incident.projectId());
    assertEquals(IncidentStatus.INVESTIGATING, incident.status());
    assertEquals(List.of(
        ResponseActionType.ALERT_SECURITY_TEAM,
        ResponseActionType.BLOCK_ACCESS,
        ResponseActionType.ENHANCE_MONITORING,
        ResponseActionType.BACKUP_PROJECT_STATE), incident.responseActions());
    assertEquals(ResponseActionExecutor.SUCCEEDED, incident.actionOutcomes().get(ResponseActionType.BLOCK_ACCESS));
    assertEquals("access to target blocked",
        fixture.zeroTrust().verifyAccess("proj1", AccessOperation.READ, foreign.toString()).reason());

    assertEquals(1, fixture.auditLog().written());
    assertEquals(1, fixture.notifier().ofType(NotificationType.SECURITY_INCIDENT).size());
    assertEquals(1, fixture.notifier().ofType(NotificationType.SECURITY_ALERT).size());
    assertEquals(1, fixture.metrics().count("incident.created"));
    assertFalse(orchestrator.operationsPaused());
  }

  @Test
  void gateStopsAtPathValidationForTraversal() {
    fixture.isolate("proj1");
    fixture.drainEvents();

    SecureAccessResult result = orchestrator.validateSecureAccess("proj1", AccessOperation.READ, "../../etc/passwd");

    assertFalse(result.allowed());
    assertTrue(result.reason().startsWith("path validation failed: "));
    SecurityIncident incident = result.incidentIfAny().orElseThrow();
    assertEquals(IncidentType.PATH_TRAVERSAL_ATTACK, incident.incidentType());
    assertEquals(SourceSystem.PATH_GUARD, incident.sourceSystem());
    assertTrue(incident.responseActions().contains(ResponseActionType.ISOLATE_NETWORK_ACCESS));
    assertEquals(ResponseActionExecutor.SUCCEEDED,
        incident.actionOutcomes().get(ResponseActionType.ISOLATE_NETWORK_ACCESS));
    assertEquals(1, fixture.notifier().ofType(NotificationType.NETWORK_ISOLATED).size());
    assertTrue(fixture.drainEvents().isEmpty());
  }

  @Test
  void gateStopsAtBoundaryRulesAndEscalatesCriticalViolations() throws IOException {
    fixture.isolate("proj1");
    fixture.drainEvents();
    String script = fixture.sandboxRoot().resolve("proj1/run.sh").toString();

    SecureAccessResult result = orchestrator.validateSecureAccess("proj1", AccessOperation.WRITE, script);

    assertFalse(result.allowed());
    assertEquals("boundary rule proj_quarantine_executable denies write in project_proj1", result.reason());
    SecurityIncident incident = result.incidentIfAny().orElseThrow();
    assertEquals(IncidentType.BOUNDARY_VIOLATION, incident.incidentType());
    assertEquals(Severity.CRITICAL, incident.severity());
    assertEquals(IncidentStatus.ESCALATED, incident.status());
    assertEquals(incident.timestamp(), incident.resolvedAt());
    assertTrue(fixture.zeroTrust().isQuarantined("proj1"));
    assertTrue(orchestrator.operationsPaused());
    assertTrue(fixture.evidenceStore().hasEvidenceBundle(incident.id()));
    assertEquals(0, incident.failedActionCount());
    assertEquals(1, fixture.notifier().ofType(NotificationType.EMERGENCY_PROTOCOL).size());
    assertEquals(1, fixture.notifier().ofType(NotificationType.PROJECT_QUARANTINED).size());
    assertEquals(List.of(incident), orchestrator.criticalIncidents());
    assertTrue(orchestrator.activeIncidents().isEmpty());
  }

  @Test
  void gateStopsAtProjectVerification() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    fixture.drainEvents();

    SecureAccessResult result;
    try (var scope = fixture.engine().executionContext().enter("proj2")) {
      result = orchestrator.validateSecureAccess("proj1", AccessOperation.READ, "notes.txt");
    }

    assertFalse(result.allowed());
    assertEquals("cross_project_access failed: active execution context belongs to project proj2",
        result.reason());
    SecurityIncident incident = result.incidentIfAny().orElseThrow();
    assertEquals(IncidentType.UNAUTHORIZED_ACCESS, incident.incidentType());
    assertEquals(Severity.HIGH, incident.severity());
    assertEquals(SourceSystem.ZERO_TRUST, incident.sourceSystem());
    assertEquals("notes.txt", incident.targetPath());
  }

  @Test
  void gateAllowsOrdinaryAccessWithoutIncidents() {
    fixture.isolate("proj1");
    fixture.drainEvents();

    SecureAccessResult result = orchestrator.validateSecureAccess("proj1", AccessOperation.WRITE, "src/main.py");

    assertTrue(result.allowed());
    assertTrue(result.incidentIfAny().isEmpty());
    assertTrue(orchestrator.incidents(10).isEmpty());
  }

  @Test
  void gateWithoutProjectSkipsProjectVerification() {
    SecureAccessResult result = orchestrator.validateSecureAccess(
        null, AccessOperation.READ, fixture.sandboxRoot().resolve("shared.txt").toString());

    assertTrue(result.allowed());
  }

  @Test
  void gateRejectsProjectsThatWereNeverIsolated() {
    assertThrows(IllegalArgumentException.class,
        () -> orchestrator.validateSecureAccess("ghost", AccessOperation.READ, "notes.txt"));
  }

  @Test
  void emergencyPauseIsAnnouncedOnceUntilResumed() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    SecurityIncident first = orchestrator.handleEvent(new SecurityEvent.BoundaryCompromised(
        fixture.clock().now(), "proj1", 50.0, "integrity below threshold"));
    SecurityIncident second = orchestrator.handleEvent(new SecurityEvent.BoundaryCompromised(
        fixture.clock().now(), "proj2", 50.0, "integrity below threshold"));

    assertEquals(IncidentStatus.ESCALATED, first.status());
    assertEquals(IncidentStatus.ESCALATED, second.status());
    assertEquals(1, fixture.notifier().ofType(NotificationType.OPERATIONS_PAUSED).size());
    assertEquals(2, fixture.notifier().ofType(NotificationType.EMERGENCY_PROTOCOL).size());
    assertTrue(fixture.evidenceStore().hasEvidenceBundle(first.id()));
    assertTrue(fixture.evidenceStore().hasEvidenceBundle(second.id()));

    assertTrue(orchestrator.resumeOperations());
    assertFalse(orchestrator.resumeOperations());
    assertFalse(orchestrator.operationsPaused());
    assertEquals(1, fixture.notifier().ofType(NotificationType.OPERATIONS_RESUMED).size());
  }

  @Test
  void deniedAccessToQuarantinedProjectDoesNotRepeatBackups() {
    fixture.isolate("proj1");
    SecurityIncident compromised = orchestrator.handleEvent(new SecurityEvent.BoundaryCompromised(
        fixture.clock().now(), "proj1", 50.0, "integrity below threshold"));
    assertTrue(fixture.zeroTrust().isQuarantined("proj1"));
    assertEquals(ResponseActionExecutor.SUCCEEDED,
        compromised.actionOutcomes().get(ResponseActionType.BACKUP_PROJECT_STATE));

    for (int attempt = 0; attempt < 3; attempt++) {
      SecurityIncident incident = orchestrator.handleEvent(new SecurityEvent.UnauthorizedAccess(
          fixture.clock().now(), "proj1", AccessOperation.READ, "notes.txt", "project is quarantined"));
      assertEquals(Severity.HIGH, incident.severity());
      assertEquals("skipped: quarantined project already backed up",
          incident.actionOutcomes().get(ResponseActionType.BACKUP_PROJECT_STATE));
    }
  }

  @Test
  void escalatedIncidentsLowerIncidentResponseHealth() {
    fixture.isolate("proj1");
    orchestrator.handleEvent(new SecurityEvent.BoundaryCompromised(
        fixture.clock().now(), "proj1", 50.0, "integrity below threshold"));

    assertEquals(85.0, orchestrator.incidentResponseScore(fixture.clock().now()), 1e-9);
    fixture.clock().advance(Duration.ofHours(25));
    assertEquals(100.0, orchestrator.incidentResponseScore(fixture.clock().now()), 1e-9);
  }

  @Test
  void createSecureProjectReportsContextOrError() {
    SecureProjectResult created = orchestrator.createSecureProject(
        "proj1", fixture.sandboxRoot().resolve("proj1").toString(), SecurityLevel.ENHANCED);

    assertTrue(created.success());
    assertNull(created.error());
    SecurityContext context = created.contextIfAny().orElseThrow();
    assertEquals("proj1", context.projectId());
    assertEquals(SecurityLevel.ENHANCED, context.securityLevel());

    SecureProjectResult duplicate = orchestrator.createSecureProject(
        "proj1", fixture.sandboxRoot().resolve("proj1").toString(), SecurityLevel.STANDARD);
    assertFalse(duplicate.success());
    assertTrue(duplicate.contextIfAny().isEmpty());

    SecureProjectResult badId = orchestrator.createSecureProject("../x", "x", SecurityLevel.STANDARD);
    assertFalse(badId.success());

    assertTrue(orchestrator.removeProjectIsolation("proj1"));
    assertFalse(orchestrator.removeProjectIsolation("proj1"));
  }

  @Test
  void incidentsMoveThroughContainmentToResolution() {
    fixture.isolate("proj1");
    SecurityIncident incident = orchestrator.handleEvent(new SecurityEvent.VerificationAlert(
        fixture.clock().now(), "proj1", "privilege_escalation", "escalation pattern matched"));
    assertEquals(IncidentType.POLICY_VIOLATION, incident.incidentType());
    assertEquals(Severity.MEDIUM, incident.severity());
    assertEquals(List.of(incident), orchestrator.activeIncidents());

    orchestrator.containIncident(incident.id());
    assertEquals(IncidentStatus.CONTAINED, incident.status());
    assertTrue(orchestrator.activeIncidents().isEmpty());
    assertThrows(IllegalStateException.class, () -> orchestrator.containIncident(incident.id()));

    fixture.clock().advance(Duration.ofMinutes(5));
    orchestrator.resolveIncident(incident.id());
    assertEquals(IncidentStatus.RESOLVED, incident.status());
    assertEquals(fixture.clock().now(), incident.resolvedAt());
    assertThrows(IllegalStateException.class, () -> orchestrator.resolveIncident(incident.id()));
    assertThrows(IllegalArgumentException.class, () -> orchestrator.resolveIncident("INC-missing"));
    assertEquals(incident, orchestrator.incident(incident.id()).orElseThrow());
  }

  @Test
  void postureOfAQuietWorkspaceIsCompliant() {
    assertTrue(orchestrator.latestPosture().isEmpty());

    SecurityPosture posture = orchestrator.assessSecurityPosture();

    assertEquals(100.0, posture.overallScore(), 1e-9);
    assertEquals(ComplianceStatus.COMPLIANT, posture.complianceStatus());
    assertEquals(0, posture.activeThreats());
    assertTrue(posture.recommendations().isEmpty());
    assertEquals(posture, orchestrator.latestPosture().orElseThrow());
    assertEquals(1, fixture.notifier().ofType(NotificationType.SECURITY_POSTURE_UPDATED).size());
  }

  @Test
  void postureCountsActiveAndResolvedIncidents() {
    fixture.isolate("proj1");
    SecurityIncident resolved = orchestrator.handleEvent(new SecurityEvent.VerificationAlert(
        fixture.clock().now(), "proj1", "resource_monitoring", "heap usage 95.0%"));
    orchestrator.resolveIncident(resolved.id());
    orchestrator.handleEvent(new SecurityEvent.VerificationAlert(
        fixture.clock().now(), "proj1", "resource_monitoring", "heap usage 96.0%"));

    SecurityPosture posture = orchestrator.assessSecurityPosture();

    assertEquals(1, posture.activeThreats());
    assertEquals(1, posture.resolvedIncidents());
    assertTrue(posture.recommendations().contains("Address active security threats immediately"));
  }

  @Test
  void exportedReportIsJson() {
    fixture.isolate("proj1");
    orchestrator.validateSecureAccess("proj1", AccessOperation.READ, "../../etc/passwd");

    Map<String, Object> report = JsonDocuments.parseObject(orchestrator.exportComprehensiveSecurityReport());

    assertTrue(report.containsKey("security_posture"));
    assertTrue(report.containsKey("path_protection"));
    assertTrue(report.containsKey("boundary_enforcement"));
    assertTrue(report.containsKey("zero_trust"));
    assertEquals(Boolean.FALSE, report.get("operations_paused"));
    List<?> incidents = (List<?>) report.get("recent_incidents");
    assertEquals(1, incidents.size());
    assertEquals("path_traversal_attack", ((Map<?, ?>) incidents.get(0)).get("incident_type"));
  }

  @Test
  void stopDrainsQueuedEventsAndForbidsRestart() {
    fixture.isolate("proj1");
    fixture.drainEvents();
    orchestrator.start();
    fixture.eventBus().publish(new SecurityEvent.VerificationAlert(
        fixture.clock().now(), "proj1", "resource_monitoring", "heap usage 95.0%"));

    orchestrator.stop();

    assertEquals(1, orchestrator.incidents(10).size());
    assertEquals(0, fixture.eventBus().pending());
    assertThrows(IllegalStateException.class, orchestrator::start);
    assertThrows(IllegalStateException.class,
        () -> orchestrator.validateSecureAccess("proj1", AccessOperation.READ, "notes.txt"));
    assertThrows(IllegalStateException.class,
        () -> orchestrator.createSecureProject("proj2", "proj2", SecurityLevel.STANDARD));
  }
}
