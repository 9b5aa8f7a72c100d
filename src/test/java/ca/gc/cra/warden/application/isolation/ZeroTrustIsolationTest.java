package ca.gc.cra.warden.application.isolation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.isolation.CheckKind;
import ca.gc.cra.warden.domain.isolation.FailureAction;
import ca.gc.cra.warden.domain.isolation.IsolationBoundaryType;
import ca.gc.cra.warden.domain.isolation.PendingApproval;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.domain.isolation.ThreatResponseKind;
import ca.gc.cra.warden.domain.isolation.VerificationResult;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.testing.SecurityCoreFixture;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ZeroTrustIsolationTest {

  @TempDir Path tempDir;

  private SecurityCoreFixture fixture;
  private ZeroTrustIsolation zeroTrust;

  @BeforeEach
  void setUp() {
    fixture = new SecurityCoreFixture(tempDir);
    zeroTrust = fixture.zeroTrust();
  }

  @AfterEach
  void tearDown() throws IOException {
    fixture.close();
  }

  private Path root(String projectId) {
    return fixture.sandboxRoot().resolve(projectId);
  }

  @Test
  void createProjectIsolationPreparesRootAndRegistersSandbox() throws IOException {
    ProjectIsolationBoundary boundary = fixture.isolate("proj1");

    assertEquals("project_proj1", boundary.boundaryId());
    assertEquals(root("proj1"), boundary.projectRoot());
    assertEquals(IsolationBoundaryType.LOGICAL, boundary.boundaryType());
    assertEquals(4, boundary.verificationChecks().size());
    assertEquals(2, boundary.enforcementMechanisms().size());

    Map<String, Object> config = JsonDocuments.parseObject(
        Files.readString(root("proj1").resolve(".warden-project.json"), StandardCharsets.UTF_8));
    assertEquals("proj1", config.get("projectId"));
    assertEquals("standard", config.get("securityLevel"));
    assertEquals("project_proj1", config.get("boundaryId"));
    assertTrue(Files.exists(root("proj1").resolve(".gitignore")));

    assertTrue(fixture.engine().projectSandbox("proj1").isPresent());
    assertEquals(root("proj1"), fixture.pathGuard().projectRoot("proj1"));
    assertTrue(zeroTrust.isActive("proj1"));
    assertEquals(List.of("proj1"), zeroTrust.activeProjects());
  }

  @Test
  void higherLevelsUsePhysicalBoundariesAndMoreMechanisms() {
    ProjectIsolationBoundary enhanced = fixture.isolate("proj1", SecurityLevel.ENHANCED);
    ProjectIsolationBoundary maximum = fixture.isolate("proj2", SecurityLevel.MAXIMUM);

    assertEquals(IsolationBoundaryType.PHYSICAL, enhanced.boundaryType());
    assertEquals(3, enhanced.enforcementMechanisms().size());
    assertEquals(4, maximum.enforcementMechanisms().size());
    assertEquals(FailureAction.QUARANTINE,
        maximum.check(CheckKind.PRIVILEGE_ESCALATION).orElseThrow().failureAction());
  }

  @Test
  void relativeProjectPathResolvesUnderItsSandboxDirectory() {
    ProjectIsolationBoundary boundary =
        zeroTrust.createProjectIsolation("proj1", "workspace", SecurityLevel.STANDARD);

    assertEquals(root("proj1").resolve("workspace"), boundary.projectRoot());
  }

  @Test
  void creationRejectsDuplicatesBadIdsAndUnsafePaths() {
    fixture.isolate("proj1");

    assertThrows(IllegalStateException.class, () -> fixture.isolate("proj1"));
    assertThrows(IllegalArgumentException.class,
        () -> zeroTrust.createProjectIsolation("../escape", "x", SecurityLevel.STANDARD));
    IllegalArgumentException rejected = assertThrows(IllegalArgumentException.class,
        () -> zeroTrust.createProjectIsolation("proj3", "../../etc", SecurityLevel.STANDARD));
    assertTrue(rejected.getMessage().startsWith("project path rejected: "));
    assertFalse(zeroTrust.isActive("proj3"));
  }

  @Test
  void repeatedIntegrityFailuresCompromiseThenQuarantine() throws IOException {
    fixture.isolate("proj1");
    fixture.drainEvents();
    Files.createDirectories(root("proj1").resolve(".warden"));

    VerificationResult first = zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);
    assertFalse(first.passed());
    assertEquals("forbidden entry present: .warden", first.detail());
    assertEquals(75.0, zeroTrust.healthScore(), 1e-9);
    assertTrue(fixture.drainEvents().isEmpty());

    zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);
    List<SecurityEvent> afterSecond = fixture.drainEvents();
    SecurityEvent.BoundaryCompromised compromised =
        assertInstanceOf(SecurityEvent.BoundaryCompromised.class, afterSecond.get(0));
    assertEquals(50.0, compromised.integrityScore(), 1e-9);

    VerificationResult third = zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);
    assertEquals(FailureAction.QUARANTINE, third.actionTaken());
    List<SecurityEvent> afterThird = fixture.drainEvents();
    assertEquals(1, afterThird.size());
    assertInstanceOf(SecurityEvent.ProjectQuarantined.class, afterThird.get(0));

    assertTrue(zeroTrust.isQuarantined("proj1"));
    assertFalse(zeroTrust.isActive("proj1"));
    assertTrue(fixture.engine().projectSandbox("proj1").isEmpty());
    assertEquals(root("proj1"), zeroTrust.projectRoot("proj1").orElseThrow());
    assertThrows(IllegalArgumentException.class,
        () -> zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY));
  }

  @Test
  void outOfBandSandboxEditsFailIntegrityAndCompromiseProject() throws IOException {
    fixture.isolate("proj1");
    fixture.drainEvents();
    Path notes = root("proj1").resolve("notes.txt");

    Files.writeString(notes, "injected", StandardCharsets.UTF_8);
    VerificationResult first = zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);
    assertFalse(first.passed());
    assertEquals("content hash changed outside recorded activity", first.detail());
    assertInstanceOf(SecurityEvent.IntegrityViolationDetected.class, fixture.drainEvents().get(0));

    Files.writeString(notes, "injected again", StandardCharsets.UTF_8);
    zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);
    List<SecurityEvent> afterSecond = fixture.drainEvents();
    assertTrue(afterSecond.stream().anyMatch(SecurityEvent.IntegrityViolationDetected.class::isInstance));
    SecurityEvent.BoundaryCompromised compromised = afterSecond.stream()
        .filter(SecurityEvent.BoundaryCompromised.class::isInstance)
        .map(SecurityEvent.BoundaryCompromised.class::cast)
        .findFirst()
        .orElseThrow();
    assertEquals("proj1", compromised.projectId());
  }

  @Test
  void passingChecksRecoverSlowly() {
    fixture.isolate("proj1");

    VerificationResult result = zeroTrust.runVerification("proj1", CheckKind.FILESYSTEM_INTEGRITY);

    assertTrue(result.passed());
    assertEquals("ok", result.detail());
    assertEquals(100.0, zeroTrust.healthScore(), 1e-9);
  }

  @Test
  void crossProjectAccessIsDeniedThenScannedAndQuarantinedOnApproval() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    String foreign = root("proj2").resolve("data.csv").toString();

    AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.READ, foreign);

    assertFalse(verdict.allowed());
    assertEquals("cross_project_access failed: target belongs to project proj2", verdict.reason());
    assertEquals(FailureAction.BLOCK, verdict.results().get(0).actionTaken());
    assertEquals("proj1", verdict.eventIfAny().orElseThrow().projectId());
    fixture.drainEvents();

    List<SecurityEvent.ThreatDetected> threats = zeroTrust.scanThreats();

    assertEquals(1, threats.size());
    assertEquals("cross_project_file_access", threats.get(0).rule().ruleId());
    assertEquals(1, zeroTrust.threatsDetected());
    List<PendingApproval> approvals = zeroTrust.pendingApprovals();
    assertEquals(1, approvals.size());
    assertEquals(ThreatResponseKind.QUARANTINE_PROJECT, approvals.get(0).action());
    assertTrue(approvals.get(0).approvalId().startsWith("APR-"));
    assertEquals("access to target blocked",
        zeroTrust.verifyAccess("proj1", AccessOperation.READ, foreign).reason());

    zeroTrust.approve(approvals.get(0).approvalId());

    assertTrue(zeroTrust.isQuarantined("proj1"));
    assertTrue(fixture.drainEvents().stream().anyMatch(SecurityEvent.ProjectQuarantined.class::isInstance));
    assertEquals("project is quarantined",
        zeroTrust.verifyAccess("proj1", AccessOperation.READ, "notes.txt").reason());
    assertThrows(IllegalArgumentException.class, () -> zeroTrust.approve(approvals.get(0).approvalId()));
  }

  @Test
  void preAuthorizedResponsesSkipTheApprovalQueue() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    zeroTrust.preAuthorize("proj1", ThreatResponseKind.QUARANTINE_PROJECT);

    zeroTrust.verifyAccess("proj1", AccessOperation.READ, root("proj2").resolve("data.csv").toString());
    zeroTrust.scanThreats();

    assertTrue(zeroTrust.pendingApprovals().isEmpty());
    assertTrue(zeroTrust.isQuarantined("proj1"));
  }

  @Test
  void validateProjectAccessPublishesDenials() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    fixture.drainEvents();

    assertTrue(zeroTrust.validateProjectAccess("proj1", AccessOperation.WRITE, "src/main.py"));
    assertFalse(zeroTrust.validateProjectAccess("proj1", AccessOperation.READ,
        root("proj2").resolve("data.csv").toString()));

    List<SecurityEvent> events = fixture.drainEvents();
    assertEquals(1, events.size());
    SecurityEvent.UnauthorizedAccess denied = assertInstanceOf(SecurityEvent.UnauthorizedAccess.class, events.get(0));
    assertEquals(AccessOperation.READ, denied.operation());
  }

  @Test
  void activeContextOfAnotherProjectFailsCrossProjectCheck() {
    fixture.isolate("proj1");
    fixture.isolate("proj2");

    try (var scope = fixture.engine().executionContext().enter("proj2")) {
      AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.READ, "notes.txt");
      assertEquals("cross_project_access failed: active execution context belongs to project proj2",
          verdict.reason());
    }
  }

  @Test
  void scopeHeldOnAnotherThreadDoesNotLeakIntoCrossProjectCheck() throws Exception {
    fixture.isolate("proj1");
    fixture.isolate("proj2");
    fixture.drainEvents();
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Thread other = new Thread(() -> {
      try (var scope = fixture.engine().executionContext().enter("proj2")) {
        entered.countDown();
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    other.start();
    try {
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.READ, "notes.txt");

      assertTrue(verdict.allowed());
      assertTrue(fixture.drainEvents().stream().noneMatch(SecurityEvent.UnauthorizedAccess.class::isInstance));
    } finally {
      release.countDown();
      other.join(5_000L);
    }
  }

  @Test
  void projectFileNamedLikeElevationBinaryIsNotEscalation() throws IOException {
    fixture.isolate("proj1");
    Files.createDirectories(root("proj1").resolve("docs"));
    Files.writeString(root("proj1").resolve("docs/su"), "notes", StandardCharsets.UTF_8);
    fixture.drainEvents();

    AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.EXECUTE, "docs/su");

    assertTrue(verdict.allowed());
    assertTrue(verdict.results().stream().allMatch(VerificationResult::passed));
    assertTrue(fixture.drainEvents().isEmpty());
  }

  @Test
  void privilegeEscalationAlertsAtStandardLevel() {
    fixture.isolate("proj1");
    fixture.drainEvents();

    AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.EXECUTE, "/usr/bin/sudo");

    assertTrue(verdict.allowed());
    VerificationResult escalation = verdict.results().get(1);
    assertFalse(escalation.passed());
    assertEquals(FailureAction.ALERT, escalation.actionTaken());
    SecurityEvent.VerificationAlert alert =
        assertInstanceOf(SecurityEvent.VerificationAlert.class, fixture.drainEvents().get(0));
    assertEquals("privilege_escalation", alert.checkName());

    List<SecurityEvent.ThreatDetected> threats = zeroTrust.scanThreats();
    assertEquals("privileged_binary_execution", threats.get(0).rule().ruleId());
    assertEquals("access to target blocked",
        zeroTrust.verifyAccess("proj1", AccessOperation.EXECUTE, "/usr/bin/sudo").reason());
  }

  @Test
  void privilegeEscalationQuarantinesAtEnhancedLevel() {
    fixture.isolate("proj1", SecurityLevel.ENHANCED);

    AccessVerdict verdict = zeroTrust.verifyAccess("proj1", AccessOperation.WRITE, "/etc/sudoers");

    assertFalse(verdict.allowed());
    assertTrue(verdict.reason().startsWith("privilege_escalation failed: escalation pattern matched"));
    assertTrue(zeroTrust.isQuarantined("proj1"));
  }

  @Test
  void configurationTamperingFreezesConfigAndBacksItUp() throws IOException {
    fixture.isolate("proj1");

    assertTrue(zeroTrust.verifyAccess("proj1", AccessOperation.WRITE, ".warden-project.json").allowed());
    List<SecurityEvent.ThreatDetected> threats = zeroTrust.scanThreats();

    assertEquals("configuration_tampering", threats.get(0).rule().ruleId());
    assertEquals("modification of target blocked",
        zeroTrust.verifyAccess("proj1", AccessOperation.WRITE, ".warden-project.json").reason());
    assertTrue(zeroTrust.verifyAccess("proj1", AccessOperation.READ, ".warden-project.json").allowed());
    try (var backups = Files.list(fixture.home().resolve("backups/proj1/files"))) {
      assertEquals(1, backups.count());
    }
  }

  @Test
  void editedConfigurationFailsPeriodicCheck() throws IOException {
    fixture.isolate("proj1");
    fixture.drainEvents();
    Files.writeString(root("proj1").resolve(".warden-project.json"), "{\"projectId\":\"intruder\"}",
        StandardCharsets.UTF_8);

    VerificationResult result = zeroTrust.runVerification("proj1", CheckKind.CONFIGURATION_INTEGRITY);

    assertEquals("configuration names project intruder", result.detail());
    assertEquals(FailureAction.ALERT, result.actionTaken());
    assertInstanceOf(SecurityEvent.VerificationAlert.class, fixture.drainEvents().get(0));
  }

  @Test
  void onChangeConfigurationChecksRunOnSweep() throws IOException {
    fixture.isolate("proj1", SecurityLevel.ENHANCED);
    assertTrue(zeroTrust.sweepConfigurationChanges().isEmpty());

    Files.writeString(root("proj1").resolve(".warden-project.json"), "not json", StandardCharsets.UTF_8);
    List<VerificationResult> results = zeroTrust.sweepConfigurationChanges();

    assertEquals(1, results.size());
    assertTrue(results.get(0).detail().startsWith("configuration file unreadable"));
    assertTrue(zeroTrust.sweepConfigurationChanges().isEmpty());
  }

  @Test
  void resourceExhaustionRateLimitsTheProject() {
    List<SecurityEvent> published = new ArrayList<>();
    ZeroTrustIsolation pressured = new ZeroTrustIsolation(
        fixture.pathGuard(),
        fixture.engine(),
        new ProjectLocks(),
        fixture.evidenceStore(),
        new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.95),
        new ZeroTrustSettings(100, 3),
        fixture.clock(),
        fixture.metrics(),
        published::add);
    pressured.createProjectIsolation("hog", root("hog").toString(), SecurityLevel.STANDARD);
    pressured.recordActivity("hog", AccessOperation.WRITE, "buffer.bin");

    List<SecurityEvent.ThreatDetected> threats = pressured.scanThreats();

    assertEquals("resource_exhaustion_attack", threats.get(0).rule().ruleId());
    assertTrue(pressured.verifyAccess("hog", AccessOperation.READ, "a.txt").allowed());
    assertTrue(pressured.verifyAccess("hog", AccessOperation.READ, "b.txt").allowed());
    assertEquals("rate limit exceeded", pressured.verifyAccess("hog", AccessOperation.READ, "c.txt").reason());
    assertFalse(pressured.enhanceMonitoring("hog"));
  }

  @Test
  void unknownProjectsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> zeroTrust.verifyAccess("ghost", AccessOperation.READ, "x"));
    assertThrows(IllegalArgumentException.class, () -> zeroTrust.blockAccess("ghost", "x"));
    assertThrows(IllegalArgumentException.class, () -> zeroTrust.approve("APR-missing"));
  }

  @Test
  void removalAllowsTheIdToBeReused() {
    fixture.isolate("proj1");
    zeroTrust.quarantineProject("proj1", "manual");
    assertThrows(IllegalStateException.class, () -> fixture.isolate("proj1"));

    assertTrue(zeroTrust.removeProjectIsolation("proj1"));
    assertFalse(zeroTrust.removeProjectIsolation("proj1"));

    fixture.isolate("proj1");
    assertTrue(zeroTrust.isActive("proj1"));
  }

  @Test
  void quarantineIsIdempotentAndSilent() {
    fixture.isolate("proj1");
    fixture.drainEvents();

    assertTrue(zeroTrust.quarantineProject("proj1", "manual"));
    assertFalse(zeroTrust.quarantineProject("proj1", "again"));

    assertTrue(fixture.drainEvents().isEmpty());
    assertEquals(List.of("proj1"), zeroTrust.quarantinedProjects());
  }

  @Test
  void networkIsolationAndMonitoringAreOneShot() {
    fixture.isolate("proj1");

    assertTrue(zeroTrust.isolateNetwork("proj1"));
    assertFalse(zeroTrust.isolateNetwork("proj1"));
    assertTrue(zeroTrust.enhanceMonitoring("proj1"));
    assertFalse(zeroTrust.enhanceMonitoring("proj1"));

    @SuppressWarnings("unchecked")
    Map<String, Object> entry = ((List<Map<String, Object>>) zeroTrust.report().get("projects")).get(0);
    assertEquals(Boolean.TRUE, entry.get("network_isolated"));
    assertEquals(Boolean.TRUE, entry.get("enhanced_monitoring"));
  }

  @Test
  void recentActivityUsesBoundaryScopedDescriptors() {
    fixture.isolate("proj1");

    zeroTrust.recordActivity("proj1", AccessOperation.WRITE, "src/main.py");

    assertEquals("project_proj1:.->project_proj1:src/main.py",
        zeroTrust.recentActivity("proj1", 1).get(0).descriptor());
    assertTrue(zeroTrust.recentActivity("proj1", 1).get(0).created());
  }
}
