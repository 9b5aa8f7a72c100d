package ca.gc.cra.warden.application.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import ca.gc.cra.warden.domain.incident.SourceSystem;
import ca.gc.cra.warden.domain.security.Severity;
import ca.gc.cra.warden.testing.SecurityCoreFixture;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmergencyProtocolTest {

  @TempDir Path tempDir;

  private SecurityCoreFixture fixture;

  @BeforeEach
  void setUp() {
    fixture = new SecurityCoreFixture(tempDir);
  }

  @AfterEach
  void tearDown() throws IOException {
    fixture.close();
  }

  private EmergencyProtocol protocol(EvidenceStorePort store) {
    NotificationRelay relay = new NotificationRelay(fixture.notifier(), fixture.clock());
    ResponseActionExecutor actions = new ResponseActionExecutor(
        fixture.zeroTrust(), store, new ProjectLocks(), relay, fixture.clock(), fixture.metrics());
    return new EmergencyProtocol(actions, store, relay, () -> List.of("recent log line"), limit -> List.of(), 5,
        fixture.clock());
  }

  private SecurityIncident critical(String id, String projectId) {
    return new SecurityIncident(id, fixture.clock().now(), IncidentType.SYSTEM_COMPROMISE, Severity.CRITICAL,
        SourceSystem.ZERO_TRUST, projectId, null, "integrity below threshold", Map.of(), List.of());
  }

  @Test
  void evidenceStoreFailureIsRecordedOnTheIncident() {
    fixture.isolate("proj1");
    EvidenceStorePort failing = new EvidenceStorePort() {
      @Override
      public Path writeForensicSnapshot(String incidentId, Map<String, Object> document) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public Path writeEvidenceBundle(String incidentId, Map<String, Object> document) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public boolean hasEvidenceBundle(String incidentId) {
        return false;
      }

      @Override
      public Path backupProject(String projectId, Path projectRoot) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public Path backupFile(String projectId, Path file) throws IOException {
        throw new IOException("disk full");
      }
    };
    SecurityIncident incident = critical("INC-1", "proj1");

    protocol(failing).activate(incident);

    assertEquals("failed: disk full", incident.emergencyOutcomes().get("evidence"));
    assertEquals(ResponseActionExecutor.SUCCEEDED, incident.emergencyOutcomes().get("quarantine"));
    assertEquals(1, incident.failedActionCount());
    assertTrue(fixture.zeroTrust().isQuarantined("proj1"));
    assertEquals(1, fixture.notifier().ofType(NotificationType.EMERGENCY_PROTOCOL).size());
    assertEquals(Map.of("evidence", "failed: disk full", "quarantine", ResponseActionExecutor.SUCCEEDED),
        IncidentDocuments.toMap(incident).get("emergency_outcomes"));
  }

  @Test
  void skippedQuarantineAndRepeatedEvidenceAreRecorded() {
    EmergencyProtocol protocol = protocol(fixture.evidenceStore());
    SecurityIncident incident = critical("INC-2", "ghost");

    protocol.activate(incident);
    assertEquals("skipped: project not isolated", incident.emergencyOutcomes().get("quarantine"));
    assertEquals(ResponseActionExecutor.SUCCEEDED, incident.emergencyOutcomes().get("evidence"));
    assertTrue(fixture.evidenceStore().hasEvidenceBundle("INC-2"));

    protocol.activate(incident);
    assertEquals("skipped: already preserved", incident.emergencyOutcomes().get("evidence"));
    assertEquals(0, incident.failedActionCount());
  }
}
