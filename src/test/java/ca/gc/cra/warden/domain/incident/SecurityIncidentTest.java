package ca.gc.cra.warden.domain.incident;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SecurityIncidentTest {

  private static final Instant CREATED = Instant.parse("2024-05-01T12:00:00Z");

  private static SecurityIncident incident(Severity severity) {
    return new SecurityIncident("INC-1", CREATED, IncidentType.UNAUTHORIZED_ACCESS, severity,
        SourceSystem.ZERO_TRUST, "proj1", "notes.txt", "Access denied", Map.of("reason", "blocked"),
        List.of(ResponseActionType.ALERT_SECURITY_TEAM, ResponseActionType.BLOCK_ACCESS));
  }

  @Test
  void startsDetectedWithoutResolutionTime() {
    SecurityIncident incident = incident(Severity.HIGH);

    assertEquals(IncidentStatus.DETECTED, incident.status());
    assertNull(incident.resolvedAt());
  }

  @Test
  void terminalTransitionsRecordResolutionTime() {
    SecurityIncident incident = incident(Severity.HIGH);
    Instant resolved = CREATED.plusSeconds(60);

    incident.transitionTo(IncidentStatus.INVESTIGATING, CREATED);
    assertNull(incident.resolvedAt());
    incident.transitionTo(IncidentStatus.RESOLVED, resolved);

    assertEquals(resolved, incident.resolvedAt());
  }

  @Test
  void illegalTransitionsAreRejected() {
    SecurityIncident high = incident(Severity.HIGH);

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> high.transitionTo(IncidentStatus.ESCALATED, CREATED));
    assertEquals("Incident INC-1 cannot move from detected to escalated", ex.getMessage());

    SecurityIncident critical = incident(Severity.CRITICAL);
    critical.transitionTo(IncidentStatus.ESCALATED, CREATED);
    assertThrows(IllegalStateException.class, () -> critical.transitionTo(IncidentStatus.RESOLVED, CREATED));
  }

  @Test
  void failedOutcomesAreCounted() {
    SecurityIncident incident = incident(Severity.HIGH);

    incident.recordActionOutcome(ResponseActionType.ALERT_SECURITY_TEAM, "succeeded");
    incident.recordActionOutcome(ResponseActionType.BLOCK_ACCESS, "failed: invalid target path");

    assertEquals(1, incident.failedActionCount());
    assertEquals("succeeded", incident.actionOutcomes().get(ResponseActionType.ALERT_SECURITY_TEAM));
  }

  @Test
  void evidenceIsCopied() {
    Map<String, String> evidence = new HashMap<>();
    evidence.put("reason", "blocked");
    SecurityIncident incident = new SecurityIncident("INC-2", CREATED, IncidentType.POLICY_VIOLATION,
        Severity.LOW, SourceSystem.ORCHESTRATOR, null, null, "note", evidence, null);

    evidence.put("reason", "changed");

    assertEquals("blocked", incident.evidence().get("reason"));
    assertEquals(List.of(), incident.responseActions());
  }
}
