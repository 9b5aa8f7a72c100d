package ca.gc.cra.warden.domain.incident;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IncidentStatusTest {

  @Test
  void lifecycleOnlyMovesForward() {
    assertTrue(IncidentStatus.DETECTED.canTransitionTo(IncidentStatus.INVESTIGATING, false));
    assertTrue(IncidentStatus.INVESTIGATING.canTransitionTo(IncidentStatus.CONTAINED, false));
    assertTrue(IncidentStatus.INVESTIGATING.canTransitionTo(IncidentStatus.RESOLVED, false));
    assertTrue(IncidentStatus.CONTAINED.canTransitionTo(IncidentStatus.RESOLVED, false));

    assertFalse(IncidentStatus.DETECTED.canTransitionTo(IncidentStatus.CONTAINED, false));
    assertFalse(IncidentStatus.DETECTED.canTransitionTo(IncidentStatus.RESOLVED, false));
    assertFalse(IncidentStatus.CONTAINED.canTransitionTo(IncidentStatus.INVESTIGATING, false));
    assertFalse(IncidentStatus.INVESTIGATING.canTransitionTo(IncidentStatus.DETECTED, false));
    assertFalse(IncidentStatus.INVESTIGATING.canTransitionTo(null, false));
  }

  @Test
  void escalationRequiresACriticalIncident() {
    assertTrue(IncidentStatus.DETECTED.canTransitionTo(IncidentStatus.ESCALATED, true));
    assertTrue(IncidentStatus.CONTAINED.canTransitionTo(IncidentStatus.ESCALATED, true));
    assertFalse(IncidentStatus.INVESTIGATING.canTransitionTo(IncidentStatus.ESCALATED, false));
  }

  @Test
  void resolvedAndEscalatedAreTerminal() {
    assertTrue(IncidentStatus.RESOLVED.terminal());
    assertTrue(IncidentStatus.ESCALATED.terminal());
    assertFalse(IncidentStatus.CONTAINED.terminal());
    for (IncidentStatus next : IncidentStatus.values()) {
      assertFalse(IncidentStatus.RESOLVED.canTransitionTo(next, true));
      assertFalse(IncidentStatus.ESCALATED.canTransitionTo(next, true));
    }
  }
}
