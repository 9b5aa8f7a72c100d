package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.security.Severity;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed {@code (incident type, severity) -> response actions} table.
 *
 * <p>Every incident alerts the security team. Severity adds containment steps; {@code boundary_violation} always
 * blocks access and {@code path_traversal_attack} always isolates network access. Order is stable and free of
 * duplicates.</p>
 *
 * @since 0.1.0
 */
public final class ResponsePolicy {
  private ResponsePolicy() {}

  /**
   * Selects the response actions for an incident.
   *
   * @param type incident type
   * @param severity incident severity
   * @return ordered actions, never empty
   */
  public static List<ResponseActionType> actionsFor(IncidentType type, Severity severity) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Set<ResponseActionType> actions = new LinkedHashSet<>();
    actions.add(ResponseActionType.ALERT_SECURITY_TEAM);
    switch (severity) {
      case CRITICAL -> {
        actions.add(ResponseActionType.QUARANTINE_PROJECT);
        actions.add(ResponseActionType.BACKUP_PROJECT_STATE);
        actions.add(ResponseActionType.FORENSIC_ANALYSIS);
      }
      case HIGH -> {
        actions.add(ResponseActionType.BLOCK_ACCESS);
        actions.add(ResponseActionType.ENHANCE_MONITORING);
        actions.add(ResponseActionType.BACKUP_PROJECT_STATE);
      }
      case MEDIUM -> actions.add(ResponseActionType.ENHANCE_MONITORING);
      case LOW -> {
        // alert only
      }
    }
    if (type == IncidentType.BOUNDARY_VIOLATION) {
      actions.add(ResponseActionType.BLOCK_ACCESS);
    }
    if (type == IncidentType.PATH_TRAVERSAL_ATTACK) {
      actions.add(ResponseActionType.ISOLATE_NETWORK_ACCESS);
    }
    return List.copyOf(actions);
  }
}
