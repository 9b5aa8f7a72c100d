package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON-compatible renderings of incidents for reports, forensic snapshots and evidence bundles.
 *
 * @since 0.1.0
 */
public final class IncidentDocuments {
  private IncidentDocuments() {}

  public static Map<String, Object> toMap(SecurityIncident incident) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("id", incident.id());
    document.put("timestamp", incident.timestamp().toString());
    document.put("incident_type", incident.incidentType().wireName());
    document.put("severity", incident.severity().wireName());
    document.put("source_system", incident.sourceSystem().wireName());
    document.put("project_id", incident.projectId());
    document.put("target_path", incident.targetPath());
    document.put("description", incident.description());
    document.put("status", incident.status().wireName());
    document.put("resolved_at", incident.resolvedAt() == null ? null : incident.resolvedAt().toString());
    document.put("evidence", new TreeMap<>(incident.evidence()));
    document.put("response_actions", incident.responseActions().stream().map(ResponseActionType::wireName).toList());
    Map<String, Object> outcomes = new LinkedHashMap<>();
    for (ResponseActionType action : incident.responseActions()) {
      String outcome = incident.actionOutcomes().get(action);
      if (outcome != null) {
        outcomes.put(action.wireName(), outcome);
      }
    }
    document.put("action_outcomes", outcomes);
    Map<String, String> emergency = incident.emergencyOutcomes();
    if (!emergency.isEmpty()) {
      document.put("emergency_outcomes", new TreeMap<>(emergency));
    }
    return document;
  }

  public static List<Map<String, Object>> toMaps(List<SecurityIncident> incidents) {
    return incidents.stream().map(IncidentDocuments::toMap).toList();
  }
}
