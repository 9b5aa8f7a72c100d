package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.SourceSystem;
import ca.gc.cra.warden.domain.security.Severity;
import java.util.Map;

/** Incident attributes derived from one event, before an id and response actions are assigned. */
record IncidentDraft(
    IncidentType incidentType,
    Severity severity,
    SourceSystem sourceSystem,
    String projectId,
    String targetPath,
    String description,
    Map<String, String> evidence) {}
