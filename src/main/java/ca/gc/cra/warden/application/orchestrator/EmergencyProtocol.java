package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emergency steps for critical incidents: pause operations, quarantine the project, preserve evidence and alert.
 *
 * <p>Each step runs regardless of how the others ended and its outcome is recorded on the incident. Evidence is
 * written at most once per incident.</p>
 *
 * @since 0.1.0
 */
final class EmergencyProtocol {
  private static final Logger log = LoggerFactory.getLogger(EmergencyProtocol.class);
  private static final int RECENT_LOG_LINES = 200;

  private final ResponseActionExecutor actions;
  private final EvidenceStorePort evidenceStore;
  private final NotificationRelay notifications;
  private final Supplier<List<String>> recentLogs;
  private final IntFunction<List<SecurityIncident>> recentIncidents;
  private final int incidentsInEvidence;
  private final ClockPort clock;
  private final AtomicBoolean paused = new AtomicBoolean();

  EmergencyProtocol(
      ResponseActionExecutor actions,
      EvidenceStorePort evidenceStore,
      NotificationRelay notifications,
      Supplier<List<String>> recentLogs,
      IntFunction<List<SecurityIncident>> recentIncidents,
      int incidentsInEvidence,
      ClockPort clock) {
    this.actions = Objects.requireNonNull(actions, "actions");
    this.evidenceStore = Objects.requireNonNull(evidenceStore, "evidenceStore");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.recentLogs = Objects.requireNonNull(recentLogs, "recentLogs");
    this.recentIncidents = Objects.requireNonNull(recentIncidents, "recentIncidents");
    this.incidentsInEvidence = incidentsInEvidence;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  void activate(SecurityIncident incident) {
    log.error("security.emergency id={} type={} project={}", incident.id(), incident.incidentType().wireName(),
        incident.projectId());
    pause(incident.id());
    String quarantine = actions.execute(ResponseActionType.QUARANTINE_PROJECT, incident);
    incident.recordEmergencyOutcome("quarantine", quarantine);
    log.info("security.emergency.quarantine id={} outcome={}", incident.id(), quarantine);
    incident.recordEmergencyOutcome("evidence", preserveEvidence(incident));
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("incident_type", incident.incidentType().wireName());
    attributes.put("severity", incident.severity().wireName());
    attributes.put("description", incident.description());
    notifications.send(NotificationType.EMERGENCY_PROTOCOL, incident.projectId(), incident.id(), attributes);
  }

  private void pause(String incidentId) {
    if (paused.compareAndSet(false, true)) {
      log.warn("security.operations.paused incident={}", incidentId);
      notifications.send(NotificationType.OPERATIONS_PAUSED, null, incidentId, Map.of());
    }
  }

  /**
   * Clears the pause flag.
   *
   * @return {@code true} when operations were paused
   */
  boolean resume() {
    if (paused.compareAndSet(true, false)) {
      log.info("security.operations.resumed");
      notifications.send(NotificationType.OPERATIONS_RESUMED, null, null, Map.of());
      return true;
    }
    return false;
  }

  boolean paused() {
    return paused.get();
  }

  private String preserveEvidence(SecurityIncident incident) {
    try {
      if (evidenceStore.hasEvidenceBundle(incident.id())) {
        return "skipped: already preserved";
      }
      Map<String, Object> bundle = new LinkedHashMap<>();
      bundle.put("incident", IncidentDocuments.toMap(incident));
      bundle.put("process", ProcessSnapshot.capture(clock.now()).toMap());
      bundle.put("recent_logs", recentLogs(RECENT_LOG_LINES));
      bundle.put("recent_incidents", IncidentDocuments.toMaps(recentIncidents.apply(incidentsInEvidence)));
      bundle.put("timestamp", clock.now().toString());
      Path written = evidenceStore.writeEvidenceBundle(incident.id(), bundle);
      log.info("security.evidence.preserved id={} path={}", incident.id(), written);
      return ResponseActionExecutor.SUCCEEDED;
    } catch (IOException | RuntimeException ex) {
      log.error("Evidence preservation failed for incident {}", incident.id(), ex);
      return "failed: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
    }
  }

  private List<String> recentLogs(int limit) {
    List<String> lines = recentLogs.get();
    return lines.size() <= limit ? lines : lines.subList(lines.size() - limit, lines.size());
  }
}
