package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.application.isolation.ZeroTrustIsolation;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes response actions for an incident, each one isolated from the others.
 *
 * <p>Every action ends with an outcome recorded on the incident: {@code succeeded}, {@code skipped: <why>} or
 * {@code failed: <message>}. Failures are logged and counted as {@code incident.action.failed}; they never
 * propagate.</p>
 *
 * @since 0.1.0
 */
final class ResponseActionExecutor {
  private static final Logger log = LoggerFactory.getLogger(ResponseActionExecutor.class);
  static final String SUCCEEDED = "succeeded";

  private final ZeroTrustIsolation zeroTrust;
  private final EvidenceStorePort evidenceStore;
  private final ProjectLocks locks;
  private final NotificationRelay notifications;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Set<String> quarantinedBackups = ConcurrentHashMap.newKeySet();

  ResponseActionExecutor(
      ZeroTrustIsolation zeroTrust,
      EvidenceStorePort evidenceStore,
      ProjectLocks locks,
      NotificationRelay notifications,
      ClockPort clock,
      MetricsPort metrics) {
    this.zeroTrust = Objects.requireNonNull(zeroTrust, "zeroTrust");
    this.evidenceStore = Objects.requireNonNull(evidenceStore, "evidenceStore");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Runs every selected action of the incident in order. */
  void executeAll(SecurityIncident incident) {
    for (ResponseActionType action : incident.responseActions()) {
      incident.recordActionOutcome(action, execute(action, incident));
    }
  }

  String execute(ResponseActionType action, SecurityIncident incident) {
    try {
      return switch (action) {
        case ALERT_SECURITY_TEAM -> alert(incident);
        case QUARANTINE_PROJECT -> quarantine(incident.projectId(), incident);
        case BLOCK_ACCESS -> blockAccess(incident);
        case ENHANCE_MONITORING -> enhanceMonitoring(incident);
        case BACKUP_PROJECT_STATE -> backup(incident);
        case ISOLATE_NETWORK_ACCESS -> isolateNetwork(incident);
        case FORENSIC_ANALYSIS -> forensics(incident);
      };
    } catch (RuntimeException ex) {
      metrics.increment("incident.action.failed");
      log.error("incident.action.failed id={} action={}", incident.id(), action.wireName(), ex);
      return "failed: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
    }
  }

  private String alert(SecurityIncident incident) {
    log.error("security.alert id={} type={} severity={} project={} description={}", incident.id(),
        incident.incidentType().wireName(), incident.severity().wireName(), incident.projectId(),
        incident.description());
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("severity", incident.severity().wireName());
    attributes.put("incident_type", incident.incidentType().wireName());
    attributes.put("urgency", incident.critical() ? "immediate" : "high");
    attributes.put("description", incident.description());
    notifications.send(NotificationType.SECURITY_ALERT, incident.projectId(), incident.id(), attributes);
    return SUCCEEDED;
  }

  /**
   * Quarantines a project; repeated calls are no-ops.
   *
   * @param projectId project to quarantine; may be {@code null}
   * @param incident triggering incident
   * @return outcome
   */
  private String quarantine(String projectId, SecurityIncident incident) {
    if (projectId == null) {
      return "skipped: no project";
    }
    if (zeroTrust.isQuarantined(projectId)) {
      return "skipped: already quarantined";
    }
    if (!zeroTrust.quarantineProject(projectId, incident.description())) {
      return "skipped: project not isolated";
    }
    notifications.send(NotificationType.PROJECT_QUARANTINED, projectId, incident.id(),
        Map.of("reason", incident.description()));
    return SUCCEEDED;
  }

  private String blockAccess(SecurityIncident incident) {
    String projectId = incident.projectId();
    if (projectId == null) {
      return "skipped: no project";
    }
    if (incident.targetPath() == null || incident.targetPath().isBlank()) {
      return "skipped: no target";
    }
    if (!zeroTrust.isActive(projectId)) {
      return "skipped: project not active";
    }
    zeroTrust.blockAccess(projectId, incident.targetPath());
    notifications.send(NotificationType.PROJECT_ACCESS_BLOCKED, projectId, incident.id(),
        Map.of("target_path", incident.targetPath()));
    return SUCCEEDED;
  }

  private String enhanceMonitoring(SecurityIncident incident) {
    String projectId = incident.projectId();
    if (projectId == null) {
      return "skipped: no project";
    }
    if (!zeroTrust.isActive(projectId)) {
      return "skipped: project not active";
    }
    return zeroTrust.enhanceMonitoring(projectId) ? SUCCEEDED : "skipped: already enhanced";
  }

  private String backup(SecurityIncident incident) {
    String projectId = incident.projectId();
    if (projectId == null) {
      return "skipped: no project";
    }
    Optional<Path> root = zeroTrust.projectRoot(projectId);
    if (root.isEmpty()) {
      return "skipped: project unknown";
    }
    // A quarantined tree is frozen; one backup covers every later incident until release.
    if (!zeroTrust.isQuarantined(projectId)) {
      quarantinedBackups.remove(projectId);
    } else if (!quarantinedBackups.add(projectId)) {
      return "skipped: quarantined project already backed up";
    }
    Path backup = locks.withLock(projectId, () -> {
      try {
        return evidenceStore.backupProject(projectId, root.get());
      } catch (IOException ex) {
        quarantinedBackups.remove(projectId);
        throw new UncheckedIOException("backup of project " + projectId + " failed", ex);
      }
    });
    log.info("incident.backup id={} project={} backup={}", incident.id(), projectId, backup);
    return SUCCEEDED;
  }

  private String isolateNetwork(SecurityIncident incident) {
    String projectId = incident.projectId();
    if (projectId == null) {
      return "skipped: no project";
    }
    if (!zeroTrust.isActive(projectId)) {
      return "skipped: project not active";
    }
    if (!zeroTrust.isolateNetwork(projectId)) {
      return "skipped: already isolated";
    }
    notifications.send(NotificationType.NETWORK_ISOLATED, projectId, incident.id(), Map.of());
    return SUCCEEDED;
  }

  private String forensics(SecurityIncident incident) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("incident", IncidentDocuments.toMap(incident));
    document.put("system_state", ProcessSnapshot.capture(clock.now()).toMap());
    Map<String, Object> systems = new LinkedHashMap<>();
    systems.put("active_projects", zeroTrust.activeProjects());
    systems.put("quarantined_projects", zeroTrust.quarantinedProjects());
    document.put("security_systems", systems);
    document.put("timestamp", clock.now().toString());
    try {
      Path written = evidenceStore.writeForensicSnapshot(incident.id(), document);
      log.info("incident.forensics id={} path={}", incident.id(), written);
    } catch (IOException ex) {
      throw new UncheckedIOException("forensic snapshot for " + incident.id() + " failed", ex);
    }
    return SUCCEEDED;
  }
}
