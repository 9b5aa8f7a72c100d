package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.application.boundary.BoundaryEngine;
import ca.gc.cra.warden.application.events.SecurityEventBus;
import ca.gc.cra.warden.application.isolation.AccessVerdict;
import ca.gc.cra.warden.application.isolation.ZeroTrustIsolation;
import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.application.path.PathGuard;
import ca.gc.cra.warden.application.path.PathInspection;
import ca.gc.cra.warden.application.port.AuditLogPort;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityNotificationPort;
import ca.gc.cra.warden.application.util.Ids;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.boundary.AccessDecision;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.incident.IncidentStatus;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import ca.gc.cra.warden.domain.incident.SecurityPosture;
import ca.gc.cra.warden.domain.incident.SystemHealth;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Root of the security core: turns events into incidents, runs the response policy, drives
 * the emergency protocol, assesses posture and exposes the secure access gate.
 * <p><strong>Why:</strong> The leaf subsystems detect; only the orchestrator decides what a detection means for
 * the workspace and records it.</p>
 * <p><strong>Role:</strong> Owns the security loop and the incident ledger. Drains the {@link SecurityEventBus}
 * the leaf subsystems publish into; gate denials are turned into incidents synchronously.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create exactly one incident per event, audit it and execute its response actions independently.</li>
 *   <li>Escalate critical incidents through the emergency protocol.</li>
 *   <li>Assess posture on a fixed interval and publish it.</li>
 *   <li>Gate access through path validation, boundary rules and the project gate, in that order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Incident creation may run on the security loop and on caller threads at the
 * same time; the ledger and each incident guard their own state.</p>
 * <p><strong>Observability:</strong> Counts {@code incident.created} and {@code incident.action.failed}; every
 * incident is logged at WARN and written to the audit log.</p>
 *
 * @since 0.1.0
 */
public final class SecurityOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SecurityOrchestrator.class);
  private static final Duration CRITICAL_WINDOW = Duration.ofHours(24);
  private static final int LOG_PATH_BYTES = 256;

  private enum Lifecycle { NEW, RUNNING, STOPPED }

  private final OrchestratorSettings settings;
  private final PathGuard pathGuard;
  private final BoundaryEngine engine;
  private final ZeroTrustIsolation zeroTrust;
  private final SecurityEventBus eventBus;
  private final AuditLogPort auditLog;
  private final Supplier<ScheduledExecutorService> loopFactory;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final IncidentLedger ledger = new IncidentLedger();
  private final IncidentMapper mapper = new IncidentMapper();
  private final NotificationRelay notifications;
  private final ResponseActionExecutor actions;
  private final EmergencyProtocol emergency;
  private final PostureAssessor postureAssessor;
  private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

  private Lifecycle lifecycle = Lifecycle.NEW;
  private ScheduledExecutorService loop;
  private volatile SecurityPosture latestPosture;

  /**
   * Wires the orchestrator over already constructed subsystems.
   *
   * @param settings task periods
   * @param pathGuard path validation
   * @param engine boundary engine
   * @param zeroTrust project isolation
   * @param eventBus channel the subsystems publish into
   * @param auditLog incident audit trail
   * @param evidenceStore forensic snapshots, evidence bundles and backups
   * @param notifier outbound notifications
   * @param locks per-project locks shared with the isolation layer
   * @param recentLogs supplier of recent log lines for evidence bundles
   * @param aggregator posture aggregation
   * @param loopFactory creates the security loop on {@link #start()}
   * @param clock time source
   * @param metrics metrics sink
   */
  public SecurityOrchestrator(
      OrchestratorSettings settings,
      PathGuard pathGuard,
      BoundaryEngine engine,
      ZeroTrustIsolation zeroTrust,
      SecurityEventBus eventBus,
      AuditLogPort auditLog,
      EvidenceStorePort evidenceStore,
      SecurityNotificationPort notifier,
      ProjectLocks locks,
      Supplier<List<String>> recentLogs,
      PostureAggregator aggregator,
      Supplier<ScheduledExecutorService> loopFactory,
      ClockPort clock,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.pathGuard = Objects.requireNonNull(pathGuard, "pathGuard");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.zeroTrust = Objects.requireNonNull(zeroTrust, "zeroTrust");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.loopFactory = Objects.requireNonNull(loopFactory, "loopFactory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.notifications = new NotificationRelay(notifier, clock);
    this.actions = new ResponseActionExecutor(zeroTrust, evidenceStore, locks, notifications, clock, metrics);
    this.emergency = new EmergencyProtocol(actions, evidenceStore, notifications, recentLogs, ledger::recent,
        settings.recentIncidentsInEvidence(), clock);
    this.postureAssessor = new PostureAssessor(aggregator);
  }

  /**
   * Creates the security loop and schedules watcher polls, integrity checks, verification timers, threat scans,
   * event drains and posture assessments.
   *
   * @throws IllegalStateException when the orchestrator was stopped
   */
  public synchronized void start() {
    if (lifecycle == Lifecycle.STOPPED) {
      throw new IllegalStateException("security orchestrator was stopped and cannot be restarted");
    }
    if (lifecycle == Lifecycle.RUNNING) {
      return;
    }
    loop = loopFactory.get();
    engine.start(loop, settings.watchPollIntervalMillis(), settings.integrityCheckIntervalMillis());
    zeroTrust.start(loop, settings.threatScanIntervalMillis());
    scheduled.add(loop.scheduleWithFixedDelay(this::drainSafely, settings.eventDrainIntervalMillis(),
        settings.eventDrainIntervalMillis(), TimeUnit.MILLISECONDS));
    scheduled.add(loop.scheduleWithFixedDelay(this::assessSafely, settings.postureIntervalMillis(),
        settings.postureIntervalMillis(), TimeUnit.MILLISECONDS));
    lifecycle = Lifecycle.RUNNING;
    log.info("Security orchestrator started (drain={}ms, posture={}ms)", settings.eventDrainIntervalMillis(),
        settings.postureIntervalMillis());
  }

  /**
   * Cancels scheduled work, closes watchers and shuts the loop down; in-flight tasks are allowed to finish.
   * Events still queued are processed on the calling thread.
   */
  public synchronized void stop() {
    if (lifecycle == Lifecycle.RUNNING) {
      scheduled.forEach(future -> future.cancel(false));
      scheduled.clear();
      zeroTrust.stop();
      engine.stop();
      loop.shutdown();
      loop = null;
      processPendingEvents();
      log.info("Security orchestrator stopped");
    }
    lifecycle = Lifecycle.STOPPED;
  }

  private synchronized void ensureNotStopped() {
    if (lifecycle == Lifecycle.STOPPED) {
      throw new IllegalStateException("security orchestrator is stopped");
    }
  }

  private void drainSafely() {
    try {
      processPendingEvents();
    } catch (RuntimeException ex) {
      log.error("Event drain failed", ex);
    }
  }

  private void assessSafely() {
    try {
      assessSecurityPosture();
    } catch (RuntimeException ex) {
      log.error("Posture assessment failed", ex);
    }
  }

  /**
   * Turns every queued event into an incident.
   *
   * @return number of events processed
   */
  public int processPendingEvents() {
    return eventBus.drain(this::handleEvent);
  }

  /**
   * Creates the incident for one event and runs its response.
   *
   * @param event triggering event
   * @return the new incident
   */
  public SecurityIncident handleEvent(SecurityEvent event) {
    Objects.requireNonNull(event, "event");
    IncidentDraft draft = event.accept(mapper);
    Instant now = clock.now();
    SecurityIncident incident = new SecurityIncident(
        Ids.next("INC", now.toEpochMilli()),
        now,
        draft.incidentType(),
        draft.severity(),
        draft.sourceSystem(),
        draft.projectId(),
        draft.targetPath(),
        draft.description(),
        draft.evidence(),
        ResponsePolicy.actionsFor(draft.incidentType(), draft.severity()));
    ledger.add(incident);
    metrics.increment("incident.created");
    log.warn("security.incident id={} type={} severity={} source={} project={} target={}", incident.id(),
        incident.incidentType().wireName(), incident.severity().wireName(), incident.sourceSystem().wireName(),
        incident.projectId(), incident.targetPath() == null ? null : Logs.truncate(incident.targetPath(),
            LOG_PATH_BYTES));
    audit(incident);
    notifications.send(NotificationType.SECURITY_INCIDENT, incident.projectId(), incident.id(),
        Map.of("incident_type", incident.incidentType().wireName(), "severity", incident.severity().wireName()));
    actions.executeAll(incident);
    incident.transitionTo(IncidentStatus.INVESTIGATING, clock.now());
    if (incident.critical()) {
      emergency.activate(incident);
      incident.transitionTo(IncidentStatus.ESCALATED, clock.now());
    }
    return incident;
  }

  private void audit(SecurityIncident incident) {
    try {
      auditLog.append(incident);
    } catch (IOException | RuntimeException ex) {
      log.error("Audit write failed for incident {}", incident.id(), ex);
    }
  }

  /**
   * The single gate callers must pass before any file operation: path validation, then boundary rules, then the
   * project gate. The first failure short-circuits and creates its incident.
   *
   * @param projectId accessing project; {@code null} skips the project gate
   * @param operation requested operation
   * @param targetPath requested target
   * @return decision; a denial is a hard stop
   * @throws IllegalArgumentException when {@code projectId} names a project that was never isolated
   * @throws IllegalStateException when the orchestrator is stopped
   */
  public SecureAccessResult validateSecureAccess(String projectId, AccessOperation operation, String targetPath) {
    Objects.requireNonNull(operation, "operation");
    ensureNotStopped();
    PathInspection inspection = pathGuard.evaluate(targetPath, projectId, operation);
    if (!inspection.safe()) {
      zeroTrust.recordActivity(projectId, operation, targetPath);
      SecurityIncident incident = inspection.eventIfAny().map(this::handleEvent).orElse(null);
      return SecureAccessResult.deny(
          "path validation failed: " + String.join("; ", inspection.safePath().violations()), incident);
    }
    AccessDecision decision = engine.validateFileAccess(targetPath, operation, projectId);
    if (!decision.allowed()) {
      zeroTrust.recordActivity(projectId, operation, targetPath);
      SecurityIncident incident = decision.violationIfAny()
          .map(violation -> handleEvent(new SecurityEvent.BoundaryViolationDetected(violation)))
          .orElse(null);
      return SecureAccessResult.deny(decision.reason(), incident);
    }
    if (projectId != null) {
      AccessVerdict verdict = zeroTrust.verifyAccess(projectId, operation, targetPath);
      if (!verdict.allowed()) {
        SecurityIncident incident = verdict.eventIfAny().map(this::handleEvent).orElse(null);
        return SecureAccessResult.deny(verdict.reason(), incident);
      }
    }
    return SecureAccessResult.allow();
  }

  /**
   * Creates an isolated project.
   *
   * @param projectId project identifier
   * @param projectPath project root
   * @param level security level
   * @return result carrying the security context, or the error for rejected input
   * @throws IllegalStateException when the orchestrator is stopped
   */
  public SecureProjectResult createSecureProject(String projectId, String projectPath, SecurityLevel level) {
    ensureNotStopped();
    try {
      ProjectIsolationBoundary boundary = zeroTrust.createProjectIsolation(projectId, projectPath, level);
      log.info("security.project.created project={} level={}", boundary.projectId(),
          boundary.securityLevel().wireName());
      return SecureProjectResult.succeeded(new SecurityContext(boundary.projectId(), boundary.securityLevel(),
          boundary.boundaryId(), boundary.projectRoot(), boundary.createdAt()));
    } catch (IllegalArgumentException | IllegalStateException | NullPointerException ex) {
      log.warn("security.project.rejected project={} reason={}", projectId, ex.getMessage());
      return SecureProjectResult.failed(ex.getMessage());
    }
  }

  public boolean removeProjectIsolation(String projectId) {
    return zeroTrust.removeProjectIsolation(projectId);
  }

  /**
   * Marks an investigating incident as contained.
   *
   * @param incidentId incident identifier
   * @return the incident
   * @throws IllegalArgumentException when the incident is unknown
   * @throws IllegalStateException when the incident is not under investigation
   */
  public SecurityIncident containIncident(String incidentId) {
    SecurityIncident incident = requireIncident(incidentId);
    incident.transitionTo(IncidentStatus.CONTAINED, clock.now());
    log.info("security.incident.contained id={}", incidentId);
    return incident;
  }

  /**
   * Resolves an investigating or contained incident.
   *
   * @param incidentId incident identifier
   * @return the incident
   * @throws IllegalArgumentException when the incident is unknown
   * @throws IllegalStateException when the incident is already terminal
   */
  public SecurityIncident resolveIncident(String incidentId) {
    SecurityIncident incident = requireIncident(incidentId);
    incident.transitionTo(IncidentStatus.RESOLVED, clock.now());
    log.info("security.incident.resolved id={}", incidentId);
    return incident;
  }

  private SecurityIncident requireIncident(String incidentId) {
    return ledger.find(Objects.requireNonNull(incidentId, "incidentId"))
        .orElseThrow(() -> new IllegalArgumentException("unknown incident: " + incidentId));
  }

  public Optional<SecurityIncident> incident(String incidentId) {
    return ledger.find(incidentId);
  }

  /**
   * Most recent incidents, newest first.
   *
   * @param limit maximum number returned
   * @return incidents
   */
  public List<SecurityIncident> incidents(int limit) {
    return ledger.recent(limit);
  }

  public List<SecurityIncident> activeIncidents() {
    return ledger.active();
  }

  public List<SecurityIncident> criticalIncidents() {
    return ledger.critical();
  }

  public boolean operationsPaused() {
    return emergency.paused();
  }

  /**
   * Clears the pause set by the emergency protocol.
   *
   * @return {@code true} when operations were paused
   */
  public boolean resumeOperations() {
    return emergency.resume();
  }

  /**
   * Assesses and publishes the current posture.
   *
   * @return the new posture
   */
  public SecurityPosture assessSecurityPosture() {
    SecurityPosture posture = computePosture();
    latestPosture = posture;
    log.info("security.posture score={} status={} active_threats={}", posture.overallScore(),
        posture.complianceStatus().wireName(), posture.activeThreats());
    notifications.send(NotificationType.SECURITY_POSTURE_UPDATED, null, null, Map.of(
        "overall_score", Double.toString(posture.overallScore()),
        "compliance_status", posture.complianceStatus().wireName()));
    return posture;
  }

  /**
   * Last published posture.
   *
   * @return posture, empty before the first assessment
   */
  public Optional<SecurityPosture> latestPosture() {
    return Optional.ofNullable(latestPosture);
  }

  private SecurityPosture computePosture() {
    Instant now = clock.now();
    SystemHealth health = new SystemHealth(
        clamp(pathGuard.healthScore()),
        clamp(engine.healthScore()),
        clamp(zeroTrust.healthScore()),
        incidentResponseScore(now));
    return postureAssessor.assess(health, ledger.active().size(), ledger.countWithStatus(IncidentStatus.RESOLVED),
        now);
  }

  /**
   * Response health: 15 points per open critical incident of the last 24 hours and up to 25 points for the share
   * of failed response actions.
   */
  double incidentResponseScore(Instant now) {
    int openCritical = ledger.openCriticalSince(now.minus(CRITICAL_WINDOW));
    long executed = 0;
    long failed = 0;
    for (SecurityIncident incident : ledger.matching(incident -> true)) {
      Map<ResponseActionType, String> outcomes = incident.actionOutcomes();
      executed += outcomes.size();
      failed += incident.failedActionCount();
    }
    double failureRatio = executed == 0 ? 0.0 : (double) failed / executed;
    return clamp(100.0 - 15.0 * openCritical - 25.0 * failureRatio);
  }

  private static double clamp(double score) {
    return Math.max(0.0, Math.min(100.0, score));
  }

  /**
   * Aggregates the current posture, the three subsystem reports, the last 100 incidents and pending approvals.
   *
   * @return JSON-compatible document
   */
  public Map<String, Object> buildComprehensiveSecurityReport() {
    return new SecurityReportBuilder(clock.now())
        .posture(computePosture())
        .section("path_protection", pathGuard.report())
        .section("boundary_enforcement", engine.report())
        .section("zero_trust", zeroTrust.report())
        .incidents(ledger.recent(SecurityReportBuilder.REPORT_INCIDENTS))
        .pendingApprovals(zeroTrust.pendingApprovals())
        .operationsPaused(emergency.paused())
        .build();
  }

  public String exportComprehensiveSecurityReport() {
    return JsonDocuments.writePretty(buildComprehensiveSecurityReport());
  }

  public PathGuard pathGuard() {
    return pathGuard;
  }

  public BoundaryEngine boundaryEngine() {
    return engine;
  }

  public ZeroTrustIsolation zeroTrust() {
    return zeroTrust;
  }
}
