package ca.gc.cra.warden.domain.incident;

import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> The orchestrator's unit of record for a detected security event.
 * <p><strong>Role:</strong> Created exactly once per triggering event; never deleted.</p>
 * <p><strong>Thread-safety:</strong> Identity and evidence are immutable. Lifecycle state, action outcomes and
 * emergency step outcomes are guarded by this instance's monitor.</p>
 *
 * @since 0.1.0
 */
public final class SecurityIncident {
  private final String id;
  private final Instant timestamp;
  private final IncidentType incidentType;
  private final Severity severity;
  private final SourceSystem sourceSystem;
  private final String projectId;
  private final String targetPath;
  private final String description;
  private final Map<String, String> evidence;
  private final List<ResponseActionType> responseActions;
  private final Map<ResponseActionType, String> actionOutcomes = new LinkedHashMap<>();
  private final Map<String, String> emergencyOutcomes = new LinkedHashMap<>();

  private IncidentStatus status = IncidentStatus.DETECTED;
  private Instant resolvedAt;

  /**
   * Creates an incident in the {@link IncidentStatus#DETECTED} state.
   *
   * @param id unique identifier
   * @param timestamp creation time
   * @param incidentType classification
   * @param severity severity
   * @param sourceSystem subsystem that raised the triggering event
   * @param projectId implicated project; may be {@code null}
   * @param targetPath implicated path; may be {@code null}
   * @param description human-readable summary
   * @param evidence attributes of the triggering event
   * @param responseActions actions selected by the response policy
   */
  public SecurityIncident(
      String id,
      Instant timestamp,
      IncidentType incidentType,
      Severity severity,
      SourceSystem sourceSystem,
      String projectId,
      String targetPath,
      String description,
      Map<String, String> evidence,
      List<ResponseActionType> responseActions) {
    this.id = Objects.requireNonNull(id, "id");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.incidentType = Objects.requireNonNull(incidentType, "incidentType");
    this.severity = Objects.requireNonNull(severity, "severity");
    this.sourceSystem = Objects.requireNonNull(sourceSystem, "sourceSystem");
    this.projectId = projectId;
    this.targetPath = targetPath;
    this.description = Objects.requireNonNull(description, "description");
    this.evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    this.responseActions = responseActions == null ? List.of() : List.copyOf(responseActions);
  }

  public String id() {
    return id;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public IncidentType incidentType() {
    return incidentType;
  }

  public Severity severity() {
    return severity;
  }

  public SourceSystem sourceSystem() {
    return sourceSystem;
  }

  public String projectId() {
    return projectId;
  }

  public String targetPath() {
    return targetPath;
  }

  public String description() {
    return description;
  }

  public Map<String, String> evidence() {
    return evidence;
  }

  public List<ResponseActionType> responseActions() {
    return responseActions;
  }

  public boolean critical() {
    return severity == Severity.CRITICAL;
  }

  public synchronized IncidentStatus status() {
    return status;
  }

  public synchronized Instant resolvedAt() {
    return resolvedAt;
  }

  /**
   * Moves the incident forward.
   *
   * @param next requested status
   * @param at transition time, recorded as {@code resolvedAt} for terminal states
   * @throws IllegalStateException when the transition is not a legal forward move
   */
  public synchronized void transitionTo(IncidentStatus next, Instant at) {
    Objects.requireNonNull(next, "next");
    if (!status.canTransitionTo(next, critical())) {
      throw new IllegalStateException(
          "Incident " + id + " cannot move from " + status.wireName() + " to " + next.wireName());
    }
    status = next;
    if (next.terminal()) {
      resolvedAt = Objects.requireNonNull(at, "at");
    }
  }

  /**
   * Records how a response action ended.
   *
   * @param action executed action
   * @param outcome {@code succeeded}, {@code skipped: ...} or {@code failed: ...}
   */
  public synchronized void recordActionOutcome(ResponseActionType action, String outcome) {
    actionOutcomes.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(outcome, "outcome"));
  }

  public synchronized Map<ResponseActionType, String> actionOutcomes() {
    return Map.copyOf(actionOutcomes);
  }

  /**
   * Records how an emergency protocol step ended.
   *
   * @param step step name such as {@code quarantine} or {@code evidence}
   * @param outcome {@code succeeded}, {@code skipped: ...} or {@code failed: ...}
   */
  public synchronized void recordEmergencyOutcome(String step, String outcome) {
    emergencyOutcomes.put(Objects.requireNonNull(step, "step"), Objects.requireNonNull(outcome, "outcome"));
  }

  public synchronized Map<String, String> emergencyOutcomes() {
    return Map.copyOf(emergencyOutcomes);
  }

  /**
   * Counts response actions and emergency steps whose recorded outcome is a failure.
   *
   * @return failed action count
   */
  public synchronized long failedActionCount() {
    return actionOutcomes.values().stream().filter(outcome -> outcome.startsWith("failed")).count()
        + emergencyOutcomes.values().stream().filter(outcome -> outcome.startsWith("failed")).count();
  }

  @Override
  public String toString() {
    return "SecurityIncident{" + id + ", " + incidentType.wireName() + ", " + severity.wireName() + '}';
  }
}
