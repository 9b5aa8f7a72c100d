package ca.gc.cra.warden.domain.events;

/**
 * Outbound notification kinds published by the orchestrator.
 *
 * @since 0.1.0
 */
public enum NotificationType {
  SECURITY_INCIDENT("securityIncident"),
  SECURITY_ALERT("securityAlert"),
  EMERGENCY_PROTOCOL("emergencyProtocol"),
  PROJECT_QUARANTINED("projectQuarantined"),
  PROJECT_ACCESS_BLOCKED("projectAccessBlocked"),
  NETWORK_ISOLATED("networkIsolated"),
  SECURITY_POSTURE_UPDATED("securityPostureUpdated"),
  OPERATIONS_PAUSED("operationsPaused"),
  OPERATIONS_RESUMED("operationsResumed");

  private final String eventName;

  NotificationType(String eventName) {
    this.eventName = eventName;
  }

  /**
   * Event name subscribers match on.
   *
   * @return camel-case event name such as {@code securityIncident}
   */
  public String eventName() {
    return eventName;
  }
}
