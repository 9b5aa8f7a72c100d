package ca.gc.cra.warden.domain.incident;

import java.util.Locale;

/**
 * Automated response the orchestrator may execute for an incident.
 *
 * @since 0.1.0
 */
public enum ResponseActionType {
  ALERT_SECURITY_TEAM,
  QUARANTINE_PROJECT,
  BLOCK_ACCESS,
  ENHANCE_MONITORING,
  BACKUP_PROJECT_STATE,
  ISOLATE_NETWORK_ACCESS,
  FORENSIC_ANALYSIS;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
