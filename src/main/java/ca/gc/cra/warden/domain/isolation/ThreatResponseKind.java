package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Response a threat detection rule may request once it matches.
 *
 * @since 0.1.0
 */
public enum ThreatResponseKind {
  BLOCK_ACCESS,
  IMMEDIATE_BLOCK,
  QUARANTINE_PROJECT,
  ALERT_SECURITY_TEAM,
  BLOCK_MODIFICATION,
  BACKUP_CONFIGURATION,
  RATE_LIMIT,
  RESOURCE_MONITORING;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
