package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Category of a threat detection rule.
 *
 * @since 0.1.0
 */
public enum ThreatCategory {
  DATA_EXFILTRATION,
  PRIVILEGE_ESCALATION,
  LATERAL_MOVEMENT,
  PERSISTENCE,
  CODE_INJECTION,
  CONFIGURATION_TAMPERING,
  RESOURCE_EXHAUSTION;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
