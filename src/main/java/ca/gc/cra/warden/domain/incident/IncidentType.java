package ca.gc.cra.warden.domain.incident;

import java.util.Locale;

/**
 * Classification of a security incident.
 *
 * @since 0.1.0
 */
public enum IncidentType {
  BOUNDARY_VIOLATION,
  PATH_TRAVERSAL_ATTACK,
  PRIVILEGE_ESCALATION,
  DATA_EXFILTRATION,
  SYSTEM_COMPROMISE,
  UNAUTHORIZED_ACCESS,
  POLICY_VIOLATION;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
