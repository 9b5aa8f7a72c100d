package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.util.Optional;

/**
 * Answer of the secure access gate. Callers must treat a denial as a hard stop.
 *
 * @param allowed whether the access may proceed
 * @param reason denial reason; {@code null} when allowed
 * @param incident incident created for the denial; may be {@code null}
 * @since 0.1.0
 */
public record SecureAccessResult(boolean allowed, String reason, SecurityIncident incident) {
  public static SecureAccessResult allow() {
    return new SecureAccessResult(true, null, null);
  }

  public static SecureAccessResult deny(String reason, SecurityIncident incident) {
    return new SecureAccessResult(false, reason, incident);
  }

  public Optional<SecurityIncident> incidentIfAny() {
    return Optional.ofNullable(incident);
  }
}
