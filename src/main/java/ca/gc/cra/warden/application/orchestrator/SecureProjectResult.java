package ca.gc.cra.warden.application.orchestrator;

import java.util.Optional;

/**
 * Outcome of creating a secure project.
 *
 * @param success whether the project is now isolated
 * @param securityContext context of the new project; {@code null} on failure
 * @param error failure message; {@code null} on success
 * @since 0.1.0
 */
public record SecureProjectResult(boolean success, SecurityContext securityContext, String error) {
  public static SecureProjectResult succeeded(SecurityContext context) {
    return new SecureProjectResult(true, context, null);
  }

  public static SecureProjectResult failed(String error) {
    return new SecureProjectResult(false, null, error);
  }

  public Optional<SecurityContext> contextIfAny() {
    return Optional.ofNullable(securityContext);
  }
}
