package ca.gc.cra.warden.domain.boundary;

import java.util.Optional;

/**
 * Result of a synchronous boundary access check.
 *
 * @param allowed whether the access may proceed
 * @param reason denial reason; {@code null} when allowed
 * @param violation violation describing the denial; may be {@code null}
 * @since 0.1.0
 */
public record AccessDecision(boolean allowed, String reason, BoundaryViolation violation) {

  private static final AccessDecision ALLOWED = new AccessDecision(true, null, null);

  public static AccessDecision allow() {
    return ALLOWED;
  }

  public static AccessDecision deny(String reason, BoundaryViolation violation) {
    return new AccessDecision(false, reason, violation);
  }

  public Optional<BoundaryViolation> violationIfAny() {
    return Optional.ofNullable(violation);
  }
}
