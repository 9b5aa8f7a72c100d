package ca.gc.cra.warden.domain.isolation;

import java.util.Objects;

/**
 * Isolation mechanism attached to a project boundary.
 *
 * @param mechanism mechanism name such as {@code filesystem_sandbox}; never {@code null}
 * @param strength mechanism strength; never {@code null}
 * @param monitoringEnabled whether the mechanism is monitored
 * @param automaticRemediation whether failures are remediated without approval
 * @since 0.1.0
 */
public record EnforcementMechanism(
    String mechanism, MechanismStrength strength, boolean monitoringEnabled, boolean automaticRemediation) {
  public EnforcementMechanism {
    mechanism = Objects.requireNonNull(mechanism, "mechanism");
    strength = Objects.requireNonNull(strength, "strength");
  }
}
