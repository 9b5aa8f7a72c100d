package ca.gc.cra.warden.domain.incident;

import java.util.Locale;

/**
 * Incident lifecycle states.
 *
 * <p>Transitions only move forward: {@code detected -> investigating -> contained -> resolved}, with
 * {@code investigating -> resolved} allowed directly. {@code escalated} is reachable from every state except
 * {@code resolved}, and only for critical incidents. {@code resolved} and {@code escalated} are terminal.</p>
 *
 * @since 0.1.0
 */
public enum IncidentStatus {
  DETECTED,
  INVESTIGATING,
  CONTAINED,
  RESOLVED,
  ESCALATED;

  /**
   * Reports whether no further transitions are possible.
   *
   * @return {@code true} for resolved and escalated
   */
  public boolean terminal() {
    return this == RESOLVED || this == ESCALATED;
  }

  /**
   * Tests whether moving to {@code next} is a legal forward transition.
   *
   * @param next requested status
   * @param critical whether the incident is critical
   * @return {@code true} when allowed
   */
  public boolean canTransitionTo(IncidentStatus next, boolean critical) {
    if (next == null || terminal()) {
      return false;
    }
    return switch (next) {
      case DETECTED -> false;
      case INVESTIGATING -> this == DETECTED;
      case CONTAINED -> this == INVESTIGATING;
      case RESOLVED -> this == INVESTIGATING || this == CONTAINED;
      case ESCALATED -> critical;
    };
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
