package ca.gc.cra.warden.domain.boundary;

import java.util.Locale;

/**
 * Action applied when a {@link BoundaryRule} matches.
 *
 * @since 0.1.0
 */
public enum RuleAction {
  ALLOW,
  DENY,
  AUDIT,
  QUARANTINE;

  /**
   * Reports whether the action produces a {@link BoundaryViolation}.
   *
   * @return {@code true} for deny and quarantine
   */
  public boolean violates() {
    return this == DENY || this == QUARANTINE;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
