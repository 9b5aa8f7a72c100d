package ca.gc.cra.warden.domain.security;

import java.util.Locale;

/**
 * Ordered severity scale shared by traversal attempts, boundary violations, threats and incidents.
 *
 * @since 0.1.0
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Returns the next severity up, saturating at {@link #CRITICAL}.
   *
   * @return escalated severity
   */
  public Severity escalate() {
    return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
  }

  /**
   * Tests whether this severity is at least as severe as {@code other}.
   *
   * @param other severity to compare against
   * @return {@code true} when this severity ranks equal or higher
   */
  public boolean atLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  /**
   * Lower-case name used in audit records and JSON documents.
   *
   * @return wire name such as {@code critical}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
