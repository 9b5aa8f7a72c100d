package ca.gc.cra.warden.domain.path;

import ca.gc.cra.warden.domain.security.Severity;
import java.util.Locale;

/**
 * Classification of a path manipulation attack with its base severity.
 *
 * <p>Null-byte and symlink attacks are critical, encoded forms are high and the remaining
 * structural forms are medium. Targets under protected paths escalate the base severity by one level.</p>
 *
 * @since 0.1.0
 */
public enum AttackType {
  BASIC_TRAVERSAL(Severity.MEDIUM),
  ENCODED_TRAVERSAL(Severity.HIGH),
  UNICODE_TRAVERSAL(Severity.MEDIUM),
  SYMLINK_TRAVERSAL(Severity.CRITICAL),
  DOUBLE_ENCODING(Severity.HIGH),
  NULL_BYTE_INJECTION(Severity.CRITICAL),
  WINDOWS_TRAVERSAL(Severity.MEDIUM),
  MIXED_SEPARATORS(Severity.MEDIUM);

  private final Severity baseSeverity;

  AttackType(Severity baseSeverity) {
    this.baseSeverity = baseSeverity;
  }

  public Severity baseSeverity() {
    return baseSeverity;
  }

  /**
   * Computes the severity for this attack given whether the target is protected.
   *
   * @param targetsProtectedPath whether the normalized target falls under a protected path
   * @return effective severity
   */
  public Severity severityFor(boolean targetsProtectedPath) {
    return targetsProtectedPath ? baseSeverity.escalate() : baseSeverity;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
