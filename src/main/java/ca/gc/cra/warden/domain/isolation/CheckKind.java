package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Verification performed by a {@link VerificationCheck}.
 *
 * @since 0.1.0
 */
public enum CheckKind {
  /** Re-hash the project root and look for forbidden entries. */
  FILESYSTEM_INTEGRITY,
  /** Detect access from a different project's working context. */
  CROSS_PROJECT_ACCESS,
  /** Match targets against known escalation binaries and files. */
  PRIVILEGE_ESCALATION,
  /** Hash the project's isolation config file against its baseline. */
  CONFIGURATION_INTEGRITY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
