package ca.gc.cra.warden.application.boundary;

import java.util.Locale;

/**
 * How {@link ViolationEnforcer} treats offending artifacts.
 *
 * @since 0.1.0
 */
public enum EnforcementMode {
  /** Delete denied artifacts and move quarantined ones. */
  ENFORCE,
  /** Log what would have happened; touch nothing. */
  DRY_RUN;

  /**
   * Parses a configuration value case-insensitively.
   *
   * @param raw textual mode
   * @return parsed mode
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static EnforcementMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("enforcementMode must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("enforcementMode must be ENFORCE or DRY_RUN (was " + raw + ")", ex);
    }
  }
}
