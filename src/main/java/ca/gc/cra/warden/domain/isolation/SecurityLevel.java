package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Isolation strength requested when a project is created.
 *
 * @since 0.1.0
 */
public enum SecurityLevel {
  STANDARD,
  ENHANCED,
  MAXIMUM;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a level name case-insensitively.
   *
   * @param raw textual level such as {@code enhanced}
   * @return parsed level
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static SecurityLevel fromWireName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("security level must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
