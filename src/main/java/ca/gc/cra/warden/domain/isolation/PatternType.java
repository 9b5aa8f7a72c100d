package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Activity stream a threat detection pattern is evaluated against.
 *
 * @since 0.1.0
 */
public enum PatternType {
  FILE_ACCESS,
  PROCESS_BEHAVIOR,
  NETWORK_ACTIVITY,
  SYSTEM_CALL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
