package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * When a verification check runs.
 *
 * @since 0.1.0
 */
public enum CheckFrequency {
  CONTINUOUS,
  PERIODIC,
  ON_ACCESS,
  ON_CHANGE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
