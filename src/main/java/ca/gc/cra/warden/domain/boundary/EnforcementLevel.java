package ca.gc.cra.warden.domain.boundary;

import java.util.Locale;

/**
 * How strongly a boundary rule is enforced.
 *
 * @since 0.1.0
 */
public enum EnforcementLevel {
  ADVISORY,
  BLOCKING,
  QUARANTINE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
