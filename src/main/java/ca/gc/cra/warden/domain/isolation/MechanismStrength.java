package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Relative strength of an enforcement mechanism.
 *
 * @since 0.1.0
 */
public enum MechanismStrength {
  WEAK,
  MEDIUM,
  STRONG,
  CRYPTOGRAPHIC;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
