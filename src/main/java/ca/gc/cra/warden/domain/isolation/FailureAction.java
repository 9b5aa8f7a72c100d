package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * What happens once a verification check fails often enough.
 *
 * @since 0.1.0
 */
public enum FailureAction {
  LOG,
  ALERT,
  BLOCK,
  QUARANTINE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
