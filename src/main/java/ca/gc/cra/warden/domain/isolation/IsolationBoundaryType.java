package ca.gc.cra.warden.domain.isolation;

import java.util.Locale;

/**
 * Nature of the separation a project isolation boundary provides.
 *
 * @since 0.1.0
 */
public enum IsolationBoundaryType {
  PHYSICAL,
  LOGICAL,
  TEMPORAL,
  CREDENTIAL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
