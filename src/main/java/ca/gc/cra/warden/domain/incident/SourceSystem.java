package ca.gc.cra.warden.domain.incident;

import java.util.Locale;

/**
 * Subsystem that raised the event behind an incident.
 *
 * @since 0.1.0
 */
public enum SourceSystem {
  PATH_GUARD,
  BOUNDARY_ENGINE,
  ZERO_TRUST,
  ORCHESTRATOR;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
