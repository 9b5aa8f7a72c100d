package ca.gc.cra.warden.domain.boundary;

import java.util.Locale;

/**
 * Kind of region a {@link FileSystemBoundary} protects.
 *
 * @since 0.1.0
 */
public enum BoundaryType {
  FRAMEWORK_CORE,
  PROJECT_SANDBOX,
  SHARED_RESOURCE,
  QUARANTINE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
