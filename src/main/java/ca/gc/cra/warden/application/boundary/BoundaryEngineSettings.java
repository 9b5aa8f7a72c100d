package ca.gc.cra.warden.application.boundary;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings of the {@link BoundaryEngine}.
 *
 * @param homeDirectory directory substituted for {@code ~} in rule patterns
 * @param monitorFrameworkCore whether the framework root gets a directory watch
 * @param violationHistoryLimit capacity of the recent-violation ring
 * @since 0.1.0
 */
public record BoundaryEngineSettings(Path homeDirectory, boolean monitorFrameworkCore, int violationHistoryLimit) {
  public BoundaryEngineSettings {
    homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory").toAbsolutePath().normalize();
    if (violationHistoryLimit <= 0) {
      throw new IllegalArgumentException("violationHistoryLimit must be positive");
    }
  }
}
