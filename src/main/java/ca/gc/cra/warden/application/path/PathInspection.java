package ca.gc.cra.warden.application.path;

import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.path.PathTraversalAttempt;
import ca.gc.cra.warden.domain.path.SafePath;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Full result of inspecting a path: the caller-facing {@link SafePath} plus the attempt and event it implies.
 *
 * @param safePath validation result; never {@code null}
 * @param normalizedPath canonical target; {@code null} when the input could not be turned into a path
 * @param attempt attempt record for attack-classified inputs; may be {@code null}
 * @param event event to raise for unsafe inputs; may be {@code null}
 * @param protectedTarget whether the target lies under a protected path
 * @since 0.1.0
 */
public record PathInspection(
    SafePath safePath, Path normalizedPath, PathTraversalAttempt attempt, SecurityEvent event, boolean protectedTarget) {
  public PathInspection {
    safePath = Objects.requireNonNull(safePath, "safePath");
  }

  public Optional<SecurityEvent> eventIfAny() {
    return Optional.ofNullable(event);
  }

  public boolean safe() {
    return safePath.safe();
  }
}
