package ca.gc.cra.warden.application.path;

import java.util.Map;

/**
 * Counters accumulated by {@link PathGuard}.
 *
 * @param totalValidations recorded validations
 * @param unsafeValidations recorded validations that were rejected
 * @param totalAttempts attack-classified validations
 * @param attemptsByType attempts per attack type wire name
 * @param attemptsBySeverity attempts per severity wire name
 * @param attemptsByProject attempts per project id ({@code unscoped} when none)
 * @since 0.1.0
 */
public record PathGuardStatistics(
    long totalValidations,
    long unsafeValidations,
    long totalAttempts,
    Map<String, Long> attemptsByType,
    Map<String, Long> attemptsBySeverity,
    Map<String, Long> attemptsByProject) {
  public PathGuardStatistics {
    attemptsByType = Map.copyOf(attemptsByType);
    attemptsBySeverity = Map.copyOf(attemptsBySeverity);
    attemptsByProject = Map.copyOf(attemptsByProject);
  }
}
