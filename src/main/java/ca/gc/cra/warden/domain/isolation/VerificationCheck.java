package ca.gc.cra.warden.domain.isolation;

import java.util.List;
import java.util.Objects;

/**
 * Declarative verification check attached to a project boundary.
 *
 * <p>The failure action fires once {@code failureThreshold} consecutive failures have been observed within
 * {@code failureWindowMillis}; earlier failures are counted and logged only.</p>
 *
 * @param checkName stable check name such as {@code filesystem_integrity}; never {@code null}
 * @param kind verification performed; never {@code null}
 * @param frequency when the check runs; never {@code null}
 * @param periodMillis interval for periodic checks; ignored otherwise
 * @param failureAction action once the threshold is reached; never {@code null}
 * @param failureThreshold consecutive failures required, at least 1
 * @param failureWindowMillis window the consecutive failures must fall within
 * @param remediationSteps operator guidance; never {@code null}
 * @since 0.1.0
 */
public record VerificationCheck(
    String checkName,
    CheckKind kind,
    CheckFrequency frequency,
    long periodMillis,
    FailureAction failureAction,
    int failureThreshold,
    long failureWindowMillis,
    List<String> remediationSteps) {

  public VerificationCheck {
    checkName = Objects.requireNonNull(checkName, "checkName");
    kind = Objects.requireNonNull(kind, "kind");
    frequency = Objects.requireNonNull(frequency, "frequency");
    failureAction = Objects.requireNonNull(failureAction, "failureAction");
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be at least 1");
    }
    if (frequency == CheckFrequency.PERIODIC && periodMillis <= 0) {
      throw new IllegalArgumentException("periodic checks require a positive period");
    }
    remediationSteps = remediationSteps == null ? List.of() : List.copyOf(remediationSteps);
  }

  /**
   * Returns whether the check runs inline with each access.
   *
   * @return {@code true} for continuous and on-access checks
   */
  public boolean runsOnAccess() {
    return frequency == CheckFrequency.CONTINUOUS || frequency == CheckFrequency.ON_ACCESS;
  }
}
