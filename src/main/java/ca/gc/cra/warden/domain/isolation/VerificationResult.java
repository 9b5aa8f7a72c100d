package ca.gc.cra.warden.domain.isolation;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of running one verification check.
 *
 * @param checkName check that ran; never {@code null}
 * @param kind verification performed; never {@code null}
 * @param passed whether the check passed
 * @param detail failure detail or {@code ok}; never {@code null}
 * @param actionTaken failure action executed, or {@code null} when none fired
 * @param timestamp completion time; never {@code null}
 * @since 0.1.0
 */
public record VerificationResult(
    String checkName, CheckKind kind, boolean passed, String detail, FailureAction actionTaken, Instant timestamp) {
  public VerificationResult {
    checkName = Objects.requireNonNull(checkName, "checkName");
    kind = Objects.requireNonNull(kind, "kind");
    detail = Objects.requireNonNull(detail, "detail");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Reports whether this result must deny the access that triggered it.
   *
   * @return {@code true} when a block or quarantine action fired
   */
  public boolean deniesAccess() {
    return actionTaken == FailureAction.BLOCK || actionTaken == FailureAction.QUARANTINE;
  }
}
