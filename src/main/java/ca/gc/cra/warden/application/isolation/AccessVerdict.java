package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.isolation.VerificationResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of the per-project access gate.
 *
 * @param allowed whether the access may proceed
 * @param reason denial reason, or {@code allowed}
 * @param results on-access verification results, in check order
 * @param event unauthorized-access event the caller must handle when denied; {@code null} when allowed
 * @since 0.1.0
 */
public record AccessVerdict(
    boolean allowed, String reason, List<VerificationResult> results, SecurityEvent.UnauthorizedAccess event) {
  public AccessVerdict {
    reason = Objects.requireNonNull(reason, "reason");
    results = results == null ? List.of() : List.copyOf(results);
  }

  public Optional<SecurityEvent.UnauthorizedAccess> eventIfAny() {
    return Optional.ofNullable(event);
  }
}
