package ca.gc.cra.warden.domain.isolation;

import java.util.Objects;

/**
 * Response action declared by a threat detection rule.
 *
 * @param action response kind; never {@code null}
 * @param priority execution order, lower first
 * @param automatic whether the action may run without an operator
 * @param requiresApproval whether the action must be approved or pre-authorized
 * @since 0.1.0
 */
public record ThreatResponse(ThreatResponseKind action, int priority, boolean automatic, boolean requiresApproval) {
  public ThreatResponse {
    action = Objects.requireNonNull(action, "action");
  }
}
