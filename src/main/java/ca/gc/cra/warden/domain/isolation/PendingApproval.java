package ca.gc.cra.warden.domain.isolation;

import java.time.Instant;
import java.util.Objects;

/**
 * Threat response queued for operator approval.
 *
 * @param approvalId unique identifier; never {@code null}
 * @param projectId affected project; never {@code null}
 * @param ruleId threat rule that requested the action; never {@code null}
 * @param action queued action; never {@code null}
 * @param requestedAt queue time; never {@code null}
 * @param target target path of the triggering activity; may be {@code null}
 * @since 0.1.0
 */
public record PendingApproval(
    String approvalId, String projectId, String ruleId, ThreatResponseKind action, Instant requestedAt, String target) {
  public PendingApproval {
    approvalId = Objects.requireNonNull(approvalId, "approvalId");
    projectId = Objects.requireNonNull(projectId, "projectId");
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    action = Objects.requireNonNull(action, "action");
    requestedAt = Objects.requireNonNull(requestedAt, "requestedAt");
  }
}
