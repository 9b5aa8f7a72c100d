package ca.gc.cra.warden.domain.boundary;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered access rule attached to a {@link FileSystemBoundary}.
 *
 * <p>Rules are evaluated in {@link #EVALUATION_ORDER}: lower {@code priority} first, ties broken by ascending
 * {@code ruleId}. The first enabled rule whose patterns and conditions all hold decides the action.</p>
 *
 * @param ruleId unique rule identifier; never blank
 * @param sourcePattern glob matched against the source process path; {@code *} matches anything
 * @param targetPattern glob matched against the target path
 * @param action action applied on match
 * @param enforcementLevel enforcement strength
 * @param conditions predicates that must all hold; empty means unconditional
 * @param enabled disabled rules never match
 * @param priority evaluation order key, lower first
 * @since 0.1.0
 */
public record BoundaryRule(
    String ruleId,
    String sourcePattern,
    String targetPattern,
    RuleAction action,
    EnforcementLevel enforcementLevel,
    List<RuleCondition> conditions,
    boolean enabled,
    int priority) {

  /** Total evaluation order applied to every rule set. */
  public static final Comparator<BoundaryRule> EVALUATION_ORDER =
      Comparator.comparingInt(BoundaryRule::priority).thenComparing(BoundaryRule::ruleId);

  public BoundaryRule {
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    if (ruleId.isBlank()) {
      throw new IllegalArgumentException("ruleId must not be blank");
    }
    sourcePattern = Objects.requireNonNull(sourcePattern, "sourcePattern");
    targetPattern = Objects.requireNonNull(targetPattern, "targetPattern");
    action = Objects.requireNonNull(action, "action");
    enforcementLevel = Objects.requireNonNull(enforcementLevel, "enforcementLevel");
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  /**
   * Returns the condition used to classify violations raised by this rule.
   *
   * @return first condition, or {@code null} for unconditional rules
   */
  public RuleCondition leadingCondition() {
    return conditions.isEmpty() ? null : conditions.get(0);
  }

  /**
   * Copy of this rule with a different enabled flag.
   *
   * @param value new enabled flag
   * @return updated rule
   */
  public BoundaryRule withEnabled(boolean value) {
    return new BoundaryRule(
        ruleId, sourcePattern, targetPattern, action, enforcementLevel, conditions, value, priority);
  }
}
