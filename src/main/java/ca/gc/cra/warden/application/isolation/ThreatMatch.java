package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.DetectionPattern;
import ca.gc.cra.warden.domain.isolation.ThreatDetectionRule;
import java.util.Objects;

/**
 * A threat rule that matched a project's recent activity.
 *
 * @param rule matched rule
 * @param pattern first pattern of the rule that matched
 * @param evidence human-readable description of the matching activity
 * @param target path of the matching access; {@code null} for aggregate signatures
 * @since 0.1.0
 */
public record ThreatMatch(ThreatDetectionRule rule, DetectionPattern pattern, String evidence, String target) {
  public ThreatMatch {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(pattern, "pattern");
    evidence = evidence == null ? "" : evidence;
  }
}
