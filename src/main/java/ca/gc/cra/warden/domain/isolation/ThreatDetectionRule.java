package ca.gc.cra.warden.domain.isolation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Static threat detection rule evaluated against recent project activity.
 *
 * @param ruleId unique identifier; never {@code null}
 * @param name display name; never {@code null}
 * @param description rule description; never {@code null}
 * @param category threat category; never {@code null}
 * @param detectionPatterns patterns, any of which may match; never empty
 * @param responseActions actions sorted by ascending priority
 * @since 0.1.0
 */
public record ThreatDetectionRule(
    String ruleId,
    String name,
    String description,
    ThreatCategory category,
    List<DetectionPattern> detectionPatterns,
    List<ThreatResponse> responseActions) {

  public ThreatDetectionRule {
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    name = Objects.requireNonNull(name, "name");
    description = Objects.requireNonNull(description, "description");
    category = Objects.requireNonNull(category, "category");
    if (detectionPatterns == null || detectionPatterns.isEmpty()) {
      throw new IllegalArgumentException("rule " + ruleId + " requires at least one detection pattern");
    }
    detectionPatterns = List.copyOf(detectionPatterns);
    responseActions = responseActions == null
        ? List.of()
        : responseActions.stream().sorted(Comparator.comparingInt(ThreatResponse::priority)).toList();
  }
}
