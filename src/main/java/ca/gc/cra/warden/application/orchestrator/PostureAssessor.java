package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.ComplianceStatus;
import ca.gc.cra.warden.domain.incident.SecurityPosture;
import ca.gc.cra.warden.domain.incident.SystemHealth;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns subsystem scores and incident counts into a {@link SecurityPosture} with recommendations.
 *
 * @since 0.1.0
 */
public final class PostureAssessor {
  static final double COMPLIANT_SCORE = 95.0;
  static final double INTEGRITY_FLOOR = 80.0;
  static final double SUBSYSTEM_FLOOR = 90.0;
  static final int THREAT_BACKLOG = 5;

  private final PostureAggregator aggregator;

  public PostureAssessor(PostureAggregator aggregator) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
  }

  /**
   * Assesses the posture.
   *
   * @param health subsystem scores
   * @param activeThreats open incidents
   * @param resolvedIncidents resolved incidents
   * @param at assessment time
   * @return posture
   */
  public SecurityPosture assess(SystemHealth health, int activeThreats, int resolvedIncidents, Instant at) {
    Objects.requireNonNull(health, "health");
    double overall = Math.max(0.0, Math.min(100.0, aggregator.aggregate(health)));
    return new SecurityPosture(
        overall,
        at,
        ComplianceStatus.fromScore(overall),
        activeThreats,
        resolvedIncidents,
        health,
        recommendations(overall, health, activeThreats));
  }

  static List<String> recommendations(double overall, SystemHealth health, int activeThreats) {
    List<String> recommendations = new ArrayList<>();
    if (overall < COMPLIANT_SCORE) {
      recommendations.add("Enhance overall security posture to achieve 95%+ compliance");
    }
    if (health.zeroTrust() < INTEGRITY_FLOOR) {
      recommendations.add("Increase path validation monitoring");
      recommendations.add("Enhance boundary enforcement policies");
    }
    if (activeThreats > THREAT_BACKLOG) {
      recommendations.add("Investigate active threats immediately");
      recommendations.add("Consider implementing additional isolation layers");
    } else if (activeThreats > 0) {
      recommendations.add("Address active security threats immediately");
    }
    if (health.pathProtection() < SUBSYSTEM_FLOOR) {
      recommendations.add("Review path traversal prevention rules");
    }
    if (health.boundaryEnforcement() < SUBSYSTEM_FLOOR) {
      recommendations.add("Strengthen file system boundary enforcement");
    }
    return recommendations;
  }
}
