package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.SystemHealth;

/**
 * Combines the four subsystem health scores into the overall posture score.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PostureAggregator {
  /**
   * Aggregates the subsystem scores.
   *
   * @param health subsystem scores
   * @return overall score in [0,100]
   */
  double aggregate(SystemHealth health);

  /** Unweighted mean of the four scores. */
  PostureAggregator MEAN = health -> health.scores().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
}
