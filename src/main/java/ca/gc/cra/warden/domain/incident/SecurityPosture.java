package ca.gc.cra.warden.domain.incident;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated security health computed by each posture assessment.
 *
 * @param overallScore aggregate of the four subsystem scores, in [0,100]
 * @param lastAssessment assessment time; never {@code null}
 * @param complianceStatus bucket for {@code overallScore}; never {@code null}
 * @param activeThreats incidents neither contained nor resolved
 * @param resolvedIncidents incidents resolved by an operator
 * @param systemHealth per-subsystem scores; never {@code null}
 * @param recommendations operator guidance; never {@code null}
 * @since 0.1.0
 */
public record SecurityPosture(
    double overallScore,
    Instant lastAssessment,
    ComplianceStatus complianceStatus,
    int activeThreats,
    int resolvedIncidents,
    SystemHealth systemHealth,
    List<String> recommendations) {

  public SecurityPosture {
    lastAssessment = Objects.requireNonNull(lastAssessment, "lastAssessment");
    complianceStatus = Objects.requireNonNull(complianceStatus, "complianceStatus");
    systemHealth = Objects.requireNonNull(systemHealth, "systemHealth");
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
  }
}
