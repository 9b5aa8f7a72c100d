package ca.gc.cra.warden.domain.incident;

import java.util.Locale;

/**
 * Qualitative bucket for an overall posture score.
 *
 * @since 0.1.0
 */
public enum ComplianceStatus {
  COMPLIANT,
  WARNING,
  VIOLATION,
  CRITICAL;

  /**
   * Buckets a score: at least 95 is compliant, at least 85 warning, at least 70 violation, otherwise critical.
   *
   * @param overallScore score in [0,100]
   * @return compliance bucket
   */
  public static ComplianceStatus fromScore(double overallScore) {
    if (overallScore >= 95.0) {
      return COMPLIANT;
    }
    if (overallScore >= 85.0) {
      return WARNING;
    }
    if (overallScore >= 70.0) {
      return VIOLATION;
    }
    return CRITICAL;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
