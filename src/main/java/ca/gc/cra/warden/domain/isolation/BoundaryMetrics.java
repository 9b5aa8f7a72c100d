package ca.gc.cra.warden.domain.isolation;

import java.time.Instant;

/**
 * Mutable per-project isolation counters.
 *
 * <p><strong>Thread-safety:</strong> All mutators and {@link #snapshot()} synchronize on this instance; counters
 * are touched from the security loop and from caller threads running the access gate.</p>
 *
 * @since 0.1.0
 */
public final class BoundaryMetrics {
  private double integrityScore = 100.0;
  private long breachAttempts;
  private long verificationFailures;
  private Instant lastVerification;

  /**
   * Records a failed check and lowers the integrity score by {@code penalty}.
   *
   * @param penalty score reduction, clamped at zero
   * @param at failure time
   * @return integrity score after the failure
   */
  public synchronized double recordFailure(double penalty, Instant at) {
    verificationFailures++;
    lastVerification = at;
    integrityScore = Math.max(0.0, integrityScore - penalty);
    return integrityScore;
  }

  /**
   * Records a passed check and restores {@code recovery} points up to 100.
   *
   * @param recovery score increase
   * @param at verification time
   * @return integrity score after the pass
   */
  public synchronized double recordPass(double recovery, Instant at) {
    lastVerification = at;
    integrityScore = Math.min(100.0, integrityScore + recovery);
    return integrityScore;
  }

  public synchronized long recordBreachAttempt() {
    return ++breachAttempts;
  }

  public synchronized double integrityScore() {
    return integrityScore;
  }

  public synchronized Snapshot snapshot() {
    return new Snapshot(integrityScore, breachAttempts, lastVerification, verificationFailures);
  }

  /**
   * Point-in-time copy of the counters.
   *
   * @param boundaryIntegrityScore integrity score in [0,100]
   * @param breachAttempts denied accesses
   * @param lastVerification last check time; may be {@code null}
   * @param verificationFailures failed checks
   */
  public record Snapshot(
      double boundaryIntegrityScore, long breachAttempts, Instant lastVerification, long verificationFailures) {}
}
