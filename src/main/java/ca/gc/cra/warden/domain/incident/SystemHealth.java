package ca.gc.cra.warden.domain.incident;

import java.util.List;

/**
 * Health scores reported by each part of the security core, each in [0,100].
 *
 * @param pathProtection path validation health
 * @param boundaryEnforcement boundary engine health
 * @param zeroTrust mean project isolation integrity
 * @param incidentResponse orchestrator response health
 * @since 0.1.0
 */
public record SystemHealth(
    double pathProtection, double boundaryEnforcement, double zeroTrust, double incidentResponse) {

  public SystemHealth {
    requireScore("pathProtection", pathProtection);
    requireScore("boundaryEnforcement", boundaryEnforcement);
    requireScore("zeroTrust", zeroTrust);
    requireScore("incidentResponse", incidentResponse);
  }

  /**
   * The four scores in declaration order.
   *
   * @return immutable list of four scores
   */
  public List<Double> scores() {
    return List.of(pathProtection, boundaryEnforcement, zeroTrust, incidentResponse);
  }

  private static void requireScore(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
      throw new IllegalArgumentException(name + " must be within [0,100] (was " + value + ")");
    }
  }
}
