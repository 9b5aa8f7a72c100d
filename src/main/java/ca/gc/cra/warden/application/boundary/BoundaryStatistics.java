package ca.gc.cra.warden.application.boundary;

import java.util.Map;

/**
 * Point-in-time counters of the boundary engine.
 *
 * @param boundaryCount registered boundaries
 * @param totalViolations violations raised since start
 * @param blockedViolations violations whose artifact was removed or isolated
 * @param integrityViolations tamper detections since start
 * @param violationsByType counts keyed by violation type wire name
 * @param violationsByBoundary counts keyed by boundary id
 * @param uptimeMillis time since the engine was created
 * @since 0.1.0
 */
public record BoundaryStatistics(
    int boundaryCount,
    long totalViolations,
    long blockedViolations,
    long integrityViolations,
    Map<String, Long> violationsByType,
    Map<String, Long> violationsByBoundary,
    long uptimeMillis) {

  public BoundaryStatistics {
    violationsByType = violationsByType == null ? Map.of() : Map.copyOf(violationsByType);
    violationsByBoundary = violationsByBoundary == null ? Map.of() : Map.copyOf(violationsByBoundary);
  }
}
