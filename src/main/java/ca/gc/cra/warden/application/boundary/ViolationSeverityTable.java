package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.domain.boundary.BoundaryType;
import ca.gc.cra.warden.domain.boundary.RuleAction;
import ca.gc.cra.warden.domain.security.Severity;

/** Severity of a boundary violation keyed by action, boundary type and protected-target flag. */
final class ViolationSeverityTable {
  private ViolationSeverityTable() {}

  static Severity severityFor(RuleAction action, BoundaryType boundaryType, boolean protectedTarget) {
    if (action == RuleAction.QUARANTINE) {
      return Severity.CRITICAL;
    }
    if (action != RuleAction.DENY) {
      return Severity.LOW;
    }
    return switch (boundaryType) {
      case FRAMEWORK_CORE -> Severity.CRITICAL;
      case PROJECT_SANDBOX -> protectedTarget ? Severity.CRITICAL : Severity.HIGH;
      case SHARED_RESOURCE -> protectedTarget ? Severity.HIGH : Severity.MEDIUM;
      case QUARANTINE -> Severity.MEDIUM;
    };
  }
}
