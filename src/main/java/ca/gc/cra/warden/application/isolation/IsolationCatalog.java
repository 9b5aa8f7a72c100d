package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.BoundaryMetrics;
import ca.gc.cra.warden.domain.isolation.CheckFrequency;
import ca.gc.cra.warden.domain.isolation.CheckKind;
import ca.gc.cra.warden.domain.isolation.EnforcementMechanism;
import ca.gc.cra.warden.domain.isolation.FailureAction;
import ca.gc.cra.warden.domain.isolation.IsolationBoundaryType;
import ca.gc.cra.warden.domain.isolation.MechanismStrength;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.domain.isolation.VerificationCheck;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Enforcement mechanisms and verification checks selected by security level.
 *
 * <p>Higher levels add mechanisms, shorten the integrity period and escalate privilege-escalation failures from an
 * alert to a quarantine.</p>
 *
 * @since 0.1.0
 */
public final class IsolationCatalog {
  static final long FAILURE_WINDOW_MILLIS = 10 * 60_000L;
  static final int INTEGRITY_FAILURE_THRESHOLD = 3;
  static final long CONFIGURATION_PERIOD_MILLIS = 5 * 60_000L;

  private IsolationCatalog() {}

  /**
   * Builds the isolation boundary of a project.
   *
   * @param boundaryId boundary identifier
   * @param projectId project identifier
   * @param projectRoot validated project root
   * @param level requested security level
   * @param createdAt creation time
   * @return boundary with fresh metrics
   */
  public static ProjectIsolationBoundary build(
      String boundaryId, String projectId, Path projectRoot, SecurityLevel level, Instant createdAt) {
    return new ProjectIsolationBoundary(
        boundaryId,
        projectId,
        projectRoot,
        level,
        level == SecurityLevel.STANDARD ? IsolationBoundaryType.LOGICAL : IsolationBoundaryType.PHYSICAL,
        mechanisms(level),
        checks(level),
        new BoundaryMetrics(),
        createdAt);
  }

  static List<EnforcementMechanism> mechanisms(SecurityLevel level) {
    List<EnforcementMechanism> mechanisms = new ArrayList<>();
    mechanisms.add(new EnforcementMechanism("filesystem_sandbox", MechanismStrength.STRONG, true, true));
    mechanisms.add(new EnforcementMechanism("process_isolation", MechanismStrength.MEDIUM, true, false));
    if (level != SecurityLevel.STANDARD) {
      mechanisms.add(new EnforcementMechanism("memory_isolation", MechanismStrength.MEDIUM, true, true));
    }
    if (level == SecurityLevel.MAXIMUM) {
      mechanisms.add(new EnforcementMechanism("network_segmentation", MechanismStrength.CRYPTOGRAPHIC, true, true));
    }
    return mechanisms;
  }

  static List<VerificationCheck> checks(SecurityLevel level) {
    long integrityPeriod = switch (level) {
      case STANDARD -> 60_000L;
      case ENHANCED -> 30_000L;
      case MAXIMUM -> 10_000L;
    };
    boolean standard = level == SecurityLevel.STANDARD;
    return List.of(
        new VerificationCheck(
            "filesystem_integrity",
            CheckKind.FILESYSTEM_INTEGRITY,
            CheckFrequency.PERIODIC,
            integrityPeriod,
            FailureAction.QUARANTINE,
            INTEGRITY_FAILURE_THRESHOLD,
            FAILURE_WINDOW_MILLIS,
            List.of("Compare project tree against last baseline", "Remove forbidden entries",
                "Quarantine project on repeated failure")),
        new VerificationCheck(
            "cross_project_access",
            CheckKind.CROSS_PROJECT_ACCESS,
            CheckFrequency.CONTINUOUS,
            0L,
            FailureAction.BLOCK,
            1,
            FAILURE_WINDOW_MILLIS,
            List.of("Block the access", "Record breach attempt")),
        new VerificationCheck(
            "privilege_escalation",
            CheckKind.PRIVILEGE_ESCALATION,
            CheckFrequency.ON_ACCESS,
            0L,
            standard ? FailureAction.ALERT : FailureAction.QUARANTINE,
            1,
            FAILURE_WINDOW_MILLIS,
            List.of("Terminate escalation attempt", "Alert security team")),
        new VerificationCheck(
            "configuration_integrity",
            CheckKind.CONFIGURATION_INTEGRITY,
            standard ? CheckFrequency.PERIODIC : CheckFrequency.ON_CHANGE,
            standard ? CONFIGURATION_PERIOD_MILLIS : 0L,
            FailureAction.ALERT,
            1,
            FAILURE_WINDOW_MILLIS,
            List.of("Restore project configuration from backup", "Review recent modifications")));
  }
}
