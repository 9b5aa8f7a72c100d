package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.DetectionPattern;
import ca.gc.cra.warden.domain.isolation.PatternType;
import ca.gc.cra.warden.domain.isolation.ThreatCategory;
import ca.gc.cra.warden.domain.isolation.ThreatDetectionRule;
import ca.gc.cra.warden.domain.isolation.ThreatResponse;
import ca.gc.cra.warden.domain.isolation.ThreatResponseKind;
import ca.gc.cra.warden.domain.security.Severity;
import java.util.List;

/**
 * Built-in threat detection rules.
 *
 * <p>File-access patterns are regular expressions over activity descriptors of the form
 * {@code sourceScope:path->targetScope:path}, where a scope is a boundary id such as {@code project_alpha} or
 * {@code framework_core}, or {@code external}.</p>
 *
 * @since 0.1.0
 */
public final class ThreatRuleCatalog {
  /** System-call signature: more than {@link ThreatScanner#RAPID_CREATION_LIMIT} creations in one scan. */
  public static final String RAPID_FILE_CREATION = "rapid_file_creation";
  /** System-call signature: heap usage above {@link ThreatScanner#HEAP_USAGE_LIMIT}. */
  public static final String EXCESSIVE_MEMORY_ALLOCATION = "excessive_memory_allocation";

  private ThreatRuleCatalog() {}

  public static List<ThreatDetectionRule> defaults() {
    return List.of(
        new ThreatDetectionRule(
            "cross_project_file_access",
            "Cross-project file access",
            "A project touched files owned by another project",
            ThreatCategory.LATERAL_MOVEMENT,
            List.of(new DetectionPattern(PatternType.FILE_ACCESS,
                "^project_([^:]+):.*->project_(?!\\1:)[^:]+:.*$", Severity.HIGH, 0.9)),
            List.of(
                new ThreatResponse(ThreatResponseKind.BLOCK_ACCESS, 1, true, false),
                new ThreatResponse(ThreatResponseKind.QUARANTINE_PROJECT, 2, false, true))),
        new ThreatDetectionRule(
            "framework_core_write_attempt",
            "Framework core access",
            "A project touched framework files outside the shared documentation",
            ThreatCategory.PRIVILEGE_ESCALATION,
            List.of(new DetectionPattern(PatternType.FILE_ACCESS,
                "^project_[^:]+:.*->framework_core:(?!docs/|examples/).*$", Severity.CRITICAL, 0.95)),
            List.of(
                new ThreatResponse(ThreatResponseKind.IMMEDIATE_BLOCK, 1, true, false),
                new ThreatResponse(ThreatResponseKind.ALERT_SECURITY_TEAM, 1, true, false))),
        new ThreatDetectionRule(
            "configuration_tampering",
            "Configuration tampering",
            "Isolation configuration files were accessed by project activity",
            ThreatCategory.CONFIGURATION_TAMPERING,
            List.of(new DetectionPattern(PatternType.FILE_ACCESS,
                "^.*->[^:]+:(?:.*/)?(?:\\.warden/config/.*|\\.warden-project\\.json)$", Severity.HIGH, 0.85)),
            List.of(
                new ThreatResponse(ThreatResponseKind.BLOCK_MODIFICATION, 1, true, false),
                new ThreatResponse(ThreatResponseKind.BACKUP_CONFIGURATION, 2, true, false))),
        new ThreatDetectionRule(
            "resource_exhaustion_attack",
            "Resource exhaustion",
            "Project activity is exhausting memory or creating files at a high rate",
            ThreatCategory.RESOURCE_EXHAUSTION,
            List.of(
                new DetectionPattern(PatternType.SYSTEM_CALL, EXCESSIVE_MEMORY_ALLOCATION, Severity.MEDIUM, 0.7),
                new DetectionPattern(PatternType.SYSTEM_CALL, RAPID_FILE_CREATION, Severity.MEDIUM, 0.6)),
            List.of(
                new ThreatResponse(ThreatResponseKind.RATE_LIMIT, 1, true, false),
                new ThreatResponse(ThreatResponseKind.RESOURCE_MONITORING, 2, true, false))),
        new ThreatDetectionRule(
            "privileged_binary_execution",
            "Privileged binary execution",
            "A project executed a binary used to gain elevated privileges",
            ThreatCategory.PRIVILEGE_ESCALATION,
            List.of(new DetectionPattern(PatternType.PROCESS_BEHAVIOR,
                "(?i)^(?:.*/)?(?:sudo|su|doas|pkexec)(?:\\s.*)?$", Severity.HIGH, 0.8)),
            List.of(
                new ThreatResponse(ThreatResponseKind.BLOCK_ACCESS, 1, true, false),
                new ThreatResponse(ThreatResponseKind.ALERT_SECURITY_TEAM, 2, true, false))));
  }
}
