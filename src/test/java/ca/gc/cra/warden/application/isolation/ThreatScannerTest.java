package ca.gc.cra.warden.application.isolation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.isolation.ActivityRecord;
import ca.gc.cra.warden.domain.isolation.DetectionPattern;
import ca.gc.cra.warden.domain.isolation.PatternType;
import ca.gc.cra.warden.domain.isolation.ThreatCategory;
import ca.gc.cra.warden.domain.isolation.ThreatDetectionRule;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.security.Severity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThreatScannerTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private static ActivityRecord access(String descriptor, AccessOperation operation, String target, boolean created) {
    return new ActivityRecord(NOW, "alpha", operation, target, descriptor, created);
  }

  private static ActivityRecord read(String descriptor) {
    return access(descriptor, AccessOperation.READ, "/srv/x", false);
  }

  private static List<String> ruleIds(List<ThreatMatch> matches) {
    return matches.stream().map(match -> match.rule().ruleId()).toList();
  }

  @Test
  void crossProjectAccessMatchesOnlyForeignProjects() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.1);

    List<ThreatMatch> foreign = scanner.scan(List.of(read("project_alpha:.->project_beta:data.csv")));
    List<ThreatMatch> own = scanner.scan(List.of(read("project_alpha:.->project_alpha:data.csv")));

    assertEquals(List.of("cross_project_file_access"), ruleIds(foreign));
    assertEquals("/srv/x", foreign.get(0).target());
    assertTrue(own.isEmpty());
  }

  @Test
  void frameworkDocumentationIsNotAThreat() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.1);

    assertEquals(List.of("framework_core_write_attempt"),
        ruleIds(scanner.scan(List.of(read("project_alpha:.->framework_core:core/engine.py")))));
    assertTrue(scanner.scan(List.of(read("project_alpha:.->framework_core:docs/guide.md"))).isEmpty());
  }

  @Test
  void confidenceThresholdIsExclusive() {
    ThreatScanner strict = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.9, () -> 0.1);

    assertTrue(strict.scan(List.of(read("project_alpha:.->project_beta:data.csv"))).isEmpty());
    assertEquals(1, strict.scan(List.of(read("project_alpha:.->framework_core:core.py"))).size());
  }

  @Test
  void rapidFileCreationNeedsMoreThanFiftyCreations() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.1);
    List<ActivityRecord> batch = new ArrayList<>();
    for (int i = 0; i < ThreatScanner.RAPID_CREATION_LIMIT; i++) {
      batch.add(access("project_alpha:.->project_alpha:f" + i, AccessOperation.WRITE, "/srv/f" + i, true));
    }
    assertTrue(scanner.scan(batch).isEmpty());

    batch.add(access("project_alpha:.->project_alpha:last", AccessOperation.WRITE, "/srv/last", true));
    List<ThreatMatch> matches = scanner.scan(batch);

    assertEquals(List.of("resource_exhaustion_attack"), ruleIds(matches));
    assertEquals(ThreatRuleCatalog.RAPID_FILE_CREATION, matches.get(0).pattern().pattern());
  }

  @Test
  void heapPressureMatchesFirstResourcePattern() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.95);

    List<ThreatMatch> matches = scanner.scan(List.of(read("project_alpha:.->project_alpha:a")));

    assertEquals(List.of("resource_exhaustion_attack"), ruleIds(matches));
    assertEquals("heap usage 95.0%", matches.get(0).evidence());
  }

  @Test
  void privilegedBinariesOnlyMatchExecutions() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.1);

    assertEquals(List.of("privileged_binary_execution"), ruleIds(scanner.scan(List.of(
        access("project_alpha:.->external:/usr/bin/sudo", AccessOperation.EXECUTE, "/usr/bin/sudo", false)))));
    assertTrue(scanner.scan(List.of(
        access("project_alpha:.->external:/usr/bin/sudo", AccessOperation.READ, "/usr/bin/sudo", false))).isEmpty());
  }

  @Test
  void emptyBatchNeverMatches() {
    ThreatScanner scanner = new ThreatScanner(ThreatRuleCatalog.defaults(), 0.0, () -> 1.0);

    assertTrue(scanner.scan(List.of()).isEmpty());
  }

  @Test
  void invalidPatternsAreRejectedUpFront() {
    ThreatDetectionRule broken = new ThreatDetectionRule("broken", "Broken", "Broken pattern",
        ThreatCategory.LATERAL_MOVEMENT,
        List.of(new DetectionPattern(PatternType.FILE_ACCESS, "([", Severity.LOW, 0.9)), List.of());

    assertThrows(IllegalArgumentException.class, () -> new ThreatScanner(List.of(broken), 0.5, () -> 0.1));
    assertThrows(IllegalArgumentException.class,
        () -> new ThreatScanner(ThreatRuleCatalog.defaults(), 1.5, () -> 0.1));
  }
}
