package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.ActivityRecord;
import ca.gc.cra.warden.domain.isolation.DetectionPattern;
import ca.gc.cra.warden.domain.isolation.PatternType;
import ca.gc.cra.warden.domain.isolation.ThreatDetectionRule;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.logging.Logs;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.regex.Pattern;

/**
 * Evaluates threat detection rules against a batch of project activity.
 *
 * <p>Only patterns whose confidence is strictly above the acceptance threshold are considered. Each rule yields at
 * most one match per batch: its first matching pattern. Network activity is not observable here and never
 * matches.</p>
 *
 * @since 0.1.0
 */
public final class ThreatScanner {
  static final int RAPID_CREATION_LIMIT = 50;
  static final double HEAP_USAGE_LIMIT = 0.9;
  private static final int EVIDENCE_BYTES = 512;

  private final List<ThreatDetectionRule> rules;
  private final double confidenceThreshold;
  private final DoubleSupplier heapUsage;
  private final Map<String, Pattern> compiled = new HashMap<>();

  /**
   * Creates a scanner; regular-expression patterns are compiled eagerly.
   *
   * @param rules rules to evaluate
   * @param confidenceThreshold minimum confidence, exclusive
   * @param heapUsage supplier of the current heap usage ratio in [0,1]
   * @throws IllegalArgumentException when a pattern is not a valid regular expression
   */
  public ThreatScanner(List<ThreatDetectionRule> rules, double confidenceThreshold, DoubleSupplier heapUsage) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
      throw new IllegalArgumentException("confidenceThreshold must be within [0,1]");
    }
    this.confidenceThreshold = confidenceThreshold;
    this.heapUsage = Objects.requireNonNull(heapUsage, "heapUsage");
    for (ThreatDetectionRule rule : this.rules) {
      for (DetectionPattern pattern : rule.detectionPatterns()) {
        if (pattern.patternType() == PatternType.FILE_ACCESS
            || pattern.patternType() == PatternType.PROCESS_BEHAVIOR) {
          if (!isSignature(pattern.pattern())) {
            compiled.put(pattern.pattern(), Pattern.compile(pattern.pattern()));
          }
        }
      }
    }
  }

  /**
   * Heap usage of this JVM as used over max heap.
   *
   * @return supplier reading {@link Runtime} on each call
   */
  public static DoubleSupplier runtimeHeapUsage() {
    return () -> {
      Runtime runtime = Runtime.getRuntime();
      long used = runtime.totalMemory() - runtime.freeMemory();
      return (double) used / runtime.maxMemory();
    };
  }

  public List<ThreatDetectionRule> rules() {
    return rules;
  }

  public double confidenceThreshold() {
    return confidenceThreshold;
  }

  /**
   * Scans a batch of activity.
   *
   * @param batch activity recorded since the previous scan
   * @return one match per matching rule
   */
  public List<ThreatMatch> scan(List<ActivityRecord> batch) {
    List<ThreatMatch> matches = new ArrayList<>();
    if (batch.isEmpty()) {
      return matches;
    }
    for (ThreatDetectionRule rule : rules) {
      for (DetectionPattern pattern : rule.detectionPatterns()) {
        if (pattern.confidence() <= confidenceThreshold) {
          continue;
        }
        Optional<ThreatMatch> match = evaluate(rule, pattern, batch);
        if (match.isPresent()) {
          matches.add(match.get());
          break;
        }
      }
    }
    return matches;
  }

  private Optional<ThreatMatch> evaluate(
      ThreatDetectionRule rule, DetectionPattern pattern, List<ActivityRecord> batch) {
    if (isSignature(pattern.pattern())) {
      return signature(rule, pattern, batch);
    }
    return switch (pattern.patternType()) {
      case FILE_ACCESS -> firstMatch(rule, pattern, batch, false);
      case PROCESS_BEHAVIOR -> firstMatch(rule, pattern, batch, true);
      case NETWORK_ACTIVITY, SYSTEM_CALL -> Optional.empty();
    };
  }

  private Optional<ThreatMatch> firstMatch(
      ThreatDetectionRule rule, DetectionPattern pattern, List<ActivityRecord> batch, boolean executionsOnly) {
    Pattern regex = compiled.get(pattern.pattern());
    for (ActivityRecord record : batch) {
      if (executionsOnly && record.operation() != AccessOperation.EXECUTE) {
        continue;
      }
      String subject = executionsOnly ? record.targetPath() : record.descriptor();
      if (regex.matcher(subject).matches()) {
        return Optional.of(new ThreatMatch(rule, pattern,
            Logs.truncate(record.operation().wireName() + " " + subject, EVIDENCE_BYTES), record.targetPath()));
      }
    }
    return Optional.empty();
  }

  private Optional<ThreatMatch> signature(
      ThreatDetectionRule rule, DetectionPattern pattern, List<ActivityRecord> batch) {
    if (ThreatRuleCatalog.RAPID_FILE_CREATION.equals(pattern.pattern())) {
      long created = batch.stream().filter(ActivityRecord::created).count();
      if (created > RAPID_CREATION_LIMIT) {
        return Optional.of(new ThreatMatch(rule, pattern, created + " file creations since last scan", null));
      }
      return Optional.empty();
    }
    double usage = heapUsage.getAsDouble();
    if (usage > HEAP_USAGE_LIMIT) {
      return Optional.of(new ThreatMatch(rule, pattern,
          String.format(Locale.ROOT, "heap usage %.1f%%", usage * 100.0), null));
    }
    return Optional.empty();
  }

  private static boolean isSignature(String pattern) {
    return ThreatRuleCatalog.RAPID_FILE_CREATION.equals(pattern)
        || ThreatRuleCatalog.EXCESSIVE_MEMORY_ALLOCATION.equals(pattern);
  }
}
