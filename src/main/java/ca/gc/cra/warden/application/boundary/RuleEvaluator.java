package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.domain.boundary.BoundaryRule;
import ca.gc.cra.warden.domain.boundary.RuleCondition;
import ca.gc.cra.warden.domain.path.AccessOperation;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interprets boundary rules against a {@link RuleContext}.
 *
 * <p>Rules are tried in {@link BoundaryRule#EVALUATION_ORDER}; the first enabled rule whose source pattern,
 * target pattern and every condition hold is selected. Compiled globs are cached by pattern text.</p>
 *
 * @since 0.1.0
 */
public final class RuleEvaluator {
  private final Path home;
  private final ConcurrentMap<String, GlobPattern> patterns = new ConcurrentHashMap<>();

  /**
   * Creates an evaluator.
   *
   * @param home directory substituted for {@code ~} in patterns
   */
  public RuleEvaluator(Path home) {
    this.home = Objects.requireNonNull(home, "home");
  }

  /**
   * Selects the rule that governs an access.
   *
   * @param rules candidate rules in any order
   * @param context access facts
   * @return first matching enabled rule, or empty when none matches (default allow)
   */
  public Optional<BoundaryRule> select(List<BoundaryRule> rules, RuleContext context) {
    return rules.stream()
        .sorted(BoundaryRule.EVALUATION_ORDER)
        .filter(BoundaryRule::enabled)
        .filter(rule -> matches(rule, context))
        .findFirst();
  }

  /**
   * Tests one rule.
   *
   * @param rule rule to test
   * @param context access facts
   * @return {@code true} when both patterns and all conditions hold
   */
  public boolean matches(BoundaryRule rule, RuleContext context) {
    if (!pattern(rule.sourcePattern()).matches(context.sourcePath())) {
      return false;
    }
    if (!pattern(rule.targetPattern()).matches(context.targetPath())) {
      return false;
    }
    for (RuleCondition condition : rule.conditions()) {
      if (!holds(condition, context)) {
        return false;
      }
    }
    return true;
  }

  static boolean holds(RuleCondition condition, RuleContext context) {
    return switch (condition) {
      case ALWAYS -> true;
      case WRITE_OPERATION -> context.accessOperation().mutating();
      case READ_OPERATION -> context.accessOperation() == AccessOperation.READ;
      case IS_EXECUTABLE -> context.executable() && context.createsContent();
      case CROSSES_PROJECT_BOUNDARY -> context.activeProject() != null
          && context.targetOwner() != null
          && !context.activeProject().equals(context.targetOwner());
      case PATH_TRAVERSAL -> context.traversal();
      case SYMLINK_ESCAPE -> context.symlinkEscape();
      case FROM_PROJECT_SANDBOX -> context.activeProject() != null;
    };
  }

  private GlobPattern pattern(String glob) {
    return patterns.computeIfAbsent(glob, key -> GlobPattern.compile(key, home));
  }
}
