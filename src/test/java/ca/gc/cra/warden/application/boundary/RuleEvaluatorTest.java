package ca.gc.cra.warden.application.boundary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.boundary.BoundaryRule;
import ca.gc.cra.warden.domain.boundary.EnforcementLevel;
import ca.gc.cra.warden.domain.boundary.FileOperation;
import ca.gc.cra.warden.domain.boundary.RuleAction;
import ca.gc.cra.warden.domain.boundary.RuleCondition;
import ca.gc.cra.warden.domain.path.AccessOperation;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RuleEvaluatorTest {
  private static final Path ROOT = Path.of("/srv/sandbox/alpha");
  private final RuleEvaluator evaluator = new RuleEvaluator(Path.of("/home/agent"));

  private static RuleContext write(Path target, String active, String owner) {
    return new RuleContext(null, target, AccessOperation.WRITE, FileOperation.CREATE, active, owner,
        false, false, false);
  }

  private static BoundaryRule rule(String id, RuleAction action, int priority, RuleCondition... conditions) {
    return new BoundaryRule(id, "*", ROOT + "/**", action, EnforcementLevel.BLOCKING, List.of(conditions), true,
        priority);
  }

  @Test
  void lowestPriorityWinsThenRuleId() {
    List<BoundaryRule> rules = List.of(
        rule("zeta", RuleAction.AUDIT, 5),
        rule("beta", RuleAction.DENY, 5),
        rule("alpha", RuleAction.QUARANTINE, 5),
        rule("late", RuleAction.ALLOW, 10));

    Optional<BoundaryRule> selected = evaluator.select(rules, write(ROOT.resolve("a.txt"), null, "alpha"));

    assertEquals("alpha", selected.orElseThrow().ruleId());
  }

  @Test
  void disabledRulesNeverMatch() {
    List<BoundaryRule> rules = List.of(
        rule("deny", RuleAction.DENY, 1).withEnabled(false),
        rule("audit", RuleAction.AUDIT, 100));

    assertEquals("audit", evaluator.select(rules, write(ROOT.resolve("a.txt"), null, "alpha"))
        .orElseThrow().ruleId());
  }

  @Test
  void noMatchMeansNoRule() {
    List<BoundaryRule> rules = List.of(rule("deny", RuleAction.DENY, 1));

    assertTrue(evaluator.select(rules, write(Path.of("/elsewhere/a.txt"), null, null)).isEmpty());
  }

  @Test
  void crossProjectConditionNeedsBothProjectsAndADifference() {
    assertTrue(RuleEvaluator.holds(RuleCondition.CROSSES_PROJECT_BOUNDARY, write(ROOT, "beta", "alpha")));
    assertFalse(RuleEvaluator.holds(RuleCondition.CROSSES_PROJECT_BOUNDARY, write(ROOT, "alpha", "alpha")));
    assertFalse(RuleEvaluator.holds(RuleCondition.CROSSES_PROJECT_BOUNDARY, write(ROOT, null, "alpha")));
    assertFalse(RuleEvaluator.holds(RuleCondition.CROSSES_PROJECT_BOUNDARY, write(ROOT, "beta", null)));
  }

  @Test
  void executableConditionOnlyHoldsWhenContentIsCreated() {
    RuleContext created = new RuleContext(null, ROOT.resolve("run.sh"), AccessOperation.WRITE,
        FileOperation.CREATE, null, "alpha", true, false, false);
    RuleContext read = new RuleContext(null, ROOT.resolve("run.sh"), AccessOperation.READ,
        FileOperation.READ, null, "alpha", true, false, false);

    assertTrue(RuleEvaluator.holds(RuleCondition.IS_EXECUTABLE, created));
    assertFalse(RuleEvaluator.holds(RuleCondition.IS_EXECUTABLE, read));
  }

  @Test
  void allConditionsMustHold() {
    BoundaryRule frameworkWrite = rule("fw", RuleAction.DENY, 1,
        RuleCondition.FROM_PROJECT_SANDBOX, RuleCondition.WRITE_OPERATION);
    RuleContext readFromProject = new RuleContext(null, ROOT.resolve("a.txt"), AccessOperation.READ,
        FileOperation.READ, "beta", null, false, false, false);

    assertTrue(evaluator.matches(frameworkWrite, write(ROOT.resolve("a.txt"), "beta", null)));
    assertFalse(evaluator.matches(frameworkWrite, readFromProject));
    assertFalse(evaluator.matches(frameworkWrite, write(ROOT.resolve("a.txt"), null, null)));
  }
}
