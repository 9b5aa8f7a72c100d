package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.domain.boundary.BoundaryRule;
import ca.gc.cra.warden.domain.boundary.BoundaryType;
import ca.gc.cra.warden.domain.boundary.EnforcementLevel;
import ca.gc.cra.warden.domain.boundary.FileSystemBoundary;
import ca.gc.cra.warden.domain.boundary.RuleAction;
import ca.gc.cra.warden.domain.boundary.RuleCondition;
import java.nio.file.Path;
import java.util.List;

/**
 * Seeded boundary definitions and their rule sets.
 *
 * @since 0.1.0
 */
public final class BoundaryCatalog {
  public static final String FRAMEWORK_CORE_ID = "framework_core";
  public static final String QUARANTINE_ID = "quarantine";
  /** Entries that must never exist inside a project root. */
  public static final List<String> FORBIDDEN_PROJECT_ENTRIES =
      List.of(".warden", ".warden-framework", "node_modules/.warden");

  private static final String ANY = "*";

  private BoundaryCatalog() {}

  public static String sandboxId(String projectId) {
    return "project_" + projectId;
  }

  public static String sharedId(String resourceId) {
    return "shared_" + resourceId;
  }

  /**
   * Framework core: projects may not write into it and executables created there are quarantined.
   *
   * @param frameworkRoot framework installation root
   * @param monitored whether a directory watch is installed
   * @return boundary
   */
  public static FileSystemBoundary frameworkCore(Path frameworkRoot, boolean monitored) {
    Path root = frameworkRoot.toAbsolutePath().normalize();
    String target = glob(root);
    return new FileSystemBoundary(
        FRAMEWORK_CORE_ID,
        BoundaryType.FRAMEWORK_CORE,
        root,
        List.of(root.resolve("docs"), root.resolve("examples")),
        List.of(),
        List.of(
            rule("fw_deny_project_write", target, RuleAction.DENY, EnforcementLevel.BLOCKING, 1,
                RuleCondition.FROM_PROJECT_SANDBOX, RuleCondition.WRITE_OPERATION),
            rule("fw_prevent_executable_creation", target, RuleAction.QUARANTINE, EnforcementLevel.QUARANTINE, 2,
                RuleCondition.IS_EXECUTABLE),
            rule("fw_audit_default", target, RuleAction.AUDIT, EnforcementLevel.ADVISORY, 100)),
        EnforcementLevel.BLOCKING,
        monitored,
        null);
  }

  /**
   * Quarantine area; audited only so enforcement never acts inside it.
   *
   * @param quarantineDir quarantine directory
   * @return boundary
   */
  public static FileSystemBoundary quarantine(Path quarantineDir) {
    Path root = quarantineDir.toAbsolutePath().normalize();
    return new FileSystemBoundary(
        QUARANTINE_ID,
        BoundaryType.QUARANTINE,
        root,
        List.of(),
        List.of(),
        List.of(rule("quarantine_audit_default", glob(root), RuleAction.AUDIT, EnforcementLevel.ADVISORY, 100)),
        EnforcementLevel.QUARANTINE,
        true,
        null);
  }

  /**
   * Project sandbox: denies cross-project access, escaping symlinks and traversal; quarantines executables.
   *
   * @param projectId owning project
   * @param projectRoot project root
   * @return boundary
   */
  public static FileSystemBoundary projectSandbox(String projectId, Path projectRoot) {
    Path root = projectRoot.toAbsolutePath().normalize();
    String target = glob(root);
    return new FileSystemBoundary(
        sandboxId(projectId),
        BoundaryType.PROJECT_SANDBOX,
        root,
        List.of(root),
        FORBIDDEN_PROJECT_ENTRIES.stream().map(root::resolve).toList(),
        List.of(
            rule("proj_deny_cross_access", target, RuleAction.DENY, EnforcementLevel.BLOCKING, 1,
                RuleCondition.CROSSES_PROJECT_BOUNDARY),
            rule("proj_prevent_symlink", target, RuleAction.DENY, EnforcementLevel.BLOCKING, 2,
                RuleCondition.SYMLINK_ESCAPE),
            rule("proj_prevent_traversal", target, RuleAction.DENY, EnforcementLevel.BLOCKING, 3,
                RuleCondition.PATH_TRAVERSAL),
            rule("proj_quarantine_executable", target, RuleAction.QUARANTINE, EnforcementLevel.QUARANTINE, 5,
                RuleCondition.IS_EXECUTABLE),
            rule("proj_audit_default", target, RuleAction.AUDIT, EnforcementLevel.ADVISORY, 100)),
        EnforcementLevel.BLOCKING,
        true,
        projectId);
  }

  /**
   * Shared resource: readable by projects, written only from outside project sandboxes.
   *
   * @param resourceId resource identifier
   * @param resourceRoot resource root
   * @return boundary
   */
  public static FileSystemBoundary sharedResource(String resourceId, Path resourceRoot) {
    Path root = resourceRoot.toAbsolutePath().normalize();
    String target = glob(root);
    return new FileSystemBoundary(
        sharedId(resourceId),
        BoundaryType.SHARED_RESOURCE,
        root,
        List.of(root),
        List.of(),
        List.of(
            rule("shared_deny_project_write", target, RuleAction.DENY, EnforcementLevel.BLOCKING, 1,
                RuleCondition.FROM_PROJECT_SANDBOX, RuleCondition.WRITE_OPERATION),
            rule("shared_audit_default", target, RuleAction.AUDIT, EnforcementLevel.ADVISORY, 100)),
        EnforcementLevel.BLOCKING,
        true,
        null);
  }

  private static BoundaryRule rule(
      String id, String target, RuleAction action, EnforcementLevel level, int priority,
      RuleCondition... conditions) {
    return new BoundaryRule(id, ANY, target, action, level, List.of(conditions), true, priority);
  }

  private static String glob(Path root) {
    return root.toString().replace('\\', '/') + "/**";
  }
}
