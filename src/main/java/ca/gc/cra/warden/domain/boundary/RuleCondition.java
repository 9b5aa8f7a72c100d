package ca.gc.cra.warden.domain.boundary;

import java.util.Locale;

/**
 * Closed set of predicates a {@link BoundaryRule} may require in addition to its glob patterns.
 *
 * <p>Each constant is interpreted by {@code RuleEvaluator}; adding a constant requires handling it there.</p>
 *
 * @since 0.1.0
 */
public enum RuleCondition {
  /** Always holds. */
  ALWAYS,
  /** The access writes, deletes or executes. */
  WRITE_OPERATION,
  /** The access only reads. */
  READ_OPERATION,
  /** The access creates or modifies a file carrying an execute bit or a known executable extension. */
  IS_EXECUTABLE,
  /** The active project differs from the project owning the target. */
  CROSSES_PROJECT_BOUNDARY,
  /** The raw target contains a {@code ..} segment. */
  PATH_TRAVERSAL,
  /** The target is a symbolic link resolving outside the boundary root. */
  SYMLINK_ESCAPE,
  /** The access originates from inside a project sandbox. */
  FROM_PROJECT_SANDBOX;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
