package ca.gc.cra.warden.domain.boundary;

import java.util.Locale;

/**
 * Classification of a {@link BoundaryViolation}.
 *
 * @since 0.1.0
 */
public enum ViolationType {
  UNAUTHORIZED_ACCESS,
  PATH_TRAVERSAL,
  PRIVILEGE_ESCALATION,
  CROSS_BOUNDARY_WRITE,
  SYMLINK_ATTACK,
  EXECUTABLE_CREATION,
  INTEGRITY_VIOLATION;

  /**
   * Derives the violation type from the conditions of the rule that matched.
   *
   * @param condition leading condition of the matched rule; may be {@code null}
   * @return violation type
   */
  public static ViolationType fromCondition(RuleCondition condition) {
    if (condition == null) {
      return UNAUTHORIZED_ACCESS;
    }
    return switch (condition) {
      case CROSSES_PROJECT_BOUNDARY -> CROSS_BOUNDARY_WRITE;
      case IS_EXECUTABLE -> EXECUTABLE_CREATION;
      case SYMLINK_ESCAPE -> SYMLINK_ATTACK;
      case PATH_TRAVERSAL -> PATH_TRAVERSAL;
      case ALWAYS, WRITE_OPERATION, READ_OPERATION, FROM_PROJECT_SANDBOX -> UNAUTHORIZED_ACCESS;
    };
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
