package ca.gc.cra.warden.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers and text supplied to Warden.
 * <p><strong>Why:</strong> Project identifiers become directory names, metric keys and audit fields; they must be
 * short, printable and free of path syntax before any subsystem uses them.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern PROJECT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a project identifier.
   *
   * @param projectId candidate identifier
   * @return the identifier, trimmed
   * @throws NullPointerException if {@code projectId} is {@code null}
   * @throws IllegalArgumentException unless the identifier is 1 to 64 characters of {@code [A-Za-z0-9._-]} and
   *         not a dot segment
   */
  public static String requireProjectId(String projectId) {
    String sanitized = requireNonBlank("projectId", projectId);
    if (!PROJECT_ID_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message("projectId",
          "must be 1-64 letters, digits, dots, underscores or hyphens"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message("projectId", "must not be a dot segment"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
