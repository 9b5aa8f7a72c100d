package ca.gc.cra.warden.application.path;

/**
 * Produces a filename that is safe to create inside a project sandbox.
 *
 * <p>Illegal characters ({@code <>:"|?*}, path separators and control characters) become {@code _}, whitespace
 * becomes {@code _}, {@code ..} tokens and leading dots are stripped, and the result is capped at 255
 * characters. An empty result falls back to {@code safe_file}.</p>
 *
 * @since 0.1.0
 */
public final class FilenameSanitizer {
  static final String FALLBACK = "safe_file";
  static final int MAX_LENGTH = 255;

  private FilenameSanitizer() {}

  /**
   * Sanitizes a single filename.
   *
   * @param name candidate filename; {@code null} yields the fallback
   * @return sanitized filename
   */
  public static String sanitize(String name) {
    if (name == null) {
      return FALLBACK;
    }
    String withoutTraversal = name.replace("..", "");
    StringBuilder sb = new StringBuilder(withoutTraversal.length());
    for (int i = 0; i < withoutTraversal.length(); i++) {
      char c = withoutTraversal.charAt(i);
      if (Character.isISOControl(c) || Character.isWhitespace(c) || "<>:\"|?*/\\".indexOf(c) >= 0) {
        sb.append('_');
      } else {
        sb.append(c);
      }
    }
    int start = 0;
    while (start < sb.length() && sb.charAt(start) == '.') {
      start++;
    }
    String result = sb.substring(start);
    if (result.length() > MAX_LENGTH) {
      result = result.substring(0, MAX_LENGTH);
    }
    return result.isEmpty() ? FALLBACK : result;
  }
}
