package ca.gc.cra.warden.application.path;

import java.util.regex.Pattern;

/**
 * Segment-level helpers treating both {@code /} and {@code \} as separators.
 *
 * @since 0.1.0
 */
final class PathSegments {
  private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]+");
  private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:[/\\\\]");

  private PathSegments() {}

  static String[] split(String path) {
    return SEPARATORS.split(path, -1);
  }

  static boolean hasParentSegment(String path) {
    return countParentSegments(path) > 0;
  }

  static int countParentSegments(String path) {
    int count = 0;
    for (String segment : split(path)) {
      if (segment.equals("..")) {
        count++;
      }
    }
    return count;
  }

  /**
   * Walks the segments and reports whether {@code ..} ever climbs above the starting directory.
   *
   * @param path path text
   * @return {@code true} when the walk goes above its start
   */
  static boolean climbsAboveStart(String path) {
    int depth = 0;
    for (String segment : split(path)) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        depth--;
        if (depth < 0) {
          return true;
        }
      } else {
        depth++;
      }
    }
    return false;
  }

  static boolean hasMixedSeparators(String path) {
    return path.indexOf('/') >= 0 && path.indexOf('\\') >= 0;
  }

  /**
   * Detects Windows drive letters, UNC prefixes and backslash-delimited parent segments.
   *
   * @param path path text
   * @return {@code true} when the path uses Windows traversal syntax
   */
  static boolean hasWindowsSyntax(String path) {
    if (path.startsWith("\\\\") || DRIVE_PREFIX.matcher(path).find()) {
      return true;
    }
    return path.contains("..\\") || path.contains("\\..");
  }

  /**
   * Returns the last meaningful segment, skipping empty, {@code .} and {@code ..} segments.
   *
   * @param path path text
   * @return last segment or an empty string
   */
  static String lastName(String path) {
    String[] segments = split(path);
    for (int i = segments.length - 1; i >= 0; i--) {
      String segment = segments[i];
      if (!segment.isEmpty() && !segment.equals(".") && !segment.equals("..")) {
        return segment;
      }
    }
    return "";
  }
}
