package ca.gc.cra.warden.application.boundary;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Precompiled glob used by boundary rules.
 *
 * <p>A lone {@code *} matches anything, including an absent source. {@code **} crosses separators while
 * {@code *} and {@code ?} stay within one segment. A trailing {@code /**} also matches the directory itself, and a
 * leading {@code ~} expands to the home directory given at compile time.</p>
 *
 * @since 0.1.0
 */
public final class GlobPattern {
  private static final String MATCH_ALL = "*";

  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob, Pattern regex) {
    this.glob = glob;
    this.regex = regex;
  }

  /**
   * Compiles a glob.
   *
   * @param glob pattern text
   * @param home directory substituted for a leading {@code ~}
   * @return compiled pattern
   */
  public static GlobPattern compile(String glob, Path home) {
    Objects.requireNonNull(glob, "glob");
    if (glob.equals(MATCH_ALL)) {
      return new GlobPattern(glob, null);
    }
    String expanded = glob;
    if (expanded.startsWith("~") && home != null) {
      expanded = home.toAbsolutePath().normalize() + expanded.substring(1);
    }
    expanded = expanded.replace('\\', '/');
    return new GlobPattern(glob, Pattern.compile(toRegex(expanded)));
  }

  public String glob() {
    return glob;
  }

  /**
   * Matches a path.
   *
   * @param path absolute path; {@code null} only matches {@code *}
   * @return {@code true} on a match
   */
  public boolean matches(Path path) {
    if (regex == null) {
      return true;
    }
    if (path == null) {
      return false;
    }
    return regex.matcher(path.toString().replace('\\', '/')).matches();
  }

  private static String toRegex(String glob) {
    StringBuilder sb = new StringBuilder(glob.length() * 2);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (c == '*') {
        boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
        if (doubleStar) {
          boolean trailing = i + 2 == glob.length();
          boolean slashAfter = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
          boolean slashBefore = sb.length() > 0 && glob.charAt(i - 1) == '/';
          if (trailing && slashBefore) {
            // "dir/**" also matches "dir"
            sb.setLength(sb.length() - 1);
            sb.append("(?:/.*)?");
            i += 2;
          } else if (slashAfter) {
            sb.append("(?:.*/)?");
            i += 3;
          } else {
            sb.append(".*");
            i += 2;
          }
          continue;
        }
        sb.append("[^/]*");
      } else if (c == '?') {
        sb.append("[^/]");
      } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
        sb.append('\\').append(c);
      } else {
        sb.append(c);
      }
      i++;
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return glob;
  }
}
