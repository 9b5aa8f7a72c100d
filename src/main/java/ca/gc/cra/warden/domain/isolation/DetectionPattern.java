package ca.gc.cra.warden.domain.isolation;

import ca.gc.cra.warden.domain.security.Severity;
import java.util.Objects;

/**
 * Single pattern of a threat detection rule.
 *
 * @param patternType activity stream the pattern applies to; never {@code null}
 * @param pattern regular expression or named signature; never {@code null}
 * @param severity severity raised on match; never {@code null}
 * @param confidence confidence in [0,1]
 * @since 0.1.0
 */
public record DetectionPattern(PatternType patternType, String pattern, Severity severity, double confidence) {
  public DetectionPattern {
    patternType = Objects.requireNonNull(patternType, "patternType");
    pattern = Objects.requireNonNull(pattern, "pattern");
    severity = Objects.requireNonNull(severity, "severity");
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0,1]");
    }
  }
}
