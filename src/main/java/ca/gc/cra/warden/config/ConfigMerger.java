package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.boundary.EnforcementMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and explicit overrides while enforcing precedence and invariants.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private static final String[] INTERVAL_KEYS = {
    "integrityCheckIntervalMs",
    "watchPollIntervalMs",
    "postureIntervalMs",
    "threatScanIntervalMs",
    "eventDrainIntervalMs"
  };

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; YAML &gt; defaults.
   *
   * @param profile active deployment profile
   * @param yaml optional YAML-derived settings for the profile
   * @param overrides explicit key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String profile,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overrideCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overrideCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key + " (profile " + profile + ")");
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    for (String key : INTERVAL_KEYS) {
      String raw = trim(effective.get(key));
      if (raw.isEmpty()) {
        continue;
      }
      long value;
      try {
        value = Long.parseLong(raw);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
      }
      if (value <= 0) {
        throw new IllegalArgumentException(key + " must be positive (was " + raw + ")");
      }
    }

    String threshold = trim(effective.get("threatConfidenceThreshold"));
    if (!threshold.isEmpty()) {
      double value;
      try {
        value = Double.parseDouble(threshold);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("threatConfidenceThreshold must be a number (was " + threshold + ")", ex);
      }
      if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
        throw new IllegalArgumentException("threatConfidenceThreshold must be between 0.0 and 1.0");
      }
    }

    String mode = trim(effective.get("enforcementMode"));
    if (!mode.isEmpty()) {
      EnforcementMode.parse(mode);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
