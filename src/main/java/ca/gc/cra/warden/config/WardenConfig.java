package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.boundary.EnforcementMode;
import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Paths;
import ca.gc.cra.warden.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable runtime configuration for the security core.
 * <p><strong>Why:</strong> Collects every root, interval and threshold in one validated value so the composition
 * root can wire subsystems without re-parsing.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param frameworkRoot framework installation root; always protected
 * @param wardenHome Warden state directory; always protected
 * @param sandboxRoot parent of project sandboxes; must lie outside every protected path
 * @param quarantineDir destination of quarantined artifacts
 * @param auditLog newline-delimited JSON audit file
 * @param forensicsDir forensic snapshot directory
 * @param evidenceDir evidence bundle directory
 * @param backupDir project backup directory
 * @param protectedPaths additional protected roots (system directories, credential stores)
 * @param integrityCheckIntervalMillis integrity check period
 * @param watchPollIntervalMillis watcher poll period
 * @param watchStableMillis quiet time before a change is reported
 * @param postureIntervalMillis posture assessment period
 * @param threatScanIntervalMillis threat scan period
 * @param eventDrainIntervalMillis event drain period
 * @param eventQueueCapacity capacity of the event channel
 * @param enforcementMode whether violations act on the filesystem
 * @param threatConfidenceThreshold confidence a threat pattern must exceed, within {@code [0,1]}
 * @param traversalHistoryLimit capacity of the traversal attempt ring
 * @param recentLogCapacity log lines retained for evidence bundles
 * @param verbose whether to raise logging to DEBUG
 * @since 0.1.0
 */
public record WardenConfig(
    Path frameworkRoot,
    Path wardenHome,
    Path sandboxRoot,
    Path quarantineDir,
    Path auditLog,
    Path forensicsDir,
    Path evidenceDir,
    Path backupDir,
    List<Path> protectedPaths,
    long integrityCheckIntervalMillis,
    long watchPollIntervalMillis,
    long watchStableMillis,
    long postureIntervalMillis,
    long threatScanIntervalMillis,
    long eventDrainIntervalMillis,
    int eventQueueCapacity,
    EnforcementMode enforcementMode,
    double threatConfidenceThreshold,
    int traversalHistoryLimit,
    int recentLogCapacity,
    boolean verbose) {

  private static final long MAX_INTERVAL_MILLIS = 86_400_000L;
  private static final String DEFAULT_PROTECTED_PATHS = "/etc,/usr,/var,/root,/proc,/sys,/dev,~/.ssh,~/.aws,~/.gnupg";

  public WardenConfig {
    frameworkRoot = absolute(Objects.requireNonNull(frameworkRoot, "frameworkRoot"));
    wardenHome = absolute(Objects.requireNonNull(wardenHome, "wardenHome"));
    sandboxRoot = absolute(Objects.requireNonNull(sandboxRoot, "sandboxRoot"));
    quarantineDir = absolute(Objects.requireNonNull(quarantineDir, "quarantineDir"));
    auditLog = absolute(Objects.requireNonNull(auditLog, "auditLog"));
    forensicsDir = absolute(Objects.requireNonNull(forensicsDir, "forensicsDir"));
    evidenceDir = absolute(Objects.requireNonNull(evidenceDir, "evidenceDir"));
    backupDir = absolute(Objects.requireNonNull(backupDir, "backupDir"));
    protectedPaths = protectedPaths == null ? List.of() : protectedPaths.stream().map(WardenConfig::absolute).toList();
    enforcementMode = Objects.requireNonNull(enforcementMode, "enforcementMode");
    Numbers.requireRange("integrityCheckIntervalMs", integrityCheckIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("watchPollIntervalMs", watchPollIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("watchStableMillis", watchStableMillis, 0, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("postureIntervalMs", postureIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("threatScanIntervalMs", threatScanIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("eventDrainIntervalMs", eventDrainIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("eventQueueCapacity", eventQueueCapacity, 1, 1_000_000);
    Numbers.requireRange("threatConfidenceThreshold", threatConfidenceThreshold, 0.0, 1.0);
    Numbers.requireRange("traversalHistoryLimit", traversalHistoryLimit, 1, 1_000_000);
    Numbers.requireRange("recentLogCapacity", recentLogCapacity, 1, 100_000);
    List<Path> allProtected = new ArrayList<>(protectedPaths);
    allProtected.add(frameworkRoot);
    allProtected.add(wardenHome);
    Paths.requireOutside(sandboxRoot, allProtected);
  }

  /**
   * Defaults for the current user and working directory.
   *
   * @return default configuration
   */
  public static WardenConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds a configuration from flat key/value pairs; absent keys take their defaults.
   *
   * @param values configuration keys such as {@code sandboxRoot} or {@code threatScanIntervalMs}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static WardenConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : new HashMap<>(values);
    Path frameworkRoot = parsePath(kv, "frameworkRoot", Path.of(System.getProperty("user.dir")));
    Path wardenHome = parsePath(kv, "wardenHome", home().resolve(".warden"));
    Path sandboxRoot = parsePath(kv, "sandboxRoot",
        Path.of(System.getProperty("java.io.tmpdir")).resolve("warden-projects"));
    return new WardenConfig(
        frameworkRoot,
        wardenHome,
        sandboxRoot,
        parsePath(kv, "quarantineDir", wardenHome.resolve("quarantine")),
        parsePath(kv, "auditLog", wardenHome.resolve("logs").resolve("security-audit.ndjson")),
        parsePath(kv, "forensicsDir", wardenHome.resolve("forensics")),
        parsePath(kv, "evidenceDir", wardenHome.resolve("evidence")),
        parsePath(kv, "backupDir", wardenHome.resolve("backups")),
        parsePathList(kv.getOrDefault("protectedPaths", DEFAULT_PROTECTED_PATHS)),
        parseLong(kv, "integrityCheckIntervalMs", 300_000L),
        parseLong(kv, "watchPollIntervalMs", 1_000L),
        parseLong(kv, "watchStableMillis", 500L),
        parseLong(kv, "postureIntervalMs", 300_000L),
        parseLong(kv, "threatScanIntervalMs", 30_000L),
        parseLong(kv, "eventDrainIntervalMs", 100L),
        Math.toIntExact(parseLong(kv, "eventQueueCapacity", 10_000L)),
        parseEnforcementMode(kv.get("enforcementMode")),
        parseDouble(kv, "threatConfidenceThreshold", 0.5),
        Math.toIntExact(parseLong(kv, "traversalHistoryLimit", 1_000L)),
        Math.toIntExact(parseLong(kv, "recentLogCapacity", 200L)),
        parseBoolean(kv.get("verbose"), false));
  }

  /**
   * Default key/value pairs, used as the lowest precedence layer when merging.
   *
   * @return defaults as strings
   */
  public static Map<String, String> defaultValues() {
    Map<String, String> defaults = new HashMap<>();
    defaults.put("protectedPaths", DEFAULT_PROTECTED_PATHS);
    defaults.put("integrityCheckIntervalMs", "300000");
    defaults.put("watchPollIntervalMs", "1000");
    defaults.put("watchStableMillis", "500");
    defaults.put("postureIntervalMs", "300000");
    defaults.put("threatScanIntervalMs", "30000");
    defaults.put("eventDrainIntervalMs", "100");
    defaults.put("eventQueueCapacity", "10000");
    defaults.put("enforcementMode", EnforcementMode.ENFORCE.name());
    defaults.put("threatConfidenceThreshold", "0.5");
    defaults.put("traversalHistoryLimit", "1000");
    defaults.put("recentLogCapacity", "200");
    defaults.put("verbose", "false");
    return Map.copyOf(defaults);
  }

  private static Path home() {
    return Path.of(System.getProperty("user.home"));
  }

  private static Path absolute(Path path) {
    return path.toAbsolutePath().normalize();
  }

  static Path expandHome(String raw) {
    String trimmed = Strings.requireNonBlank("path", raw).trim();
    Paths.requireCleanPathText("path", trimmed);
    try {
      if (trimmed.equals("~")) {
        return home();
      }
      if (trimmed.startsWith("~/")) {
        return home().resolve(trimmed.substring(2));
      }
      return Path.of(trimmed);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("invalid path: " + trimmed, ex);
    }
  }

  private static Path parsePath(Map<String, String> kv, String key, Path fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return expandHome(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + ": " + ex.getMessage(), ex);
    }
  }

  private static List<Path> parsePathList(String raw) {
    List<Path> paths = new ArrayList<>();
    if (raw == null) {
      return paths;
    }
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        paths.add(expandHome(token));
      }
    }
    return paths;
  }

  private static long parseLong(Map<String, String> kv, String key, long fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(Map<String, String> kv, String key, double fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static EnforcementMode parseEnforcementMode(String raw) {
    return raw == null || raw.isBlank() ? EnforcementMode.ENFORCE : EnforcementMode.parse(raw);
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true") || normalized.equals("false")) {
      return Boolean.parseBoolean(normalized);
    }
    throw new IllegalArgumentException("expected true or false (was " + value + ")");
  }
}
