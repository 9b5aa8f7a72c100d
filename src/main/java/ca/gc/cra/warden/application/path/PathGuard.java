package ca.gc.cra.warden.application.path;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityEventSink;
import ca.gc.cra.warden.application.util.Ids;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.path.AttackType;
import ca.gc.cra.warden.domain.path.PathTraversalAttempt;
import ca.gc.cra.warden.domain.path.SafePath;
import ca.gc.cra.warden.domain.security.Severity;
import ca.gc.cra.warden.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates caller-supplied paths, classifies traversal attacks and synthesizes safe
 * alternatives.
 * <p><strong>Why:</strong> Every file operation an agent performs is checked here first; adversarial strings must
 * never escape a project's sandbox or reach protected framework paths.</p>
 * <p><strong>Role:</strong> Leaf subsystem; publishes {@link SecurityEvent.TraversalAttemptDetected} and
 * {@link SecurityEvent.UnsafePathDetected} to the event sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode percent and Unicode encodings up to a fixed round cap.</li>
 *   <li>Classify null-byte, separator, traversal and symlink attacks in a fixed precedence.</li>
 *   <li>Check the canonical target against allowed roots and protected paths.</li>
 *   <li>Record attack attempts in a bounded ring.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Project roots live in a concurrent map and the
 * attempt ring is guarded by its own monitor.</p>
 * <p><strong>Observability:</strong> Counts {@code path.validate.safe}, {@code path.validate.unsafe} and
 * {@code path.attempt.<type>}; attempts are logged at WARN with the input truncated.</p>
 *
 * @since 0.1.0
 */
public final class PathGuard {
  private static final Logger log = LoggerFactory.getLogger(PathGuard.class);
  private static final int LOG_PATH_BYTES = 256;
  private static final int MAX_LINK_DEPTH = 8;
  private static final String UNSCOPED = "unscoped";

  private final PathGuardSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SecurityEventSink events;
  private final ConcurrentMap<String, Path> projectRoots = new ConcurrentHashMap<>();
  private final Deque<PathTraversalAttempt> history = new ArrayDeque<>();
  private final AtomicLong totalValidations = new AtomicLong();
  private final AtomicLong unsafeValidations = new AtomicLong();
  private final AtomicLong totalAttempts = new AtomicLong();
  private final ConcurrentMap<String, AtomicLong> attemptsByType = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> attemptsBySeverity = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> attemptsByProject = new ConcurrentHashMap<>();

  /**
   * Creates a path guard.
   *
   * @param settings roots and limits
   * @param clock time source for attempt records
   * @param metrics metrics sink
   * @param events sink receiving attempt and unsafe-path events
   */
  public PathGuard(
      PathGuardSettings settings, ClockPort clock, MetricsPort metrics, SecurityEventSink events) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
  }

  public PathGuardSettings settings() {
    return settings;
  }

  /**
   * Declares the sandbox root of a project; later validations for the project are confined to it.
   *
   * @param projectId project identifier
   * @param root project root
   */
  public void registerProjectRoot(String projectId, Path root) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(root, "root");
    projectRoots.put(projectId, root.toAbsolutePath().normalize());
  }

  public void unregisterProjectRoot(String projectId) {
    if (projectId != null) {
      projectRoots.remove(projectId);
    }
  }

  /**
   * Resolves the sandbox root of a project.
   *
   * @param projectId project identifier; {@code null} for unscoped callers
   * @return registered root, {@code sandboxRoot/<projectId>} for unregistered projects, or the sandbox root
   */
  public Path projectRoot(String projectId) {
    if (projectId == null || projectId.isBlank()) {
      return settings.sandboxRoot();
    }
    Path registered = projectRoots.get(projectId);
    if (registered != null) {
      return registered;
    }
    return settings.sandboxRoot().resolve(FilenameSanitizer.sanitize(projectId)).normalize();
  }

  /**
   * Finds the registered project whose root contains {@code path}.
   *
   * @param path absolute path
   * @return owning project id when one is registered
   */
  public Optional<String> owningProject(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path normalized = path.toAbsolutePath().normalize();
    String best = null;
    int bestDepth = -1;
    for (Map.Entry<String, Path> entry : projectRoots.entrySet()) {
      Path root = entry.getValue();
      if (normalized.startsWith(root) && root.getNameCount() > bestDepth) {
        best = entry.getKey();
        bestDepth = root.getNameCount();
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Validates a path, records any attempt and publishes the resulting event.
   *
   * @param inputPath caller-supplied path; {@code null} is treated as empty and rejected
   * @param projectId project the access is for; may be {@code null}
   * @param operation requested operation
   * @return validation result; never {@code null}
   */
  public SafePath validate(String inputPath, String projectId, AccessOperation operation) {
    PathInspection inspection = evaluate(inputPath, projectId, operation);
    inspection.eventIfAny().ifPresent(events::publish);
    return inspection.safePath();
  }

  /**
   * Validates a path and records any attempt without publishing; the caller owns the returned event.
   *
   * @param inputPath caller-supplied path
   * @param projectId project the access is for; may be {@code null}
   * @param operation requested operation
   * @return inspection including the event the caller must handle
   */
  public PathInspection evaluate(String inputPath, String projectId, AccessOperation operation) {
    PathInspection inspection = inspect(inputPath, projectId, operation);
    record(inspection, projectId, operation);
    return inspection;
  }

  /**
   * Validates a path without recording or publishing anything.
   *
   * @param inputPath caller-supplied path
   * @param projectId project the access is for; may be {@code null}
   * @param operation requested operation
   * @return inspection result
   */
  public PathInspection inspect(String inputPath, String projectId, AccessOperation operation) {
    Objects.requireNonNull(operation, "operation");
    String raw = inputPath == null ? "" : inputPath;
    try {
      return doInspect(raw, projectId, operation);
    } catch (RuntimeException ex) {
      log.warn("Path inspection failed for project {}; rejecting {}", projectId,
          Logs.truncate(raw, LOG_PATH_BYTES), ex);
      Path base = projectRoot(projectId);
      SafePath rejected = new SafePath(
          raw,
          "",
          false,
          List.of("invalid path: " + ex.getClass().getSimpleName()),
          base.resolve(FilenameSanitizer.FALLBACK).toString(),
          null,
          Severity.MEDIUM);
      return new PathInspection(rejected, null, null, unsafeEvent(rejected, null, projectId, operation), false);
    }
  }

  /**
   * Tests whether {@code path} lies under a protected root.
   *
   * @param path absolute path
   * @return matching protected root
   */
  public Optional<Path> protectedRootFor(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path normalized = path.toAbsolutePath().normalize();
    for (Path protectedPath : settings.protectedPaths()) {
      if (normalized.startsWith(protectedPath)) {
        return Optional.of(protectedPath);
      }
    }
    return Optional.empty();
  }

  /**
   * Roots a project may access for an operation.
   *
   * @param projectId project identifier; may be {@code null}
   * @param operation requested operation
   * @return allowed roots, most specific first
   */
  public List<Path> allowedRoots(String projectId, AccessOperation operation) {
    List<Path> roots = new ArrayList<>();
    if (projectId != null && projectRoots.containsKey(projectId)) {
      roots.add(projectRoots.get(projectId));
    } else {
      roots.add(settings.sandboxRoot());
    }
    if (operation == AccessOperation.READ) {
      roots.addAll(settings.readOnlyRoots());
    }
    return roots;
  }

  /**
   * Returns the most recent attempts, newest first.
   *
   * @param limit maximum number of attempts
   * @return attempts
   */
  public List<PathTraversalAttempt> recentAttempts(int limit) {
    List<PathTraversalAttempt> result = new ArrayList<>();
    synchronized (history) {
      var iterator = history.descendingIterator();
      while (iterator.hasNext() && result.size() < limit) {
        result.add(iterator.next());
      }
    }
    return result;
  }

  public PathGuardStatistics statistics() {
    return new PathGuardStatistics(
        totalValidations.get(),
        unsafeValidations.get(),
        totalAttempts.get(),
        snapshot(attemptsByType),
        snapshot(attemptsBySeverity),
        snapshot(attemptsByProject));
  }

  /**
   * Health of path protection: 100 minus 0.1 per recorded attempt, never below 70.
   *
   * @return score in [70,100]
   */
  public double healthScore() {
    return Math.max(70.0, 100.0 - 0.1 * totalAttempts.get());
  }

  /**
   * Builds the path protection section of the security report.
   *
   * @return JSON-compatible document
   */
  public Map<String, Object> report() {
    PathGuardStatistics stats = statistics();
    Map<String, Object> configuration = new LinkedHashMap<>();
    configuration.put("framework_root", settings.frameworkRoot().toString());
    configuration.put("sandbox_root", settings.sandboxRoot().toString());
    configuration.put("protected_paths", settings.protectedPaths().stream().map(Path::toString).toList());
    configuration.put("read_only_roots", settings.readOnlyRoots().stream().map(Path::toString).toList());
    configuration.put("registered_projects", new TreeMap<>(projectRoots).keySet().stream().toList());

    Map<String, Object> statistics = new LinkedHashMap<>();
    statistics.put("total_validations", stats.totalValidations());
    statistics.put("unsafe_validations", stats.unsafeValidations());
    statistics.put("total_attempts", stats.totalAttempts());
    statistics.put("attempts_by_type", new TreeMap<>(stats.attemptsByType()));
    statistics.put("attempts_by_severity", new TreeMap<>(stats.attemptsBySeverity()));
    statistics.put("attempts_by_project", new TreeMap<>(stats.attemptsByProject()));

    List<Map<String, Object>> recent = new ArrayList<>();
    for (PathTraversalAttempt attempt : recentAttempts(20)) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", attempt.id());
      entry.put("timestamp", attempt.timestamp().toString());
      entry.put("attack_type", attempt.attackType().wireName());
      entry.put("severity", attempt.severity().wireName());
      entry.put("project_id", attempt.projectId());
      entry.put("intended_target", attempt.intendedTarget());
      recent.add(entry);
    }

    Map<String, Object> report = new LinkedHashMap<>();
    report.put("configuration", configuration);
    report.put("statistics", statistics);
    report.put("recent_attempts", recent);
    report.put("health_score", healthScore());
    return report;
  }

  private PathInspection doInspect(String raw, String projectId, AccessOperation operation) {
    Path base = projectRoot(projectId);
    if (raw.isBlank()) {
      SafePath empty = new SafePath(
          raw, "", false, List.of("empty path"), base.resolve(FilenameSanitizer.FALLBACK).toString(), null,
          Severity.LOW);
      return new PathInspection(empty, null, null, unsafeEvent(empty, null, projectId, operation), false);
    }

    PathDecoder.Decoding decoding = PathDecoder.decode(raw);
    String decoded = decoding.unicodeDecoded();
    String resolvable = stripControl(decoded).replace('\\', '/');

    List<String> violations = new ArrayList<>();
    Path normalized = null;
    try {
      Path candidate = Path.of(resolvable);
      normalized = (candidate.isAbsolute() ? candidate : base.resolve(candidate)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      violations.add("invalid path: " + ex.getReason());
    }

    List<Path> roots = allowedRoots(projectId, operation);
    boolean insideAllowed = normalized != null && underAny(normalized, roots);
    Optional<Path> protectedRoot = protectedRootFor(normalized);
    boolean whitelistedRead = operation == AccessOperation.READ
        && normalized != null
        && underAny(normalized, settings.readOnlyRoots());
    boolean protectedHit = protectedRoot.isPresent() && !whitelistedRead;

    AttackType attack = classify(decoding, insideAllowed, normalized, roots);
    if (attack != null) {
      violations.add(0, "attack detected: " + attack.wireName());
    }
    if (normalized != null && !insideAllowed) {
      violations.add("outside allowed roots: " + normalized);
    }
    if (protectedHit) {
      violations.add("protected path: " + protectedRoot.get());
    }

    boolean safe = violations.isEmpty();
    Severity severity = null;
    if (attack != null) {
      severity = attack.severityFor(protectedHit);
    } else if (!safe) {
      severity = protectedHit ? Severity.HIGH : Severity.MEDIUM;
    }
    String sanitized = normalized == null ? resolvable : normalized.toString();
    String recommended = safe
        ? sanitized
        : base.resolve(FilenameSanitizer.sanitize(PathSegments.lastName(decoded))).toString();

    SafePath result = new SafePath(raw, sanitized, safe, violations, recommended, attack, severity);
    if (safe) {
      return new PathInspection(result, normalized, null, null, protectedRoot.isPresent());
    }
    if (attack == null) {
      return new PathInspection(
          result, normalized, null, unsafeEvent(result, normalized, projectId, operation), protectedHit);
    }
    PathTraversalAttempt attempt = new PathTraversalAttempt(
        Ids.next("PTA", clock.nowMillis()),
        clock.now(),
        attack,
        raw,
        sanitized,
        intendedTarget(decoded, sanitized),
        severity,
        true,
        projectId,
        evidence(decoding, operation, protectedRoot));
    return new PathInspection(
        result, normalized, attempt, new SecurityEvent.TraversalAttemptDetected(attempt), protectedHit);
  }

  private AttackType classify(
      PathDecoder.Decoding decoding, boolean insideAllowed, Path normalized, List<Path> roots) {
    String decoded = decoding.unicodeDecoded();
    if (decoding.containsNul()) {
      return AttackType.NULL_BYTE_INJECTION;
    }
    if (PathSegments.hasMixedSeparators(decoded)) {
      return AttackType.MIXED_SEPARATORS;
    }
    if (PathSegments.hasWindowsSyntax(decoded)) {
      return AttackType.WINDOWS_TRAVERSAL;
    }
    int stage = decoding.firstTraversalStage();
    boolean unicodeOnly = stage < 0 && PathSegments.hasParentSegment(decoded);
    if (stage >= 0 || unicodeOnly) {
      boolean escapes = PathSegments.countParentSegments(decoded) >= 2
          || PathSegments.climbsAboveStart(decoded)
          || !insideAllowed;
      if (escapes) {
        if (unicodeOnly) {
          return AttackType.UNICODE_TRAVERSAL;
        }
        if (stage == 0) {
          return AttackType.BASIC_TRAVERSAL;
        }
        return stage == 1 ? AttackType.ENCODED_TRAVERSAL : AttackType.DOUBLE_ENCODING;
      }
    }
    if (insideAllowed && escapesViaSymlink(normalized, roots)) {
      return AttackType.SYMLINK_TRAVERSAL;
    }
    return null;
  }

  private boolean escapesViaSymlink(Path normalized, List<Path> roots) {
    Path real = realPath(normalized, 0);
    for (Path root : roots) {
      if (real.startsWith(realPath(root, 0))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Resolves symbolic links along {@code path}, including dangling links, appending non-existent trailing
   * segments lexically.
   */
  private static Path realPath(Path path, int depth) {
    if (depth > MAX_LINK_DEPTH) {
      return path;
    }
    try {
      Path existing = path;
      Deque<String> tail = new ArrayDeque<>();
      while (existing != null && !Files.exists(existing)) {
        if (Files.isSymbolicLink(existing)) {
          Path target = existing.resolveSibling(Files.readSymbolicLink(existing)).normalize();
          Path resolved = realPath(target, depth + 1);
          return append(resolved, tail);
        }
        Path name = existing.getFileName();
        if (name != null) {
          tail.push(name.toString());
        }
        existing = existing.getParent();
      }
      if (existing == null) {
        return path;
      }
      return append(existing.toRealPath(), tail);
    } catch (IOException | SecurityException ex) {
      log.debug("Unable to resolve real path for {}", path, ex);
      return path;
    }
  }

  private static Path append(Path base, Deque<String> tail) {
    Path result = base;
    for (String segment : tail) {
      result = result.resolve(segment);
    }
    return result.normalize();
  }

  private void record(PathInspection inspection, String projectId, AccessOperation operation) {
    totalValidations.incrementAndGet();
    if (inspection.safe()) {
      metrics.increment("path.validate.safe");
      return;
    }
    unsafeValidations.incrementAndGet();
    metrics.increment("path.validate.unsafe");
    PathTraversalAttempt attempt = inspection.attempt();
    if (attempt == null) {
      log.info("path.unsafe project={} op={} violations={} path={}", projectId, operation.wireName(),
          inspection.safePath().violations(), Logs.truncate(inspection.safePath().originalPath(), LOG_PATH_BYTES));
      return;
    }
    synchronized (history) {
      history.addLast(attempt);
      while (history.size() > settings.historyLimit()) {
        history.removeFirst();
      }
    }
    totalAttempts.incrementAndGet();
    attemptsByType.computeIfAbsent(attempt.attackType().wireName(), key -> new AtomicLong()).incrementAndGet();
    attemptsBySeverity.computeIfAbsent(attempt.severity().wireName(), key -> new AtomicLong()).incrementAndGet();
    attemptsByProject.computeIfAbsent(projectId == null ? UNSCOPED : projectId, key -> new AtomicLong())
        .incrementAndGet();
    metrics.increment("path.attempt." + attempt.attackType().wireName());
    log.warn("path.attempt id={} project={} op={} attack={} severity={} target={} path={}",
        attempt.id(), projectId, operation.wireName(), attempt.attackType().wireName(),
        attempt.severity().wireName(), attempt.intendedTarget(),
        Logs.truncate(attempt.originalPath(), LOG_PATH_BYTES));
  }

  private SecurityEvent unsafeEvent(
      SafePath result, Path normalized, String projectId, AccessOperation operation) {
    return new SecurityEvent.UnsafePathDetected(
        clock.now(),
        projectId,
        result.originalPath(),
        normalized == null ? result.sanitizedPath() : normalized.toString(),
        operation,
        result.severity() == null ? Severity.MEDIUM : result.severity(),
        result.violations());
  }

  private static Map<String, String> evidence(
      PathDecoder.Decoding decoding, AccessOperation operation, Optional<Path> protectedRoot) {
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("raw", Logs.truncate(decoding.raw(), LOG_PATH_BYTES));
    evidence.put("percent_decoded", Logs.truncate(printable(decoding.percentDecoded()), LOG_PATH_BYTES));
    evidence.put("unicode_decoded", Logs.truncate(printable(decoding.unicodeDecoded()), LOG_PATH_BYTES));
    evidence.put("decode_rounds", Integer.toString(decoding.decodeRounds()));
    evidence.put("parent_segments", Integer.toString(PathSegments.countParentSegments(decoding.unicodeDecoded())));
    evidence.put("operation", operation.wireName());
    protectedRoot.ifPresent(root -> evidence.put("protected_root", root.toString()));
    return evidence;
  }

  private static String intendedTarget(String decoded, String normalized) {
    String lower = decoded.toLowerCase(Locale.ROOT);
    if (lower.contains("passwd")) {
      return "/etc/passwd";
    }
    if (lower.contains("shadow")) {
      return "/etc/shadow";
    }
    if (lower.contains(".ssh") || lower.contains("id_rsa")) {
      return "ssh_keys";
    }
    if (lower.contains(".aws")) {
      return "cloud_credentials";
    }
    if (lower.contains(".env")) {
      return "environment_secrets";
    }
    if (lower.contains("framework")) {
      return "framework_core";
    }
    if (lower.contains("config")) {
      return "configuration";
    }
    return normalized;
  }

  private static boolean underAny(Path path, List<Path> roots) {
    for (Path root : roots) {
      if (path.startsWith(root)) {
        return true;
      }
    }
    return false;
  }

  private static String stripControl(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!Character.isISOControl(c)) {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static String printable(String value) {
    return value.replace("\0", "\\0");
  }

  private static Map<String, Long> snapshot(ConcurrentMap<String, AtomicLong> counters) {
    Map<String, Long> copy = new LinkedHashMap<>();
    counters.forEach((key, value) -> copy.put(key, value.get()));
    return copy;
  }
}
