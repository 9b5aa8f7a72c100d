package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.application.path.PathGuard;
import ca.gc.cra.warden.application.path.PathInspection;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.DirectoryWatchPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityEventSink;
import ca.gc.cra.warden.application.util.Ids;
import ca.gc.cra.warden.domain.boundary.AccessDecision;
import ca.gc.cra.warden.domain.boundary.BoundaryRule;
import ca.gc.cra.warden.domain.boundary.BoundaryType;
import ca.gc.cra.warden.domain.boundary.BoundaryViolation;
import ca.gc.cra.warden.domain.boundary.FileEvent;
import ca.gc.cra.warden.domain.boundary.FileEventKind;
import ca.gc.cra.warden.domain.boundary.FileOperation;
import ca.gc.cra.warden.domain.boundary.FileSystemBoundary;
import ca.gc.cra.warden.domain.boundary.RuleAction;
import ca.gc.cra.warden.domain.boundary.ViolationType;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.security.Severity;
import ca.gc.cra.warden.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the filesystem boundary registry, evaluates boundary rules against observed and
 * requested accesses, enforces violations and detects out-of-band tampering.
 * <p><strong>Why:</strong> Path validation alone cannot see what agents actually do on disk; the engine watches
 * each boundary and reacts to changes that break its rules.</p>
 * <p><strong>Role:</strong> Middle subsystem. Calls {@link PathGuard} for every observed path and publishes
 * {@link SecurityEvent.BoundaryViolationDetected} and {@link SecurityEvent.IntegrityViolationDetected}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Seed the framework core and quarantine boundaries; add project sandboxes and shared resources.</li>
 *   <li>Classify watcher events and apply the first matching rule of the owning boundary.</li>
 *   <li>Recompute content hashes and flag changes not explained by enforcement or scoped project activity.</li>
 *   <li>Answer {@link #validateFileAccess} without touching watcher state.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The boundary registry is a concurrent map; the violation ring has its own
 * monitor. Watcher callbacks and integrity checks run on the security loop.</p>
 * <p><strong>Observability:</strong> Counts {@code boundary.violation} and {@code boundary.integrity.violation};
 * violations are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class BoundaryEngine {
  private static final Logger log = LoggerFactory.getLogger(BoundaryEngine.class);
  private static final Pattern PARENT_SEGMENT = Pattern.compile("(^|[/\\\\])\\.\\.([/\\\\]|$)");
  private static final int LOG_PATH_BYTES = 256;
  private static final long MILLIS_PER_HOUR = 3_600_000L;

  private final BoundaryEngineSettings settings;
  private final PathGuard pathGuard;
  private final DirectoryWatchPort watchPort;
  private final ExecutionContext executionContext;
  private final ViolationEnforcer enforcer;
  private final RuleEvaluator evaluator;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SecurityEventSink events;
  private final long startedAtMillis;

  private final ConcurrentMap<String, FileSystemBoundary> boundaries = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DirectoryWatchPort.WatchHandle> watchers = new ConcurrentHashMap<>();
  private final Deque<BoundaryViolation> recentViolations = new ArrayDeque<>();
  private final AtomicLong totalViolations = new AtomicLong();
  private final AtomicLong blockedViolations = new AtomicLong();
  private final AtomicLong integrityViolations = new AtomicLong();
  private final ConcurrentMap<String, AtomicLong> violationsByType = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> violationsByBoundary = new ConcurrentHashMap<>();
  private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
  // paths removed by enforcement; their deletion is not a new change
  private final Set<Path> enforcedRemovals = ConcurrentHashMap.newKeySet();
  private volatile boolean initialized;

  /**
   * Creates an engine with an empty registry; call {@link #initialize()} to seed it.
   *
   * @param settings engine settings
   * @param pathGuard path validation
   * @param watchPort directory watcher
   * @param executionContext registry of the active project
   * @param enforcer violation remediation
   * @param clock time source
   * @param metrics metrics sink
   * @param events sink receiving violation events
   */
  public BoundaryEngine(
      BoundaryEngineSettings settings,
      PathGuard pathGuard,
      DirectoryWatchPort watchPort,
      ExecutionContext executionContext,
      ViolationEnforcer enforcer,
      ClockPort clock,
      MetricsPort metrics,
      SecurityEventSink events) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.pathGuard = Objects.requireNonNull(pathGuard, "pathGuard");
    this.watchPort = Objects.requireNonNull(watchPort, "watchPort");
    this.executionContext = Objects.requireNonNull(executionContext, "executionContext");
    this.enforcer = Objects.requireNonNull(enforcer, "enforcer");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
    this.evaluator = new RuleEvaluator(settings.homeDirectory());
    this.startedAtMillis = clock.nowMillis();
  }

  /** Seeds the framework core and quarantine boundaries; later calls have no effect. */
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    try {
      Files.createDirectories(enforcer.quarantineDir());
    } catch (IOException ex) {
      log.warn("Unable to create quarantine directory {}", enforcer.quarantineDir(), ex);
    }
    addBoundary(BoundaryCatalog.frameworkCore(pathGuard.settings().frameworkRoot(), settings.monitorFrameworkCore()));
    addBoundary(BoundaryCatalog.quarantine(enforcer.quarantineDir()));
    initialized = true;
    log.info("Boundary engine initialized with {} boundaries (enforcement {})", boundaries.size(),
        enforcer.mode());
  }

  /**
   * Schedules watcher polls and integrity checks on the security loop.
   *
   * @param loop single-threaded security loop
   * @param pollIntervalMillis watcher poll period
   * @param integrityIntervalMillis integrity check period
   */
  public synchronized void start(
      ScheduledExecutorService loop, long pollIntervalMillis, long integrityIntervalMillis) {
    Objects.requireNonNull(loop, "loop");
    initialize();
    scheduled.add(loop.scheduleWithFixedDelay(
        this::pollWatchers, pollIntervalMillis, pollIntervalMillis, TimeUnit.MILLISECONDS));
    scheduled.add(loop.scheduleWithFixedDelay(
        this::checkIntegrity, integrityIntervalMillis, integrityIntervalMillis, TimeUnit.MILLISECONDS));
  }

  /** Cancels scheduled work and closes every watcher. */
  public synchronized void stop() {
    scheduled.forEach(future -> future.cancel(false));
    scheduled.clear();
    watchers.values().forEach(DirectoryWatchPort.WatchHandle::close);
    watchers.clear();
  }

  /**
   * Registers a boundary, installs its watcher and records its integrity baseline.
   *
   * @param boundary boundary to add
   * @return the added boundary
   * @throws IllegalStateException when a boundary with the same id exists
   */
  public FileSystemBoundary addBoundary(FileSystemBoundary boundary) {
    Objects.requireNonNull(boundary, "boundary");
    if (boundaries.putIfAbsent(boundary.boundaryId(), boundary) != null) {
      throw new IllegalStateException("boundary already registered: " + boundary.boundaryId());
    }
    if (boundary.monitoringEnabled()) {
      try {
        watchers.put(boundary.boundaryId(),
            watchPort.watch(boundary.rootPath(), event -> onFileEvent(boundary, event)));
      } catch (IOException ex) {
        log.warn("Unable to watch boundary {} at {}", boundary.boundaryId(), boundary.rootPath(), ex);
      }
    }
    refreshBaseline(boundary);
    log.info("boundary.added id={} type={} root={} rules={}", boundary.boundaryId(),
        boundary.boundaryType().wireName(), boundary.rootPath(), boundary.accessRules().size());
    return boundary;
  }

  /**
   * Adds the sandbox boundary of a project.
   *
   * @param projectId project identifier
   * @param projectRoot project root
   * @return the added boundary
   */
  public FileSystemBoundary addProjectSandbox(String projectId, Path projectRoot) {
    return addBoundary(BoundaryCatalog.projectSandbox(projectId, projectRoot));
  }

  /**
   * Adds a shared-resource boundary.
   *
   * @param resourceId resource identifier
   * @param resourceRoot resource root
   * @return the added boundary
   */
  public FileSystemBoundary addSharedResource(String resourceId, Path resourceRoot) {
    return addBoundary(BoundaryCatalog.sharedResource(resourceId, resourceRoot));
  }

  /**
   * Removes a boundary and closes its watcher.
   *
   * @param boundaryId boundary identifier
   * @return {@code true} when a boundary was removed
   */
  public boolean removeBoundary(String boundaryId) {
    FileSystemBoundary removed = boundaries.remove(boundaryId);
    DirectoryWatchPort.WatchHandle handle = watchers.remove(boundaryId);
    if (handle != null) {
      handle.close();
    }
    if (removed != null) {
      log.info("boundary.removed id={}", boundaryId);
    }
    return removed != null;
  }

  public boolean removeProjectSandbox(String projectId) {
    return removeBoundary(BoundaryCatalog.sandboxId(projectId));
  }

  public Optional<FileSystemBoundary> boundary(String boundaryId) {
    return Optional.ofNullable(boundaries.get(boundaryId));
  }

  public Optional<FileSystemBoundary> projectSandbox(String projectId) {
    return boundary(BoundaryCatalog.sandboxId(projectId));
  }

  /**
   * Registered boundaries ordered by id.
   *
   * @return snapshot of the registry
   */
  public List<FileSystemBoundary> boundaries() {
    return boundaries.values().stream()
        .sorted(Comparator.comparing(FileSystemBoundary::boundaryId))
        .toList();
  }

  /**
   * Finds the most specific boundary whose root contains {@code path}.
   *
   * @param path absolute path
   * @return deepest containing boundary
   */
  public Optional<FileSystemBoundary> boundaryContaining(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    List<FileSystemBoundary> candidates = containing(path.toAbsolutePath().normalize());
    return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
  }

  public ExecutionContext executionContext() {
    return executionContext;
  }

  /**
   * Checks whether an access would be allowed, without enforcing, recording or publishing anything.
   *
   * @param targetPath caller-supplied target
   * @param operation requested operation
   * @param projectId project the access originates from; falls back to the active execution context
   * @return decision with the violation that would be raised when denied
   */
  public AccessDecision validateFileAccess(String targetPath, AccessOperation operation, String projectId) {
    Objects.requireNonNull(operation, "operation");
    String origin = projectId != null ? projectId : executionContext.activeProject().orElse(null);
    PathInspection inspection = pathGuard.inspect(targetPath, origin, operation);
    if (!inspection.safe() || inspection.normalizedPath() == null) {
      return AccessDecision.deny("path validation failed: " + inspection.safePath().violations(), null);
    }
    Path target = inspection.normalizedPath();
    Map<String, String> baseEvidence = new LinkedHashMap<>();
    baseEvidence.put("operation", operation.wireName());
    baseEvidence.put("origin", "access_check");
    for (FileSystemBoundary boundary : containing(target)) {
      RuleContext context = context(boundary, target, raw(targetPath), operation,
          fileOperationFor(operation, target), origin);
      Optional<BoundaryRule> rule = evaluator.select(boundary.accessRules(), context);
      if (rule.isPresent() && rule.get().action().violates()) {
        BoundaryViolation violation = violation(boundary, rule.get(), context, baseEvidence)
            .withEnforcement(true, "access_denied", Map.of());
        return AccessDecision.deny(
            "boundary rule " + rule.get().ruleId() + " denies " + operation.wireName() + " in "
                + boundary.boundaryId(),
            violation);
      }
    }
    return AccessDecision.allow();
  }

  /** Polls every watcher so that write-stable changes are delivered. */
  public void pollWatchers() {
    for (Map.Entry<String, DirectoryWatchPort.WatchHandle> entry : watchers.entrySet()) {
      try {
        entry.getValue().poll();
      } catch (RuntimeException ex) {
        log.warn("Watcher poll failed for boundary {}", entry.getKey(), ex);
      }
    }
  }

  /**
   * Recomputes every boundary hash and publishes a violation for unaccounted changes.
   *
   * @return integrity violations detected in this pass
   */
  public List<SecurityEvent.IntegrityViolationDetected> checkIntegrity() {
    List<SecurityEvent.IntegrityViolationDetected> detected = new ArrayList<>();
    for (FileSystemBoundary boundary : boundaries()) {
      checkIntegrity(boundary).ifPresent(detected::add);
    }
    return detected;
  }

  /**
   * Recomputes one boundary's hash.
   *
   * @param boundaryId boundary identifier
   * @return the violation when tampering was detected
   */
  public Optional<SecurityEvent.IntegrityViolationDetected> checkIntegrity(String boundaryId) {
    FileSystemBoundary boundary = boundaries.get(boundaryId);
    return boundary == null ? Optional.empty() : checkIntegrity(boundary);
  }

  private Optional<SecurityEvent.IntegrityViolationDetected> checkIntegrity(FileSystemBoundary boundary) {
    DirectoryWatchPort.WatchHandle handle = watchers.get(boundary.boundaryId());
    if (handle != null) {
      try {
        handle.poll();
      } catch (RuntimeException ex) {
        log.warn("Watcher poll failed for boundary {}", boundary.boundaryId(), ex);
      }
      if (handle.pendingChanges() > 0) {
        // Writes still settling; keep the old baseline so the change is judged once it is attributed.
        log.debug("boundary.integrity.deferred boundary={} pending={}", boundary.boundaryId(),
            handle.pendingChanges());
        return Optional.empty();
      }
    }
    String hash;
    try {
      hash = DirectoryHasher.hash(boundary.rootPath());
    } catch (IOException | RuntimeException ex) {
      log.warn("Integrity hash failed for boundary {}", boundary.boundaryId(), ex);
      return Optional.empty();
    }
    FileSystemBoundary.IntegrityBaseline baseline = boundary.rebaseline(hash, clock.now());
    if (!baseline.established() || hash.equals(baseline.integrityHash())
        || boundary.integrityBaseline().accountsForChangeSince(baseline)) {
      return Optional.empty();
    }
    SecurityEvent.IntegrityViolationDetected event = new SecurityEvent.IntegrityViolationDetected(
        clock.now(), boundary.boundaryId(), boundary.projectId(), boundary.rootPath().toString(),
        baseline.integrityHash(), hash);
    integrityViolations.incrementAndGet();
    metrics.increment("boundary.integrity.violation");
    log.error("boundary.integrity.violation boundary={} project={} expected={} actual={}",
        boundary.boundaryId(), boundary.projectId(), baseline.integrityHash(), hash);
    events.publish(event);
    return Optional.of(event);
  }

  private void refreshBaseline(FileSystemBoundary boundary) {
    try {
      boundary.rebaseline(DirectoryHasher.hash(boundary.rootPath()), clock.now());
    } catch (IOException ex) {
      log.warn("Unable to baseline boundary {}", boundary.boundaryId(), ex);
    }
  }

  void onFileEvent(FileSystemBoundary boundary, FileEvent event) {
    if (!boundaries.containsKey(boundary.boundaryId())) {
      return;
    }
    Path target = event.path().toAbsolutePath().normalize();
    if (event.kind() == FileEventKind.DELETED && enforcedRemovals.remove(target)) {
      return;
    }
    FileOperation operation = classify(event.kind(), target);
    String origin = executionContext.attributedProject().orElse(null);
    AccessOperation access = operation == FileOperation.EXECUTABLE_CREATION
        ? AccessOperation.WRITE
        : operation.accessOperation();
    RuleContext context = context(boundary, target, target.toString(), access, operation, origin);
    Optional<BoundaryRule> rule = evaluator.select(boundary.accessRules(), context);
    if (rule.isEmpty() || !rule.get().action().violates()) {
      if (rule.isPresent() && rule.get().action() == RuleAction.AUDIT) {
        log.debug("boundary.audit boundary={} op={} target={}", boundary.boundaryId(), operation.wireName(),
            Logs.truncate(target.toString(), LOG_PATH_BYTES));
      }
      if (origin != null || boundary.boundaryType() == BoundaryType.QUARANTINE) {
        boundary.recordAttributedChange();
      } else {
        boundary.recordUnattributedChange();
        log.info("boundary.change.unattributed boundary={} op={} target={}", boundary.boundaryId(),
            operation.wireName(), Logs.truncate(target.toString(), LOG_PATH_BYTES));
      }
      return;
    }
    Map<String, String> evidence = new LinkedHashMap<>();
    evidence.put("operation", operation.wireName());
    evidence.put("origin", "watcher");
    evidence.put("path_guard", pathGuardVerdict(target, boundary, access));
    BoundaryViolation violation = violation(boundary, rule.get(), context, evidence);
    boundary.recordEnforcement();
    if (rule.get().action() == RuleAction.QUARANTINE) {
      boundary(BoundaryCatalog.QUARANTINE_ID).ifPresent(FileSystemBoundary::recordEnforcement);
    }
    BoundaryViolation enforced = enforcer.enforce(violation, rule.get().action(), boundary);
    if (enforced.remediationAction().equals("deleted") || enforced.remediationAction().startsWith("quarantined")) {
      enforcedRemovals.add(target);
    }
    record(enforced);
    events.publish(new SecurityEvent.BoundaryViolationDetected(enforced));
  }

  private String pathGuardVerdict(Path target, FileSystemBoundary boundary, AccessOperation access) {
    PathInspection inspection = pathGuard.inspect(target.toString(), boundary.projectId(), access);
    return inspection.safePath().attack()
        .map(attack -> attack.wireName())
        .orElse(inspection.safe() ? "clean" : "outside_allowed_roots");
  }

  private BoundaryViolation violation(
      FileSystemBoundary boundary, BoundaryRule rule, RuleContext context, Map<String, String> baseEvidence) {
    boolean protectedTarget = pathGuard.protectedRootFor(context.targetPath()).isPresent();
    Severity severity = ViolationSeverityTable.severityFor(rule.action(), boundary.boundaryType(), protectedTarget);
    Map<String, String> evidence = new LinkedHashMap<>(baseEvidence);
    evidence.put("rule_action", rule.action().wireName());
    evidence.put("boundary_type", boundary.boundaryType().wireName());
    evidence.put("protected_target", Boolean.toString(protectedTarget));
    if (context.targetOwner() != null) {
      evidence.put("target_owner", context.targetOwner());
    }
    return new BoundaryViolation(
        Ids.next("BVI", clock.nowMillis()),
        clock.now(),
        ViolationType.fromCondition(rule.leadingCondition()),
        boundary.boundaryId(),
        rule.ruleId(),
        context.sourcePath() == null ? "" : context.sourcePath().toString(),
        context.targetPath().toString(),
        context.activeProject() != null ? context.activeProject() : boundary.projectId(),
        severity,
        false,
        "pending",
        evidence);
  }

  private void record(BoundaryViolation violation) {
    synchronized (recentViolations) {
      recentViolations.addLast(violation);
      while (recentViolations.size() > settings.violationHistoryLimit()) {
        recentViolations.removeFirst();
      }
    }
    totalViolations.incrementAndGet();
    if (violation.blocked()) {
      blockedViolations.incrementAndGet();
    }
    violationsByType.computeIfAbsent(violation.violationType().wireName(), key -> new AtomicLong())
        .incrementAndGet();
    violationsByBoundary.computeIfAbsent(violation.boundaryId(), key -> new AtomicLong()).incrementAndGet();
    metrics.increment("boundary.violation");
    log.warn("boundary.violation id={} type={} boundary={} rule={} project={} severity={} remediation={} target={}",
        violation.id(), violation.violationType().wireName(), violation.boundaryId(), violation.ruleId(),
        violation.projectId(), violation.severity().wireName(), violation.remediationAction(),
        Logs.truncate(violation.targetPath(), LOG_PATH_BYTES));
  }

  private RuleContext context(
      FileSystemBoundary boundary,
      Path target,
      String rawTarget,
      AccessOperation access,
      FileOperation operation,
      String origin) {
    Path source = origin == null ? null : pathGuard.projectRoot(origin);
    return new RuleContext(
        source,
        target,
        access,
        operation,
        origin,
        boundary.boundaryType() == BoundaryType.PROJECT_SANDBOX ? boundary.projectId() : null,
        ExecutableDetector.isExecutable(target),
        PARENT_SEGMENT.matcher(rawTarget).find(),
        escapesBoundary(boundary, target));
  }

  private static boolean escapesBoundary(FileSystemBoundary boundary, Path target) {
    if (!Files.isSymbolicLink(target)) {
      return false;
    }
    try {
      Path link = Files.readSymbolicLink(target);
      Path resolved = target.resolveSibling(link).normalize();
      Path real = Files.exists(resolved) ? resolved.toRealPath() : resolved;
      Path root = Files.exists(boundary.rootPath()) ? boundary.rootPath().toRealPath() : boundary.rootPath();
      return !real.startsWith(root);
    } catch (IOException | RuntimeException ex) {
      log.debug("Unable to resolve symbolic link {}", target, ex);
      return true;
    }
  }

  private static FileOperation classify(FileEventKind kind, Path target) {
    return switch (kind) {
      case DELETED -> FileOperation.DELETE;
      case MODIFIED -> FileOperation.MODIFY;
      case CREATED -> ExecutableDetector.isExecutable(target)
          ? FileOperation.EXECUTABLE_CREATION
          : FileOperation.CREATE;
    };
  }

  private static FileOperation fileOperationFor(AccessOperation operation, Path target) {
    return switch (operation) {
      case READ, EXECUTE -> FileOperation.READ;
      case WRITE -> Files.exists(target, LinkOption.NOFOLLOW_LINKS) ? FileOperation.MODIFY : FileOperation.CREATE;
    };
  }

  private List<FileSystemBoundary> containing(Path target) {
    return boundaries.values().stream()
        .filter(boundary -> boundary.contains(target))
        .sorted(Comparator.comparingInt((FileSystemBoundary b) -> b.rootPath().getNameCount()).reversed()
            .thenComparing(FileSystemBoundary::boundaryId))
        .toList();
  }

  private static String raw(String targetPath) {
    return targetPath == null ? "" : targetPath;
  }

  /**
   * Most recent violations, newest first.
   *
   * @param limit maximum number returned
   * @return violations
   */
  public List<BoundaryViolation> recentViolations(int limit) {
    List<BoundaryViolation> result = new ArrayList<>();
    synchronized (recentViolations) {
      var iterator = recentViolations.descendingIterator();
      while (iterator.hasNext() && result.size() < limit) {
        result.add(iterator.next());
      }
    }
    return result;
  }

  public BoundaryStatistics statistics() {
    return new BoundaryStatistics(
        boundaries.size(),
        totalViolations.get(),
        blockedViolations.get(),
        integrityViolations.get(),
        snapshot(violationsByType),
        snapshot(violationsByBoundary),
        Math.max(0L, clock.nowMillis() - startedAtMillis));
  }

  /**
   * Health from the violation rate per uptime hour, with uptime floored at one hour.
   *
   * @return 100, 95, 85 or 70
   */
  public double healthScore() {
    BoundaryStatistics stats = statistics();
    double hours = Math.max(1.0, (double) stats.uptimeMillis() / MILLIS_PER_HOUR);
    double rate = stats.totalViolations() / hours;
    if (rate == 0.0) {
      return 100.0;
    }
    if (rate < 1.0) {
      return 95.0;
    }
    if (rate < 5.0) {
      return 85.0;
    }
    return 70.0;
  }

  /**
   * Builds the boundary section of the security report.
   *
   * @return JSON-compatible document
   */
  public Map<String, Object> report() {
    BoundaryStatistics stats = statistics();
    List<Map<String, Object>> boundaryEntries = new ArrayList<>();
    for (FileSystemBoundary boundary : boundaries()) {
      FileSystemBoundary.IntegrityBaseline baseline = boundary.integrityBaseline();
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("boundary_id", boundary.boundaryId());
      entry.put("boundary_type", boundary.boundaryType().wireName());
      entry.put("root_path", boundary.rootPath().toString());
      entry.put("project_id", boundary.projectId());
      entry.put("enforcement_level", boundary.enforcementLevel().wireName());
      entry.put("monitoring_enabled", boundary.monitoringEnabled());
      entry.put("rules", boundary.accessRules().stream().map(BoundaryRule::ruleId).toList());
      entry.put("integrity_hash", baseline.integrityHash());
      entry.put("last_integrity_check",
          baseline.lastIntegrityCheck() == null ? null : baseline.lastIntegrityCheck().toString());
      boundaryEntries.add(entry);
    }
    Map<String, Object> statistics = new LinkedHashMap<>();
    statistics.put("total_violations", stats.totalViolations());
    statistics.put("blocked_violations", stats.blockedViolations());
    statistics.put("integrity_violations", stats.integrityViolations());
    statistics.put("violations_by_type", new TreeMap<>(stats.violationsByType()));
    statistics.put("violations_by_boundary", new TreeMap<>(stats.violationsByBoundary()));
    statistics.put("uptime_ms", stats.uptimeMillis());

    List<Map<String, Object>> recent = new ArrayList<>();
    for (BoundaryViolation violation : recentViolations(20)) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", violation.id());
      entry.put("timestamp", violation.timestamp().toString());
      entry.put("violation_type", violation.violationType().wireName());
      entry.put("boundary_id", violation.boundaryId());
      entry.put("rule_id", violation.ruleId());
      entry.put("severity", violation.severity().wireName());
      entry.put("blocked", violation.blocked());
      entry.put("remediation_action", violation.remediationAction());
      recent.add(entry);
    }

    Map<String, Object> report = new LinkedHashMap<>();
    report.put("enforcement_mode", enforcer.mode().name().toLowerCase(Locale.ROOT));
    report.put("boundaries", boundaryEntries);
    report.put("statistics", statistics);
    report.put("recent_violations", recent);
    report.put("health_score", healthScore());
    return report;
  }

  private static Map<String, Long> snapshot(ConcurrentMap<String, AtomicLong> counters) {
    Map<String, Long> copy = new LinkedHashMap<>();
    counters.forEach((key, value) -> copy.put(key, value.get()));
    return copy;
  }
}
