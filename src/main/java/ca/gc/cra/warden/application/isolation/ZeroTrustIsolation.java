package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.application.boundary.BoundaryCatalog;
import ca.gc.cra.warden.application.boundary.BoundaryEngine;
import ca.gc.cra.warden.application.boundary.DirectoryHasher;
import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.application.path.PathGuard;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityEventSink;
import ca.gc.cra.warden.application.util.Ids;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.isolation.ActivityRecord;
import ca.gc.cra.warden.domain.isolation.BoundaryMetrics;
import ca.gc.cra.warden.domain.isolation.CheckFrequency;
import ca.gc.cra.warden.domain.isolation.CheckKind;
import ca.gc.cra.warden.domain.isolation.EnforcementMechanism;
import ca.gc.cra.warden.domain.isolation.FailureAction;
import ca.gc.cra.warden.domain.isolation.PendingApproval;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.domain.isolation.ThreatResponse;
import ca.gc.cra.warden.domain.isolation.ThreatResponseKind;
import ca.gc.cra.warden.domain.isolation.VerificationCheck;
import ca.gc.cra.warden.domain.isolation.VerificationResult;
import ca.gc.cra.warden.domain.path.AccessOperation;
import ca.gc.cra.warden.domain.path.SafePath;
import ca.gc.cra.warden.logging.Logs;
import ca.gc.cra.warden.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
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
 * <strong>What:</strong> Per-project zero-trust isolation: builds isolation boundaries, runs verification checks,
 * gates project access and scans recorded activity for threats.
 * <p><strong>Why:</strong> Boundary rules describe where a project may write; this layer verifies continuously that
 * the project still behaves like itself and revokes its isolation when it does not.</p>
 * <p><strong>Role:</strong> Top leaf subsystem. Uses {@link PathGuard} for root validation and
 * {@link BoundaryEngine} for sandboxes and integrity hashes; publishes threat, compromise, quarantine, alert and
 * unauthorized-access events.</p>
 * <p><strong>Thread-safety:</strong> Project registries are concurrent maps. Creation, removal, quarantine and
 * configuration backups run under the project's {@link ProjectLocks} entry. Periodic checks and threat scans run
 * on the security loop; the access gate runs on caller threads.</p>
 * <p><strong>Observability:</strong> Counts {@code zerotrust.verification.failure}, {@code zerotrust.breach} and
 * {@code zerotrust.threat}.</p>
 *
 * @since 0.1.0
 */
public final class ZeroTrustIsolation {
  private static final Logger log = LoggerFactory.getLogger(ZeroTrustIsolation.class);
  static final double COMPROMISE_THRESHOLD = 70.0;
  private static final double PASS_RECOVERY = 1.0;
  private static final long RATE_WINDOW_MILLIS = 60_000L;
  private static final long MIN_PERIOD_MILLIS = 1_000L;
  private static final int LOG_PATH_BYTES = 256;
  private static final String GITIGNORE = "# Warden runtime state\n.warden-cache/\n*.quarantined\n";
  private static final List<Pattern> ESCALATION_PATTERNS = List.of(
      // Elevation binaries only count inside a bin directory or as a command with arguments.
      Pattern.compile("(?i)(?:^|/)(?:usr/)?(?:local/)?s?bin/(?:sudo|su|doas|pkexec)$"),
      Pattern.compile("(?i)(?:^|[;&|]\\s*)(?:sudo|su|doas|pkexec)\\s+\\S"),
      Pattern.compile("(?i)\\bchmod\\s+[ugoa]*\\+s\\b"),
      Pattern.compile("(?i)\\bsetuid\\b"),
      Pattern.compile("(?:^|/)etc/sudoers(?:\\.d)?(?:/|$)"),
      Pattern.compile("(?:^|/)etc/shadow$"),
      Pattern.compile("(?:^|/)authorized_keys$"));

  private final PathGuard pathGuard;
  private final BoundaryEngine engine;
  private final ProjectLocks locks;
  private final EvidenceStorePort evidenceStore;
  private final ThreatScanner scanner;
  private final ZeroTrustSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SecurityEventSink events;

  private final ConcurrentMap<String, ProjectState> projects = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, QuarantineRecord> quarantined = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, PendingApproval> pending = new ConcurrentHashMap<>();
  private final Set<String> preAuthorized = ConcurrentHashMap.newKeySet();
  private final AtomicLong threatsDetected = new AtomicLong();
  private final AtomicLong breachAttempts = new AtomicLong();
  private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
  private volatile ScheduledExecutorService loop;

  /**
   * Creates the isolation layer with no projects.
   *
   * @param pathGuard path validation
   * @param engine boundary engine owning the project sandboxes
   * @param locks per-project locks shared with the orchestrator
   * @param evidenceStore backup target for configuration files
   * @param scanner threat rule evaluation
   * @param settings limits
   * @param clock time source
   * @param metrics metrics sink
   * @param events sink receiving isolation events
   */
  public ZeroTrustIsolation(
      PathGuard pathGuard,
      BoundaryEngine engine,
      ProjectLocks locks,
      EvidenceStorePort evidenceStore,
      ThreatScanner scanner,
      ZeroTrustSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      SecurityEventSink events) {
    this.pathGuard = Objects.requireNonNull(pathGuard, "pathGuard");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.evidenceStore = Objects.requireNonNull(evidenceStore, "evidenceStore");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
  }

  /**
   * Schedules periodic checks of every project plus the threat scan and configuration sweep.
   *
   * @param loop single-threaded security loop
   * @param threatScanIntervalMillis threat scan period
   */
  public synchronized void start(ScheduledExecutorService loop, long threatScanIntervalMillis) {
    this.loop = Objects.requireNonNull(loop, "loop");
    for (ProjectState state : projects.values()) {
      schedule(state, loop);
    }
    scheduled.add(loop.scheduleWithFixedDelay(
        this::monitorTick, threatScanIntervalMillis, threatScanIntervalMillis, TimeUnit.MILLISECONDS));
  }

  /** Cancels every scheduled check and scan. */
  public synchronized void stop() {
    scheduled.forEach(future -> future.cancel(false));
    scheduled.clear();
    projects.values().forEach(ProjectState::cancelTimers);
    loop = null;
  }

  /**
   * Isolates a new project.
   *
   * @param projectId project identifier
   * @param projectPath requested project root; relative paths resolve under {@code sandboxRoot/<projectId>}
   * @param level security level selecting mechanisms and checks
   * @return the new isolation boundary
   * @throws IllegalArgumentException when the id is malformed or the path is rejected
   * @throws IllegalStateException when the project is already isolated or quarantined, or its root cannot be
   *     prepared
   */
  public ProjectIsolationBoundary createProjectIsolation(String projectId, String projectPath, SecurityLevel level) {
    String id = Strings.requireProjectId(projectId);
    Objects.requireNonNull(level, "level");
    return locks.withLock(id, () -> create(id, projectPath, level));
  }

  private ProjectIsolationBoundary create(String projectId, String projectPath, SecurityLevel level) {
    if (projects.containsKey(projectId)) {
      throw new IllegalStateException("project already isolated: " + projectId);
    }
    if (quarantined.containsKey(projectId)) {
      throw new IllegalStateException("project is quarantined: " + projectId);
    }
    SafePath safe = pathGuard.validate(projectPath, projectId, AccessOperation.WRITE);
    if (!safe.safe()) {
      throw new IllegalArgumentException("project path rejected: " + String.join("; ", safe.violations()));
    }
    Path root = Path.of(safe.sanitizedPath());
    Instant now = clock.now();
    String boundaryId = BoundaryCatalog.sandboxId(projectId);
    try {
      Files.createDirectories(root);
      writeProjectFiles(root, projectId, level, boundaryId, now);
    } catch (IOException ex) {
      throw new IllegalStateException("unable to prepare project root " + root, ex);
    }
    ProjectIsolationBoundary boundary = IsolationCatalog.build(boundaryId, projectId, root, level, now);
    ProjectState state = new ProjectState(boundary, settings.activityHistoryLimit());
    pathGuard.registerProjectRoot(projectId, root);
    try {
      engine.addProjectSandbox(projectId, root);
    } catch (IllegalStateException ex) {
      pathGuard.unregisterProjectRoot(projectId);
      throw ex;
    }
    baselineConfiguration(state);
    projects.put(projectId, state);
    ScheduledExecutorService current = loop;
    if (current != null) {
      schedule(state, current);
    }
    log.info("zerotrust.project.isolated project={} level={} boundary={} root={}", projectId, level.wireName(),
        boundaryId, root);
    return boundary;
  }

  private static void writeProjectFiles(
      Path root, String projectId, SecurityLevel level, String boundaryId, Instant createdAt) throws IOException {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("projectId", projectId);
    config.put("securityLevel", level.wireName());
    config.put("boundaryId", boundaryId);
    config.put("createdAt", createdAt.toString());
    JsonDocuments.writeFile(root.resolve(ProjectState.CONFIG_FILE), config);
    Path gitignore = root.resolve(".gitignore");
    if (!Files.exists(gitignore, LinkOption.NOFOLLOW_LINKS)) {
      Files.writeString(gitignore, GITIGNORE, StandardCharsets.UTF_8);
    }
  }

  /**
   * Tears down a project's isolation, whether active or quarantined, so the id can be reused.
   *
   * @param projectId project identifier
   * @return {@code true} when anything was removed
   */
  public boolean removeProjectIsolation(String projectId) {
    Objects.requireNonNull(projectId, "projectId");
    return locks.withLock(projectId, () -> {
      ProjectState state = projects.remove(projectId);
      boolean wasQuarantined = quarantined.remove(projectId) != null;
      pending.values().removeIf(approval -> approval.projectId().equals(projectId));
      if (state == null) {
        return wasQuarantined;
      }
      state.cancelTimers();
      engine.removeProjectSandbox(projectId);
      pathGuard.unregisterProjectRoot(projectId);
      log.info("zerotrust.project.removed project={}", projectId);
      return true;
    });
  }

  /**
   * Revokes a project's isolation: cancels its checks, removes its sandbox and rejects all later access.
   *
   * <p>Repeated calls have no further effect. Nothing is published; callers that did not originate the quarantine
   * themselves report it.</p>
   *
   * @param projectId project identifier
   * @param reason quarantine reason
   * @return {@code true} when this call quarantined the project
   */
  public boolean quarantineProject(String projectId, String reason) {
    Objects.requireNonNull(projectId, "projectId");
    String why = reason == null ? "unspecified" : reason;
    return locks.withLock(projectId, () -> {
      ProjectState state = projects.remove(projectId);
      if (state == null) {
        return false;
      }
      state.cancelTimers();
      engine.removeProjectSandbox(projectId);
      pathGuard.unregisterProjectRoot(projectId);
      quarantined.put(projectId, new QuarantineRecord(projectId, why, clock.now(), state.root()));
      log.warn("zerotrust.project.quarantined project={} reason={}", projectId, why);
      return true;
    });
  }

  private void selfQuarantine(String projectId, String reason) {
    if (quarantineProject(projectId, reason)) {
      events.publish(new SecurityEvent.ProjectQuarantined(clock.now(), projectId, reason));
    }
  }

  /**
   * Checks an access against the project's gate without publishing the denial event.
   *
   * @param projectId accessing project
   * @param operation requested operation
   * @param targetPath requested target; relative paths resolve under the project root
   * @return verdict carrying the unauthorized-access event when denied
   * @throws IllegalArgumentException when the project was never isolated
   */
  public AccessVerdict verifyAccess(String projectId, AccessOperation operation, String targetPath) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(operation, "operation");
    String target = targetPath == null ? "" : targetPath;
    if (quarantined.containsKey(projectId)) {
      return deny(null, projectId, operation, target, "project is quarantined", List.of());
    }
    ProjectState state = projects.get(projectId);
    if (state == null) {
      throw new IllegalArgumentException("unknown project: " + projectId);
    }
    Optional<Path> resolved = resolve(state, target);
    if (resolved.isEmpty()) {
      return deny(state, projectId, operation, target, "invalid target path", List.of());
    }
    Path path = resolved.get();
    recordActivity(state, operation, path);
    String key = path.toString();
    if (state.blocks(key)) {
      return deny(state, projectId, operation, target, "access to target blocked", List.of());
    }
    if (operation.mutating() && state.freezes(key)) {
      return deny(state, projectId, operation, target, "modification of target blocked", List.of());
    }
    if (state.rateLimited()
        && state.activity().countSince(clock.now().minusMillis(RATE_WINDOW_MILLIS)) > settings.rateLimitPerMinute()) {
      return deny(state, projectId, operation, target, "rate limit exceeded", List.of());
    }
    List<VerificationResult> results = new ArrayList<>();
    CheckInput input = new CheckInput(target, path);
    for (VerificationCheck check : state.boundary().verificationChecks()) {
      if (!check.runsOnAccess()) {
        continue;
      }
      VerificationResult result = verify(state, check, input);
      results.add(result);
      if (result.deniesAccess()) {
        return deny(state, projectId, operation, target, check.checkName() + " failed: " + result.detail(),
            results);
      }
    }
    return new AccessVerdict(true, "allowed", results, null);
  }

  /**
   * Per-access gate; a denial always publishes an unauthorized-access event.
   *
   * @param projectId accessing project
   * @param operation requested operation
   * @param targetPath requested target
   * @return {@code true} when the access may proceed
   * @throws IllegalArgumentException when the project was never isolated
   */
  public boolean validateProjectAccess(String projectId, AccessOperation operation, String targetPath) {
    AccessVerdict verdict = verifyAccess(projectId, operation, targetPath);
    verdict.eventIfAny().ifPresent(events::publish);
    return verdict.allowed();
  }

  private AccessVerdict deny(
      ProjectState state,
      String projectId,
      AccessOperation operation,
      String target,
      String reason,
      List<VerificationResult> results) {
    if (state != null) {
      state.boundary().metrics().recordBreachAttempt();
    }
    breachAttempts.incrementAndGet();
    metrics.increment("zerotrust.breach");
    log.warn("zerotrust.access.denied project={} op={} reason={} target={}", projectId, operation.wireName(),
        reason, Logs.truncate(target, LOG_PATH_BYTES));
    SecurityEvent.UnauthorizedAccess event =
        new SecurityEvent.UnauthorizedAccess(clock.now(), projectId, operation, target, reason);
    return new AccessVerdict(false, reason, results, event);
  }

  /**
   * Records an access attempt that was decided elsewhere so threat scans still see it.
   *
   * @param projectId accessing project; ignored unless active
   * @param operation requested operation
   * @param targetPath requested target
   */
  public void recordActivity(String projectId, AccessOperation operation, String targetPath) {
    if (projectId == null || operation == null || targetPath == null) {
      return;
    }
    ProjectState state = projects.get(projectId);
    if (state != null) {
      resolve(state, targetPath).ifPresent(path -> recordActivity(state, operation, path));
    }
  }

  private void recordActivity(ProjectState state, AccessOperation operation, Path target) {
    boolean created = operation == AccessOperation.WRITE && !Files.exists(target, LinkOption.NOFOLLOW_LINKS);
    String descriptor = BoundaryCatalog.sandboxId(state.projectId()) + ":.->" + scopeOf(target);
    state.activity().append(new ActivityRecord(
        clock.now(), state.projectId(), operation, target.toString(), descriptor, created));
  }

  private String scopeOf(Path target) {
    return engine.boundaryContaining(target)
        .map(boundary -> boundary.boundaryId() + ":" + relative(boundary.rootPath(), target))
        .orElse("external:" + target);
  }

  private static String relative(Path root, Path target) {
    return root.relativize(target).toString().replace('\\', '/');
  }

  private static Optional<Path> resolve(ProjectState state, String target) {
    try {
      Path path = Path.of(target);
      if (!path.isAbsolute()) {
        path = state.root().resolve(path);
      }
      return Optional.of(path.normalize());
    } catch (InvalidPathException ex) {
      log.debug("Unparseable target {} for project {}", Logs.truncate(target, LOG_PATH_BYTES),
          state.projectId(), ex);
      return Optional.empty();
    }
  }

  /**
   * Runs one verification check of a project immediately, as its timer would.
   *
   * @param projectId project identifier
   * @param kind check to run
   * @return check result
   * @throws IllegalArgumentException when the project is not active or has no such check
   */
  public VerificationResult runVerification(String projectId, CheckKind kind) {
    ProjectState state = requireActive(projectId);
    VerificationCheck check = state.boundary().check(Objects.requireNonNull(kind, "kind"))
        .orElseThrow(() -> new IllegalArgumentException("project " + projectId + " has no " + kind.wireName()
            + " check"));
    return verify(state, check, CheckInput.NONE);
  }

  private VerificationResult verify(ProjectState state, VerificationCheck check, CheckInput input) {
    Optional<String> failure;
    try {
      failure = runCheck(state, check.kind(), input);
    } catch (IOException | RuntimeException ex) {
      log.warn("Verification {} errored for project {}", check.checkName(), state.projectId(), ex);
      failure = Optional.of("check error: " + ex.getMessage());
    }
    Instant now = clock.now();
    BoundaryMetrics counters = state.boundary().metrics();
    if (failure.isEmpty()) {
      double score = counters.recordPass(PASS_RECOVERY, now);
      state.resetFailures(check.kind());
      state.markCompromised(score < COMPROMISE_THRESHOLD);
      return new VerificationResult(check.checkName(), check.kind(), true, "ok", null, now);
    }
    String detail = failure.get();
    int checkCount = Math.max(1, state.boundary().verificationChecks().size());
    double score = counters.recordFailure(100.0 / checkCount, now);
    metrics.increment("zerotrust.verification.failure");
    int streak = state.recordFailure(check.kind(), now, check.failureWindowMillis());
    log.warn("zerotrust.verification.failure project={} check={} streak={} score={} detail={}", state.projectId(),
        check.checkName(), streak, score, Logs.truncate(detail, LOG_PATH_BYTES));
    FailureAction fired = null;
    if (streak >= check.failureThreshold()) {
      state.resetFailures(check.kind());
      fired = check.failureAction();
    }
    if (state.markCompromised(score < COMPROMISE_THRESHOLD)) {
      events.publish(new SecurityEvent.BoundaryCompromised(
          now, state.projectId(), score, check.checkName() + ": " + detail));
    }
    if (fired != null) {
      onFailureAction(state, check, fired, detail);
    }
    return new VerificationResult(check.checkName(), check.kind(), false, detail, fired, now);
  }

  private void onFailureAction(ProjectState state, VerificationCheck check, FailureAction action, String detail) {
    switch (action) {
      case LOG -> log.info("zerotrust.verification.logged project={} check={} detail={}", state.projectId(),
          check.checkName(), detail);
      case ALERT -> events.publish(
          new SecurityEvent.VerificationAlert(clock.now(), state.projectId(), check.checkName(), detail));
      case BLOCK -> log.debug("Check {} blocks the triggering access of project {}", check.checkName(),
          state.projectId());
      case QUARANTINE -> selfQuarantine(state.projectId(), check.checkName() + " failed: " + detail);
    }
  }

  private Optional<String> runCheck(ProjectState state, CheckKind kind, CheckInput input) throws IOException {
    return switch (kind) {
      case FILESYSTEM_INTEGRITY -> filesystemIntegrity(state);
      case CROSS_PROJECT_ACCESS -> crossProjectAccess(state, input);
      case PRIVILEGE_ESCALATION -> privilegeEscalation(input);
      case CONFIGURATION_INTEGRITY -> configurationIntegrity(state);
    };
  }

  private Optional<String> filesystemIntegrity(ProjectState state) {
    if (!Files.isDirectory(state.root())) {
      return Optional.of("project root missing");
    }
    for (String entry : BoundaryCatalog.FORBIDDEN_PROJECT_ENTRIES) {
      if (Files.exists(state.root().resolve(entry), LinkOption.NOFOLLOW_LINKS)) {
        return Optional.of("forbidden entry present: " + entry);
      }
    }
    if (engine.checkIntegrity(state.boundary().boundaryId()).isPresent()) {
      return Optional.of("content hash changed outside recorded activity");
    }
    return Optional.empty();
  }

  private Optional<String> crossProjectAccess(ProjectState state, CheckInput input) {
    Optional<String> active = engine.executionContext().activeProject();
    if (active.isPresent() && !active.get().equals(state.projectId())) {
      return Optional.of("active execution context belongs to project " + active.get());
    }
    if (input.target() != null) {
      Optional<String> owner = pathGuard.owningProject(input.target());
      if (owner.isPresent() && !owner.get().equals(state.projectId())) {
        return Optional.of("target belongs to project " + owner.get());
      }
    }
    return Optional.empty();
  }

  private static Optional<String> privilegeEscalation(CheckInput input) {
    if (input.target() == null) {
      return Optional.empty();
    }
    String normalized = input.target().toString().replace('\\', '/');
    for (Pattern pattern : ESCALATION_PATTERNS) {
      if (pattern.matcher(input.raw()).find() || pattern.matcher(normalized).find()) {
        return Optional.of("escalation pattern matched: " + pattern.pattern());
      }
    }
    return Optional.empty();
  }

  private static Optional<String> configurationIntegrity(ProjectState state) throws IOException {
    Path config = state.configFile();
    if (!Files.isRegularFile(config, LinkOption.NOFOLLOW_LINKS)) {
      return Optional.of("configuration file missing");
    }
    Map<String, Object> document;
    try {
      document = JsonDocuments.parseObject(Files.readString(config, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      return Optional.of("configuration file unreadable: " + ex.getMessage());
    }
    Object named = document.get("projectId");
    if (!state.projectId().equals(named)) {
      return Optional.of("configuration names project " + named);
    }
    if (!DirectoryHasher.hashFile(config).equals(state.configHash())) {
      return Optional.of("configuration hash changed");
    }
    return Optional.empty();
  }

  private void baselineConfiguration(ProjectState state) {
    try {
      state.configHash(DirectoryHasher.hashFile(state.configFile()));
    } catch (IOException ex) {
      log.warn("Unable to baseline configuration of project {}", state.projectId(), ex);
      state.configHash(DirectoryHasher.ABSENT);
    }
    state.configSignature(signature(state.configFile()));
  }

  private static String signature(Path file) {
    try {
      BasicFileAttributes attributes =
          Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      return attributes.size() + ":" + attributes.lastModifiedTime().toMillis();
    } catch (IOException ex) {
      return DirectoryHasher.ABSENT;
    }
  }

  /**
   * Runs on-change configuration checks of projects whose configuration file changed since the last sweep.
   *
   * @return results of the checks that ran
   */
  public List<VerificationResult> sweepConfigurationChanges() {
    List<VerificationResult> results = new ArrayList<>();
    for (ProjectState state : List.copyOf(projects.values())) {
      Optional<VerificationCheck> check = state.boundary().check(CheckKind.CONFIGURATION_INTEGRITY)
          .filter(candidate -> candidate.frequency() == CheckFrequency.ON_CHANGE);
      if (check.isEmpty()) {
        continue;
      }
      String current = signature(state.configFile());
      if (!current.equals(state.configSignature())) {
        state.configSignature(current);
        results.add(verify(state, check.get(), CheckInput.NONE));
      }
    }
    return results;
  }

  /**
   * Evaluates threat rules against the activity each project recorded since the previous scan.
   *
   * @return threats detected in this pass, already published
   */
  public List<SecurityEvent.ThreatDetected> scanThreats() {
    List<SecurityEvent.ThreatDetected> detected = new ArrayList<>();
    for (ProjectState state : List.copyOf(projects.values())) {
      ActivityLog.Batch batch = state.activity().since(state.scanCursor());
      state.scanCursor(batch.nextCursor());
      for (ThreatMatch match : scanner.scan(batch.records())) {
        SecurityEvent.ThreatDetected event = new SecurityEvent.ThreatDetected(
            clock.now(), state.projectId(), match.rule(), match.pattern(), match.evidence());
        threatsDetected.incrementAndGet();
        metrics.increment("zerotrust.threat");
        log.warn("zerotrust.threat project={} rule={} category={} confidence={} evidence={}", state.projectId(),
            match.rule().ruleId(), match.rule().category().wireName(), match.pattern().confidence(),
            match.evidence());
        events.publish(event);
        detected.add(event);
        respond(state.projectId(), match);
      }
    }
    return detected;
  }

  private void respond(String projectId, ThreatMatch match) {
    for (ThreatResponse response : match.rule().responseActions()) {
      if (!projects.containsKey(projectId)) {
        return;
      }
      boolean gated = !response.automatic() || response.requiresApproval();
      if (gated && !preAuthorized.contains(authorizationKey(projectId, response.action()))) {
        Instant now = clock.now();
        PendingApproval approval = new PendingApproval(Ids.next("APR", now.toEpochMilli()), projectId,
            match.rule().ruleId(), response.action(), now, match.target());
        pending.put(approval.approvalId(), approval);
        log.info("zerotrust.approval.queued id={} project={} rule={} action={}", approval.approvalId(), projectId,
            approval.ruleId(), response.action().wireName());
        continue;
      }
      executeResponse(projectId, match.rule().ruleId(), response.action(), match.target());
    }
  }

  private void executeResponse(String projectId, String ruleId, ThreatResponseKind action, String target) {
    ProjectState state = projects.get(projectId);
    if (state == null) {
      log.info("Skipping {} for project {}; project is not active", action.wireName(), projectId);
      return;
    }
    try {
      switch (action) {
        case BLOCK_ACCESS, IMMEDIATE_BLOCK -> {
          if (target != null) {
            blockAccess(projectId, target);
          }
        }
        case QUARANTINE_PROJECT -> selfQuarantine(projectId, "threat rule " + ruleId);
        case ALERT_SECURITY_TEAM -> log.warn("zerotrust.threat.alert project={} rule={}", projectId, ruleId);
        case BLOCK_MODIFICATION -> {
          if (target != null) {
            state.freeze(target);
          }
        }
        case BACKUP_CONFIGURATION -> locks.run(projectId, () -> backupConfiguration(state));
        case RATE_LIMIT -> state.rateLimited(true);
        case RESOURCE_MONITORING -> enhanceMonitoring(projectId);
      }
      log.info("zerotrust.response project={} rule={} action={}", projectId, ruleId, action.wireName());
    } catch (RuntimeException ex) {
      log.warn("Threat response {} failed for project {}", action.wireName(), projectId, ex);
    }
  }

  private void backupConfiguration(ProjectState state) {
    if (!Files.exists(state.configFile(), LinkOption.NOFOLLOW_LINKS)) {
      log.warn("No configuration to back up for project {}", state.projectId());
      return;
    }
    try {
      Path copy = evidenceStore.backupFile(state.projectId(), state.configFile());
      log.info("zerotrust.config.backup project={} copy={}", state.projectId(), copy);
    } catch (IOException ex) {
      log.warn("Configuration backup failed for project {}", state.projectId(), ex);
    }
  }

  /**
   * Allows responses of {@code action} for {@code projectId} to run without queueing for approval.
   *
   * @param projectId project identifier
   * @param action response action
   */
  public void preAuthorize(String projectId, ThreatResponseKind action) {
    preAuthorized.add(authorizationKey(Objects.requireNonNull(projectId, "projectId"),
        Objects.requireNonNull(action, "action")));
  }

  /**
   * Runs a queued response.
   *
   * @param approvalId queued approval
   * @return the approval that ran
   * @throws IllegalArgumentException when no such approval is queued
   */
  public PendingApproval approve(String approvalId) {
    PendingApproval approval = pending.remove(Objects.requireNonNull(approvalId, "approvalId"));
    if (approval == null) {
      throw new IllegalArgumentException("unknown approval: " + approvalId);
    }
    log.info("zerotrust.approval.granted id={} project={} action={}", approvalId, approval.projectId(),
        approval.action().wireName());
    executeResponse(approval.projectId(), approval.ruleId(), approval.action(), approval.target());
    return approval;
  }

  public List<PendingApproval> pendingApprovals() {
    return pending.values().stream()
        .sorted(Comparator.comparing(PendingApproval::requestedAt).thenComparing(PendingApproval::approvalId))
        .toList();
  }

  private static String authorizationKey(String projectId, ThreatResponseKind action) {
    return projectId + '|' + action.name();
  }

  /**
   * Halves the periods of the project's periodic checks, never below one second.
   *
   * @param projectId project identifier
   * @return {@code false} when monitoring was already enhanced
   * @throws IllegalArgumentException when the project is not active
   */
  public boolean enhanceMonitoring(String projectId) {
    ProjectState state = requireActive(projectId);
    synchronized (state) {
      if (state.enhanced()) {
        return false;
      }
      state.enhanced(true);
    }
    ScheduledExecutorService current = loop;
    if (current != null && state.hasTimers()) {
      state.cancelTimers();
      schedule(state, current);
    }
    log.info("zerotrust.monitoring.enhanced project={}", projectId);
    return true;
  }

  /**
   * Marks the project's network access as isolated.
   *
   * @param projectId project identifier
   * @return {@code false} when already isolated
   * @throws IllegalArgumentException when the project is not active
   */
  public boolean isolateNetwork(String projectId) {
    ProjectState state = requireActive(projectId);
    synchronized (state) {
      if (state.networkIsolated()) {
        return false;
      }
      state.networkIsolated(true);
    }
    log.warn("zerotrust.network.isolated project={}", projectId);
    return true;
  }

  /**
   * Denies all later access of the project to {@code targetPath}.
   *
   * @param projectId project identifier
   * @param targetPath target to block; relative paths resolve under the project root
   * @throws IllegalArgumentException when the project is not active or the path cannot be parsed
   */
  public void blockAccess(String projectId, String targetPath) {
    ProjectState state = requireActive(projectId);
    Path path = resolve(state, Objects.requireNonNull(targetPath, "targetPath"))
        .orElseThrow(() -> new IllegalArgumentException("invalid target path"));
    state.block(path.toString());
    log.warn("zerotrust.access.blocked project={} target={}", projectId,
        Logs.truncate(path.toString(), LOG_PATH_BYTES));
  }

  private void monitorTick() {
    try {
      sweepConfigurationChanges();
    } catch (RuntimeException ex) {
      log.warn("Configuration sweep failed", ex);
    }
    try {
      scanThreats();
    } catch (RuntimeException ex) {
      log.warn("Threat scan failed", ex);
    }
  }

  private void schedule(ProjectState state, ScheduledExecutorService executor) {
    String projectId = state.projectId();
    for (VerificationCheck check : state.boundary().verificationChecks()) {
      if (check.frequency() != CheckFrequency.PERIODIC) {
        continue;
      }
      long period = state.enhanced() ? Math.max(MIN_PERIOD_MILLIS, check.periodMillis() / 2) : check.periodMillis();
      state.addTimer(executor.scheduleWithFixedDelay(
          () -> runScheduled(projectId, check), period, period, TimeUnit.MILLISECONDS));
    }
  }

  private void runScheduled(String projectId, VerificationCheck check) {
    ProjectState state = projects.get(projectId);
    if (state == null) {
      return;
    }
    try {
      verify(state, check, CheckInput.NONE);
    } catch (RuntimeException ex) {
      log.warn("Scheduled check {} failed for project {}", check.checkName(), projectId, ex);
    }
  }

  private ProjectState requireActive(String projectId) {
    ProjectState state = projects.get(Objects.requireNonNull(projectId, "projectId"));
    if (state == null) {
      throw new IllegalArgumentException("project is not active: " + projectId);
    }
    return state;
  }

  public boolean isActive(String projectId) {
    return projectId != null && projects.containsKey(projectId);
  }

  public boolean isQuarantined(String projectId) {
    return projectId != null && quarantined.containsKey(projectId);
  }

  public Optional<ProjectIsolationBoundary> boundary(String projectId) {
    ProjectState state = projectId == null ? null : projects.get(projectId);
    return state == null ? Optional.empty() : Optional.of(state.boundary());
  }

  /**
   * Root of an active or quarantined project.
   *
   * @param projectId project identifier
   * @return project root when the project is known
   */
  public Optional<Path> projectRoot(String projectId) {
    if (projectId == null) {
      return Optional.empty();
    }
    ProjectState state = projects.get(projectId);
    if (state != null) {
      return Optional.of(state.root());
    }
    QuarantineRecord record = quarantined.get(projectId);
    return record == null ? Optional.empty() : Optional.of(record.projectRoot());
  }

  public List<String> activeProjects() {
    return projects.keySet().stream().sorted().toList();
  }

  public List<String> quarantinedProjects() {
    return quarantined.keySet().stream().sorted().toList();
  }

  /**
   * Most recent accesses of a project, newest first.
   *
   * @param projectId project identifier
   * @param limit maximum number returned
   * @return activity, empty for inactive projects
   */
  public List<ActivityRecord> recentActivity(String projectId, int limit) {
    ProjectState state = projectId == null ? null : projects.get(projectId);
    return state == null ? List.of() : state.activity().recent(limit);
  }

  public long threatsDetected() {
    return threatsDetected.get();
  }

  /**
   * Mean integrity score over active projects.
   *
   * @return score in [0,100]; 100 when no project is active
   */
  public double healthScore() {
    return projects.values().stream()
        .mapToDouble(state -> state.boundary().metrics().integrityScore())
        .average()
        .orElse(100.0);
  }

  /**
   * Builds the zero-trust section of the security report.
   *
   * @return JSON-compatible document
   */
  public Map<String, Object> report() {
    List<Map<String, Object>> active = new ArrayList<>();
    for (String projectId : activeProjects()) {
      ProjectState state = projects.get(projectId);
      if (state == null) {
        continue;
      }
      ProjectIsolationBoundary boundary = state.boundary();
      BoundaryMetrics.Snapshot counters = boundary.metrics().snapshot();
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("project_id", projectId);
      entry.put("boundary_id", boundary.boundaryId());
      entry.put("security_level", boundary.securityLevel().wireName());
      entry.put("boundary_type", boundary.boundaryType().wireName());
      entry.put("project_root", boundary.projectRoot().toString());
      entry.put("created_at", boundary.createdAt().toString());
      entry.put("enforcement_mechanisms",
          boundary.enforcementMechanisms().stream().map(EnforcementMechanism::mechanism).toList());
      List<Map<String, Object>> checks = new ArrayList<>();
      for (VerificationCheck check : boundary.verificationChecks()) {
        Map<String, Object> checkEntry = new LinkedHashMap<>();
        checkEntry.put("check_name", check.checkName());
        checkEntry.put("frequency", check.frequency().wireName());
        checkEntry.put("failure_action", check.failureAction().wireName());
        checks.add(checkEntry);
      }
      entry.put("verification_checks", checks);
      entry.put("boundary_integrity_score", counters.boundaryIntegrityScore());
      entry.put("breach_attempts", counters.breachAttempts());
      entry.put("verification_failures", counters.verificationFailures());
      entry.put("last_verification",
          counters.lastVerification() == null ? null : counters.lastVerification().toString());
      entry.put("enhanced_monitoring", state.enhanced());
      entry.put("network_isolated", state.networkIsolated());
      entry.put("rate_limited", state.rateLimited());
      entry.put("blocked_targets", state.blockedTargets().size());
      active.add(entry);
    }
    List<Map<String, Object>> quarantine = new ArrayList<>();
    quarantined.values().stream()
        .sorted(Comparator.comparing(QuarantineRecord::projectId))
        .forEach(record -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("project_id", record.projectId());
          entry.put("reason", record.reason());
          entry.put("quarantined_at", record.quarantinedAt().toString());
          entry.put("project_root", record.projectRoot().toString());
          quarantine.add(entry);
        });
    List<Map<String, Object>> approvals = new ArrayList<>();
    for (PendingApproval approval : pendingApprovals()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("approval_id", approval.approvalId());
      entry.put("project_id", approval.projectId());
      entry.put("rule_id", approval.ruleId());
      entry.put("action", approval.action().wireName());
      entry.put("requested_at", approval.requestedAt().toString());
      approvals.add(entry);
    }
    Map<String, Object> statistics = new LinkedHashMap<>();
    statistics.put("active_projects", active.size());
    statistics.put("quarantined_projects", quarantine.size());
    statistics.put("threats_detected", threatsDetected.get());
    statistics.put("breach_attempts", breachAttempts.get());
    statistics.put("threat_rules", scanner.rules().size());

    Map<String, Object> report = new LinkedHashMap<>();
    report.put("projects", active);
    report.put("quarantined", quarantine);
    report.put("pending_approvals", approvals);
    report.put("statistics", statistics);
    report.put("health_score", healthScore());
    return report;
  }

  private record CheckInput(String raw, Path target) {
    static final CheckInput NONE = new CheckInput("", null);
  }

  private record QuarantineRecord(String projectId, String reason, Instant quarantinedAt, Path projectRoot) {}
}
