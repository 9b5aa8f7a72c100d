package ca.gc.cra.warden.testing;

import ca.gc.cra.warden.application.boundary.BoundaryEngine;
import ca.gc.cra.warden.application.boundary.BoundaryEngineSettings;
import ca.gc.cra.warden.application.boundary.EnforcementMode;
import ca.gc.cra.warden.application.boundary.ExecutionContext;
import ca.gc.cra.warden.application.boundary.ViolationEnforcer;
import ca.gc.cra.warden.application.events.SecurityEventBus;
import ca.gc.cra.warden.application.isolation.ThreatRuleCatalog;
import ca.gc.cra.warden.application.isolation.ThreatScanner;
import ca.gc.cra.warden.application.isolation.ZeroTrustIsolation;
import ca.gc.cra.warden.application.isolation.ZeroTrustSettings;
import ca.gc.cra.warden.application.orchestrator.OrchestratorSettings;
import ca.gc.cra.warden.application.orchestrator.PostureAggregator;
import ca.gc.cra.warden.application.orchestrator.SecurityOrchestrator;
import ca.gc.cra.warden.application.path.PathGuard;
import ca.gc.cra.warden.application.path.PathGuardSettings;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import ca.gc.cra.warden.infrastructure.audit.NdjsonAuditLogAdapter;
import ca.gc.cra.warden.infrastructure.events.InMemorySecurityNotifier;
import ca.gc.cra.warden.infrastructure.evidence.FileEvidenceStore;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.infrastructure.fs.PollingDirectoryWatcher;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the full security core over a temporary directory with a manual clock and an immediate watcher.
 *
 * <p>Layout under the root: {@code framework/}, {@code home/} (quarantine, forensics, evidence, backups and the
 * audit log live here) and {@code sandbox/}. Nothing is scheduled; tests drive polls, checks and drains
 * themselves.</p>
 */
public final class SecurityCoreFixture implements AutoCloseable {
  private final Path root;
  private final Path frameworkRoot;
  private final Path home;
  private final Path sandboxRoot;
  private final MutableClock clock = new MutableClock();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final SecurityEventBus eventBus;
  private final PathGuard pathGuard;
  private final BoundaryEngine engine;
  private final FileEvidenceStore evidenceStore;
  private final ZeroTrustIsolation zeroTrust;
  private final InMemorySecurityNotifier notifier = new InMemorySecurityNotifier();
  private final NdjsonAuditLogAdapter auditLog;
  private final SecurityOrchestrator orchestrator;

  public SecurityCoreFixture(Path root) {
    this(root, EnforcementMode.ENFORCE);
  }

  public SecurityCoreFixture(Path root, EnforcementMode mode) {
    this.root = root.toAbsolutePath().normalize();
    this.frameworkRoot = this.root.resolve("framework");
    this.home = this.root.resolve("home");
    this.sandboxRoot = this.root.resolve("sandbox");
    try {
      Files.createDirectories(frameworkRoot.resolve("docs"));
      Files.createDirectories(home);
      Files.createDirectories(sandboxRoot);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    this.eventBus = new SecurityEventBus(1_000, metrics);
    ProjectLocks locks = new ProjectLocks();
    this.pathGuard = new PathGuard(
        PathGuardSettings.of(frameworkRoot, home, sandboxRoot, List.of(), 100), clock, metrics, eventBus);
    this.engine = new BoundaryEngine(
        new BoundaryEngineSettings(home, true, 100),
        pathGuard,
        new PollingDirectoryWatcher(clock, 0),
        new ExecutionContext(),
        new ViolationEnforcer(mode, quarantineDir(), clock, metrics),
        clock,
        metrics,
        eventBus);
    this.evidenceStore = new FileEvidenceStore(
        home.resolve("forensics"), home.resolve("evidence"), home.resolve("backups"), clock);
    this.zeroTrust = new ZeroTrustIsolation(
        pathGuard,
        engine,
        locks,
        evidenceStore,
        new ThreatScanner(ThreatRuleCatalog.defaults(), 0.5, () -> 0.1),
        ZeroTrustSettings.defaults(),
        clock,
        metrics,
        eventBus);
    this.auditLog = new NdjsonAuditLogAdapter(home.resolve("audit").resolve("incidents.ndjson"));
    this.orchestrator = new SecurityOrchestrator(
        new OrchestratorSettings(1_000, 60_000, 60_000, 1_000, 60_000, 20),
        pathGuard,
        engine,
        zeroTrust,
        eventBus,
        auditLog,
        evidenceStore,
        notifier,
        locks,
        () -> List.of("recent log line"),
        PostureAggregator.MEAN,
        () -> ExecutorFactories.newSecurityLoop("warden-test"),
        clock,
        metrics);
    engine.initialize();
  }

  public ProjectIsolationBoundary isolate(String projectId) {
    return isolate(projectId, SecurityLevel.STANDARD);
  }

  public ProjectIsolationBoundary isolate(String projectId, SecurityLevel level) {
    return zeroTrust.createProjectIsolation(projectId, sandboxRoot.resolve(projectId).toString(), level);
  }

  /**
   * Removes every queued event without creating incidents.
   *
   * @return drained events in publication order
   */
  public List<SecurityEvent> drainEvents() {
    List<SecurityEvent> drained = new ArrayList<>();
    eventBus.drain(drained::add);
    return drained;
  }

  public Path root() {
    return root;
  }

  public Path frameworkRoot() {
    return frameworkRoot;
  }

  public Path home() {
    return home;
  }

  public Path sandboxRoot() {
    return sandboxRoot;
  }

  public Path quarantineDir() {
    return home.resolve("quarantine");
  }

  public MutableClock clock() {
    return clock;
  }

  public RecordingMetricsPort metrics() {
    return metrics;
  }

  public SecurityEventBus eventBus() {
    return eventBus;
  }

  public PathGuard pathGuard() {
    return pathGuard;
  }

  public BoundaryEngine engine() {
    return engine;
  }

  public FileEvidenceStore evidenceStore() {
    return evidenceStore;
  }

  public ZeroTrustIsolation zeroTrust() {
    return zeroTrust;
  }

  public InMemorySecurityNotifier notifier() {
    return notifier;
  }

  public NdjsonAuditLogAdapter auditLog() {
    return auditLog;
  }

  public SecurityOrchestrator orchestrator() {
    return orchestrator;
  }

  @Override
  public void close() throws IOException {
    orchestrator.stop();
    auditLog.close();
  }
}
