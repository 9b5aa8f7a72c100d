package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.boundary.BoundaryEngine;
import ca.gc.cra.warden.application.boundary.BoundaryEngineSettings;
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
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityNotificationPort;
import ca.gc.cra.warden.application.util.ProjectLocks;
import ca.gc.cra.warden.infrastructure.audit.NdjsonAuditLogAdapter;
import ca.gc.cra.warden.infrastructure.events.LoggingSecurityNotifier;
import ca.gc.cra.warden.infrastructure.evidence.FileEvidenceStore;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.infrastructure.fs.PollingDirectoryWatcher;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.logging.RecentLogBuffer;
import ca.gc.cra.warden.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the security core to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link WardenConfig} into a running object
 * graph.</p>
 * <p><strong>Role:</strong> Builds path validation, boundary enforcement, project isolation and the orchestrator,
 * sharing one clock, one metrics port, one event channel and one set of project locks.</p>
 * <p><strong>Thread-safety:</strong> Construct and close on a single thread during startup and shutdown.</p>
 * <p><strong>Observability:</strong> Installs the recent log buffer and, when configured, verbose logging.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final String LOOP_THREAD_PREFIX = "warden-security";
  private static final int VIOLATION_HISTORY_LIMIT = 1_000;
  private static final int EVIDENCE_INCIDENTS = 20;

  private final WardenConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final NdjsonAuditLogAdapter auditLog;
  private final SecurityOrchestrator orchestrator;

  /**
   * Wires the graph with OpenTelemetry metrics and logging notifications.
   *
   * @param config runtime configuration
   */
  public CompositionRoot(WardenConfig config) {
    this(config, ClockPort.SYSTEM, new OpenTelemetryMetricsAdapter(), null);
  }

  /**
   * Wires the graph with explicit clock, metrics and notifier.
   *
   * @param config runtime configuration
   * @param clock time source
   * @param metrics metrics sink
   * @param notifier outbound notifications; {@code null} selects {@link LoggingSecurityNotifier}
   * @throws IllegalArgumentException when the warden home or sandbox root cannot be used as a writable directory
   */
  public CompositionRoot(
      WardenConfig config, ClockPort clock, MetricsPort metrics, SecurityNotificationPort notifier) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Optional<RecentLogBuffer> recentLogs = LoggingConfigurator.installRecentLogBuffer(config.recentLogCapacity());
    Supplier<List<String>> recentLogLines = recentLogs
        .<Supplier<List<String>>>map(buffer -> () -> buffer.recent(config.recentLogCapacity()))
        .orElse(List::of);

    Paths.validateWritableDir(config.wardenHome(), null, true);
    Paths.validateWritableDir(config.sandboxRoot(), null, true);

    SecurityEventBus eventBus = new SecurityEventBus(config.eventQueueCapacity(), metrics);
    ProjectLocks locks = new ProjectLocks();
    PathGuard pathGuard = new PathGuard(pathGuardSettings(config), clock, metrics, eventBus);
    BoundaryEngine engine = new BoundaryEngine(
        new BoundaryEngineSettings(Path.of(System.getProperty("user.home")), true, VIOLATION_HISTORY_LIMIT),
        pathGuard,
        new PollingDirectoryWatcher(clock, config.watchStableMillis()),
        new ExecutionContext(),
        new ViolationEnforcer(config.enforcementMode(), config.quarantineDir(), clock, metrics),
        clock,
        metrics,
        eventBus);
    EvidenceStorePort evidenceStore =
        new FileEvidenceStore(config.forensicsDir(), config.evidenceDir(), config.backupDir(), clock);
    ZeroTrustIsolation zeroTrust = new ZeroTrustIsolation(
        pathGuard,
        engine,
        locks,
        evidenceStore,
        new ThreatScanner(ThreatRuleCatalog.defaults(), config.threatConfidenceThreshold(),
            ThreatScanner.runtimeHeapUsage()),
        ZeroTrustSettings.defaults(),
        clock,
        metrics,
        eventBus);
    this.auditLog = new NdjsonAuditLogAdapter(config.auditLog());
    this.orchestrator = new SecurityOrchestrator(
        orchestratorSettings(config),
        pathGuard,
        engine,
        zeroTrust,
        eventBus,
        auditLog,
        evidenceStore,
        notifier == null ? new LoggingSecurityNotifier(metrics) : notifier,
        locks,
        recentLogLines,
        PostureAggregator.MEAN,
        () -> ExecutorFactories.newSecurityLoop(LOOP_THREAD_PREFIX),
        clock,
        metrics);
    engine.initialize();
    log.info("Warden wired (frameworkRoot={}, sandboxRoot={}, enforcement={})", config.frameworkRoot(),
        config.sandboxRoot(), config.enforcementMode());
  }

  static PathGuardSettings pathGuardSettings(WardenConfig config) {
    return PathGuardSettings.of(config.frameworkRoot(), config.wardenHome(), config.sandboxRoot(),
        config.protectedPaths(), config.traversalHistoryLimit());
  }

  static OrchestratorSettings orchestratorSettings(WardenConfig config) {
    return new OrchestratorSettings(
        config.watchPollIntervalMillis(),
        config.integrityCheckIntervalMillis(),
        config.threatScanIntervalMillis(),
        config.eventDrainIntervalMillis(),
        config.postureIntervalMillis(),
        EVIDENCE_INCIDENTS);
  }

  public WardenConfig config() {
    return config;
  }

  public SecurityOrchestrator orchestrator() {
    return orchestrator;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /** Stops the orchestrator, then closes the audit log and, when owned here, the metrics adapter. */
  @Override
  public void close() {
    orchestrator.stop();
    try {
      auditLog.close();
    } catch (IOException ex) {
      log.warn("Failed to close security audit log {}", config.auditLog(), ex);
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
