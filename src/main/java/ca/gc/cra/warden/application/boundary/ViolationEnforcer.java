package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.application.path.FilenameSanitizer;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.domain.boundary.BoundaryType;
import ca.gc.cra.warden.domain.boundary.BoundaryViolation;
import ca.gc.cra.warden.domain.boundary.FileSystemBoundary;
import ca.gc.cra.warden.domain.boundary.RuleAction;
import ca.gc.cra.warden.logging.Logs;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the remediation for a boundary violation to the offending artifact.
 * <p><strong>Why:</strong> Detection and remediation are separated so the destructive delete-on-deny behaviour can
 * be switched to {@link EnforcementMode#DRY_RUN} without touching rule evaluation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deny: delete the artifact recursively, best-effort.</li>
 *   <li>Quarantine: move the artifact to {@code quarantineDir/{epochMillis}-{name}} with a metadata sidecar.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; callers serialize per project.</p>
 * <p><strong>Observability:</strong> Failures are logged at WARN and recorded in the returned violation; they are
 * never rethrown.</p>
 *
 * @since 0.1.0
 */
public final class ViolationEnforcer {
  private static final Logger log = LoggerFactory.getLogger(ViolationEnforcer.class);
  static final String METADATA_SUFFIX = ".metadata.json";

  private final EnforcementMode mode;
  private final Path quarantineDir;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates an enforcer.
   *
   * @param mode enforcement mode
   * @param quarantineDir destination for quarantined artifacts
   * @param clock time source for quarantine names
   * @param metrics metrics sink
   */
  public ViolationEnforcer(EnforcementMode mode, Path quarantineDir, ClockPort clock, MetricsPort metrics) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.quarantineDir = Objects.requireNonNull(quarantineDir, "quarantineDir").toAbsolutePath().normalize();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public EnforcementMode mode() {
    return mode;
  }

  public Path quarantineDir() {
    return quarantineDir;
  }

  /**
   * Enforces a violation.
   *
   * @param violation detected violation
   * @param action action of the matched rule
   * @param boundary boundary the artifact belongs to
   * @return violation carrying the enforcement outcome
   */
  public BoundaryViolation enforce(BoundaryViolation violation, RuleAction action, FileSystemBoundary boundary) {
    Objects.requireNonNull(violation, "violation");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(boundary, "boundary");
    Path target = Path.of(violation.targetPath());
    if (boundary.boundaryType() == BoundaryType.QUARANTINE || target.startsWith(quarantineDir)) {
      return violation.withEnforcement(false, "none: inside quarantine", Map.of());
    }
    if (mode == EnforcementMode.DRY_RUN) {
      log.info("boundary.enforce.dry_run id={} action={} target={}", violation.id(), action.wireName(),
          Logs.truncate(violation.targetPath(), 256));
      return violation.withEnforcement(false, "dry_run: " + action.wireName(), Map.of());
    }
    if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
      return violation.withEnforcement(true, "already_absent", Map.of());
    }
    return switch (action) {
      case DENY -> delete(violation, target);
      case QUARANTINE -> quarantine(violation, target);
      case ALLOW, AUDIT -> violation.withEnforcement(false, "none", Map.of());
    };
  }

  private BoundaryViolation delete(BoundaryViolation violation, Path target) {
    try {
      deleteRecursively(target);
      metrics.increment("boundary.enforce.deleted");
      log.warn("boundary.enforce.deleted id={} target={}", violation.id(), Logs.truncate(violation.targetPath(), 256));
      return violation.withEnforcement(true, "deleted", Map.of());
    } catch (IOException | RuntimeException ex) {
      metrics.increment("boundary.enforce.failed");
      log.warn("Unable to delete {} for violation {}", violation.targetPath(), violation.id(), ex);
      return violation.withEnforcement(false, "delete_failed: " + ex.getMessage(),
          Map.of("enforcement_error", String.valueOf(ex.getMessage())));
    }
  }

  private BoundaryViolation quarantine(BoundaryViolation violation, Path target) {
    long now = clock.nowMillis();
    Path name = target.getFileName();
    String base = now + "-" + FilenameSanitizer.sanitize(name == null ? "" : name.toString());
    try {
      Files.createDirectories(quarantineDir);
      Path destination = moveUnique(target, base);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("violation_id", violation.id());
      metadata.put("original_path", violation.targetPath());
      metadata.put("boundary_id", violation.boundaryId());
      metadata.put("rule_id", violation.ruleId());
      metadata.put("project_id", violation.projectId());
      metadata.put("violation_type", violation.violationType().wireName());
      metadata.put("severity", violation.severity().wireName());
      metadata.put("quarantined_at", clock.now().toString());
      JsonDocuments.writeFile(destination.resolveSibling(destination.getFileName() + METADATA_SUFFIX), metadata);
      metrics.increment("boundary.enforce.quarantined");
      log.warn("boundary.enforce.quarantined id={} target={} destination={}", violation.id(),
          Logs.truncate(violation.targetPath(), 256), destination);
      return violation.withEnforcement(true, "quarantined: " + destination,
          Map.of("quarantine_path", destination.toString()));
    } catch (IOException | RuntimeException ex) {
      metrics.increment("boundary.enforce.failed");
      log.warn("Unable to quarantine {} for violation {}", violation.targetPath(), violation.id(), ex);
      return violation.withEnforcement(false, "quarantine_failed: " + ex.getMessage(),
          Map.of("enforcement_error", String.valueOf(ex.getMessage())));
    }
  }

  private Path moveUnique(Path source, String baseName) throws IOException {
    Path destination = quarantineDir.resolve(baseName);
    for (int attempt = 1; ; attempt++) {
      try {
        return Files.move(source, destination);
      } catch (FileAlreadyExistsException ex) {
        if (attempt >= 100) {
          throw ex;
        }
        destination = quarantineDir.resolve(baseName + "." + attempt);
      }
    }
  }

  static void deleteRecursively(Path target) throws IOException {
    if (!Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
      Files.deleteIfExists(target);
      return;
    }
    Files.walkFileTree(target, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        Files.deleteIfExists(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.deleteIfExists(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
