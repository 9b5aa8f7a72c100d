package ca.gc.cra.warden.domain.boundary;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Named filesystem region with ordered access rules and an integrity baseline.
 * <p><strong>Role:</strong> Owned exclusively by the boundary engine; one instance per managed root.</p>
 * <p><strong>Thread-safety:</strong> Configuration is immutable. The integrity baseline is guarded by this
 * instance's monitor and the activity counters are atomic.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemBoundary {
  private final String boundaryId;
  private final BoundaryType boundaryType;
  private final Path rootPath;
  private final List<Path> allowedPaths;
  private final List<Path> forbiddenPaths;
  private final List<BoundaryRule> accessRules;
  private final EnforcementLevel enforcementLevel;
  private final boolean monitoringEnabled;
  private final String projectId;
  private final AtomicLong enforcements = new AtomicLong();
  private final AtomicLong attributedChanges = new AtomicLong();
  private final AtomicLong unattributedChanges = new AtomicLong();

  private IntegrityBaseline baseline = IntegrityBaseline.EMPTY;

  /**
   * Creates a boundary; rules are sorted into evaluation order.
   *
   * @param boundaryId unique identifier
   * @param boundaryType region kind
   * @param rootPath absolute, normalized root
   * @param allowedPaths paths explicitly allowed inside the root
   * @param forbiddenPaths paths that must never be written
   * @param accessRules rule set in any order
   * @param enforcementLevel default enforcement strength
   * @param monitoringEnabled whether a directory watch is installed
   * @param projectId owning project for sandboxes; {@code null} otherwise
   */
  public FileSystemBoundary(
      String boundaryId,
      BoundaryType boundaryType,
      Path rootPath,
      List<Path> allowedPaths,
      List<Path> forbiddenPaths,
      List<BoundaryRule> accessRules,
      EnforcementLevel enforcementLevel,
      boolean monitoringEnabled,
      String projectId) {
    this.boundaryId = Objects.requireNonNull(boundaryId, "boundaryId");
    this.boundaryType = Objects.requireNonNull(boundaryType, "boundaryType");
    this.rootPath = Objects.requireNonNull(rootPath, "rootPath").toAbsolutePath().normalize();
    this.allowedPaths = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
    this.forbiddenPaths = forbiddenPaths == null ? List.of() : List.copyOf(forbiddenPaths);
    List<BoundaryRule> sorted = new ArrayList<>(accessRules == null ? List.of() : accessRules);
    sorted.sort(BoundaryRule.EVALUATION_ORDER);
    this.accessRules = List.copyOf(sorted);
    this.enforcementLevel = Objects.requireNonNull(enforcementLevel, "enforcementLevel");
    this.monitoringEnabled = monitoringEnabled;
    this.projectId = projectId;
  }

  public String boundaryId() {
    return boundaryId;
  }

  public BoundaryType boundaryType() {
    return boundaryType;
  }

  public Path rootPath() {
    return rootPath;
  }

  public List<Path> allowedPaths() {
    return allowedPaths;
  }

  public List<Path> forbiddenPaths() {
    return forbiddenPaths;
  }

  /**
   * Rules in evaluation order.
   *
   * @return immutable sorted rules
   */
  public List<BoundaryRule> accessRules() {
    return accessRules;
  }

  public EnforcementLevel enforcementLevel() {
    return enforcementLevel;
  }

  public boolean monitoringEnabled() {
    return monitoringEnabled;
  }

  public String projectId() {
    return projectId;
  }

  /**
   * Tests whether {@code path} lies at or below the boundary root.
   *
   * @param path absolute path
   * @return {@code true} when contained
   */
  public boolean contains(Path path) {
    return path != null && path.toAbsolutePath().normalize().startsWith(rootPath);
  }

  /**
   * Tests whether {@code path} lies under one of the forbidden paths.
   *
   * @param path absolute path
   * @return {@code true} when forbidden
   */
  public boolean isForbidden(Path path) {
    if (path == null) {
      return false;
    }
    Path normalized = path.toAbsolutePath().normalize();
    for (Path forbidden : forbiddenPaths) {
      if (normalized.startsWith(forbidden)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Records an enforcement action so the next integrity check treats the resulting change as expected.
   *
   * @return total enforcement actions so far
   */
  public long recordEnforcement() {
    return enforcements.incrementAndGet();
  }

  public long enforcementCount() {
    return enforcements.get();
  }

  /** Records a watched change made from inside an active project scope. */
  public void recordAttributedChange() {
    attributedChanges.incrementAndGet();
  }

  /** Records a watched change that no project scope accounts for. */
  public void recordUnattributedChange() {
    unattributedChanges.incrementAndGet();
  }

  public synchronized IntegrityBaseline integrityBaseline() {
    return baseline;
  }

  /**
   * Replaces the integrity baseline, capturing the activity counters alongside the hash.
   *
   * @param hash content hash of the root
   * @param checkedAt time of the check
   * @return the baseline that was replaced
   */
  public synchronized IntegrityBaseline rebaseline(String hash, Instant checkedAt) {
    IntegrityBaseline previous = baseline;
    this.baseline = new IntegrityBaseline(
        Objects.requireNonNull(hash, "hash"),
        Objects.requireNonNull(checkedAt, "checkedAt"),
        enforcements.get(),
        attributedChanges.get(),
        unattributedChanges.get());
    return previous;
  }

  @Override
  public String toString() {
    return "FileSystemBoundary{" + boundaryId + ", " + boundaryType.wireName() + ", " + rootPath + '}';
  }

  /**
   * Last recorded integrity state of a boundary.
   *
   * @param integrityHash content hash; empty before the first check
   * @param lastIntegrityCheck time of the last check; {@code null} before the first check
   * @param enforcements enforcement counter captured with the hash
   * @param attributedChanges scoped change counter captured with the hash
   * @param unattributedChanges unscoped change counter captured with the hash
   */
  public record IntegrityBaseline(
      String integrityHash,
      Instant lastIntegrityCheck,
      long enforcements,
      long attributedChanges,
      long unattributedChanges) {
    static final IntegrityBaseline EMPTY = new IntegrityBaseline("", null, 0L, 0L, 0L);

    public boolean established() {
      return !integrityHash.isEmpty();
    }

    /**
     * Whether activity recorded between {@code previous} and this baseline accounts for a content change.
     * Any unattributed change in between makes the whole delta unaccounted.
     *
     * @param previous earlier baseline of the same boundary
     * @return {@code true} when enforcement or scoped project activity explains the change
     */
    public boolean accountsForChangeSince(IntegrityBaseline previous) {
      if (unattributedChanges != previous.unattributedChanges()) {
        return false;
      }
      return enforcements != previous.enforcements() || attributedChanges != previous.attributedChanges();
    }
  }
}
