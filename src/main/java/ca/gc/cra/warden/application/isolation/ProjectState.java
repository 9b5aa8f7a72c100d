package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.CheckKind;
import ca.gc.cra.warden.domain.isolation.ProjectIsolationBoundary;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/** Mutable runtime state of one isolated project. Mutators synchronize on the instance. */
final class ProjectState {
  static final String CONFIG_FILE = ".warden-project.json";

  private final ProjectIsolationBoundary boundary;
  private final ActivityLog activity;
  private final Map<CheckKind, Deque<Instant>> failures = new EnumMap<>(CheckKind.class);
  private final Set<String> blockedTargets = ConcurrentHashMap.newKeySet();
  private final Set<String> frozenTargets = ConcurrentHashMap.newKeySet();
  private final List<ScheduledFuture<?>> timers = new ArrayList<>();
  private volatile String configHash;
  private volatile String configSignature;
  private volatile boolean compromised;
  private volatile boolean enhanced;
  private volatile boolean networkIsolated;
  private volatile boolean rateLimited;
  private long scanCursor;

  ProjectState(ProjectIsolationBoundary boundary, int activityCapacity) {
    this.boundary = boundary;
    this.activity = new ActivityLog(activityCapacity);
  }

  ProjectIsolationBoundary boundary() {
    return boundary;
  }

  String projectId() {
    return boundary.projectId();
  }

  Path root() {
    return boundary.projectRoot();
  }

  Path configFile() {
    return boundary.projectRoot().resolve(CONFIG_FILE);
  }

  ActivityLog activity() {
    return activity;
  }

  /**
   * Records a failure and returns how many consecutive failures fall within the window.
   *
   * @param kind failing check
   * @param at failure time
   * @param windowMillis window the consecutive failures must fall within
   * @return consecutive failures, including this one
   */
  synchronized int recordFailure(CheckKind kind, Instant at, long windowMillis) {
    Deque<Instant> streak = failures.computeIfAbsent(kind, k -> new ArrayDeque<>());
    streak.addLast(at);
    Instant cutoff = at.minusMillis(windowMillis);
    while (!streak.isEmpty() && streak.peekFirst().isBefore(cutoff)) {
      streak.removeFirst();
    }
    return streak.size();
  }

  synchronized void resetFailures(CheckKind kind) {
    Deque<Instant> streak = failures.get(kind);
    if (streak != null) {
      streak.clear();
    }
  }

  boolean blocks(String target) {
    return blockedTargets.contains(target);
  }

  void block(String target) {
    blockedTargets.add(target);
  }

  Set<String> blockedTargets() {
    return Set.copyOf(blockedTargets);
  }

  synchronized void addTimer(ScheduledFuture<?> timer) {
    timers.add(timer);
  }

  synchronized void cancelTimers() {
    timers.forEach(timer -> timer.cancel(false));
    timers.clear();
  }

  synchronized boolean hasTimers() {
    return !timers.isEmpty();
  }

  synchronized long scanCursor() {
    return scanCursor;
  }

  synchronized void scanCursor(long cursor) {
    this.scanCursor = cursor;
  }

  String configHash() {
    return configHash;
  }

  void configHash(String hash) {
    this.configHash = hash;
  }

  String configSignature() {
    return configSignature;
  }

  void configSignature(String signature) {
    this.configSignature = signature;
  }

  /**
   * Tracks the compromise threshold crossing.
   *
   * @param below whether the score is currently below the threshold
   * @return {@code true} only on the transition into the compromised state
   */
  synchronized boolean markCompromised(boolean below) {
    boolean crossed = below && !compromised;
    compromised = below;
    return crossed;
  }

  boolean compromised() {
    return compromised;
  }

  boolean enhanced() {
    return enhanced;
  }

  void enhanced(boolean value) {
    this.enhanced = value;
  }

  boolean networkIsolated() {
    return networkIsolated;
  }

  void networkIsolated(boolean value) {
    this.networkIsolated = value;
  }

  boolean rateLimited() {
    return rateLimited;
  }

  void rateLimited(boolean value) {
    this.rateLimited = value;
  }

  boolean freezes(String target) {
    return frozenTargets.contains(target);
  }

  void freeze(String target) {
    frozenTargets.add(target);
  }

  Set<String> frozenTargets() {
    return Set.copyOf(frozenTargets);
  }
}
