package ca.gc.cra.warden.domain.isolation;

import ca.gc.cra.warden.domain.path.AccessOperation;
import java.time.Instant;
import java.util.Objects;

/**
 * Access observed for a project, retained for threat scans.
 *
 * @param timestamp when the access happened; never {@code null}
 * @param projectId project the access was attributed to; never {@code null}
 * @param operation access operation; never {@code null}
 * @param targetPath absolute target; never {@code null}
 * @param descriptor {@code scope:path->scope:path} string matched by file access patterns; never {@code null}
 * @param created whether the access created a new file
 * @since 0.1.0
 */
public record ActivityRecord(
    Instant timestamp,
    String projectId,
    AccessOperation operation,
    String targetPath,
    String descriptor,
    boolean created) {
  public ActivityRecord {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    projectId = Objects.requireNonNull(projectId, "projectId");
    operation = Objects.requireNonNull(operation, "operation");
    targetPath = Objects.requireNonNull(targetPath, "targetPath");
    descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }
}
