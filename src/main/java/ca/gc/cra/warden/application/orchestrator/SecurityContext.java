package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.isolation.SecurityLevel;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Security context handed back to callers that created a secure project.
 *
 * @param projectId project identifier
 * @param securityLevel isolation level
 * @param boundaryId sandbox boundary id
 * @param projectRoot validated project root
 * @param createdAt creation time
 * @since 0.1.0
 */
public record SecurityContext(
    String projectId, SecurityLevel securityLevel, String boundaryId, Path projectRoot, Instant createdAt) {}
