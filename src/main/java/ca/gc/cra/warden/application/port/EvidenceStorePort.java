package ca.gc.cra.warden.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * <strong>What:</strong> Persists forensic snapshots, evidence bundles and backups outside the project sandboxes.
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls for different incidents and
 * projects; callers serialize per project.</p>
 *
 * @since 0.1.0
 */
public interface EvidenceStorePort {
  /**
   * Writes a forensic snapshot document for an incident.
   *
   * @param incidentId incident identifier
   * @param document JSON-compatible document (maps, lists, strings, numbers, booleans)
   * @return written file
   * @throws IOException when the file cannot be written
   */
  Path writeForensicSnapshot(String incidentId, Map<String, Object> document) throws IOException;

  /**
   * Writes the evidence bundle for an incident unless one already exists.
   *
   * @param incidentId incident identifier
   * @param document JSON-compatible document
   * @return written or existing file
   * @throws IOException when the file cannot be written
   */
  Path writeEvidenceBundle(String incidentId, Map<String, Object> document) throws IOException;

  /**
   * Reports whether an evidence bundle was already preserved for the incident.
   *
   * @param incidentId incident identifier
   * @return {@code true} when the bundle exists
   */
  boolean hasEvidenceBundle(String incidentId);

  /**
   * Copies the project tree into a timestamped backup directory.
   *
   * @param projectId project identifier
   * @param projectRoot project root to copy
   * @return backup directory
   * @throws IOException when copying fails
   */
  Path backupProject(String projectId, Path projectRoot) throws IOException;

  /**
   * Copies a single file into the project's backup area.
   *
   * @param projectId project identifier
   * @param file file to copy
   * @return backup copy
   * @throws IOException when copying fails
   */
  Path backupFile(String projectId, Path file) throws IOException;
}
