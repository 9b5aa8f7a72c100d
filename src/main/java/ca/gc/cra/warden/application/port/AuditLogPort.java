package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.io.IOException;

/**
 * <strong>What:</strong> Append-only audit trail with one record per incident.
 * <p><strong>Thread-safety:</strong> Implementations must serialize concurrent appends.</p>
 *
 * @since 0.1.0
 */
public interface AuditLogPort extends AutoCloseable {
  /**
   * Appends a record for {@code incident}.
   *
   * @param incident incident to record
   * @throws IOException when the record cannot be written
   */
  void append(SecurityIncident incident) throws IOException;

  @Override
  default void close() throws IOException {}

  /** Audit log that drops every record. */
  AuditLogPort NO_OP = incident -> {};
}
