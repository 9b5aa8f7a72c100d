package ca.gc.cra.warden.domain.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound notification delivered to subscribers of the security core.
 *
 * @param type notification kind; never {@code null}
 * @param timestamp emission time; never {@code null}
 * @param projectId implicated project; may be {@code null}
 * @param incidentId related incident; may be {@code null}
 * @param attributes notification payload; never {@code null}
 * @since 0.1.0
 */
public record SecurityNotification(
    NotificationType type, Instant timestamp, String projectId, String incidentId, Map<String, String> attributes) {
  public SecurityNotification {
    type = Objects.requireNonNull(type, "type");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
