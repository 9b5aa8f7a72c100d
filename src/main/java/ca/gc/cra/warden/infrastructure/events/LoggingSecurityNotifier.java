package ca.gc.cra.warden.infrastructure.events;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityNotificationPort;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.events.SecurityNotification;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits security notifications to structured logs and counts them as {@code notify.<eventName>}.
 *
 * @since 0.1.0
 */
public final class LoggingSecurityNotifier implements SecurityNotificationPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingSecurityNotifier.class);

  private final MetricsPort metrics;

  /**
   * Creates a logging notifier.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingSecurityNotifier(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public LoggingSecurityNotifier() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void publish(SecurityNotification notification) {
    Objects.requireNonNull(notification, "notification");
    NotificationType type = notification.type();
    metrics.increment("notify." + type.eventName());

    StringJoiner joiner = new StringJoiner(" ");
    joiner.add("type=" + type.eventName());
    joiner.add("at=" + notification.timestamp());
    if (notification.projectId() != null) {
      joiner.add("project=" + notification.projectId());
    }
    if (notification.incidentId() != null) {
      joiner.add("incident=" + notification.incidentId());
    }
    for (Map.Entry<String, String> entry : new TreeMap<>(notification.attributes()).entrySet()) {
      joiner.add(entry.getKey() + '=' + entry.getValue());
    }
    if (type == NotificationType.EMERGENCY_PROTOCOL || type == NotificationType.OPERATIONS_PAUSED) {
      log.error("security.notify {}", joiner);
    } else if (type == NotificationType.SECURITY_POSTURE_UPDATED || type == NotificationType.OPERATIONS_RESUMED) {
      log.info("security.notify {}", joiner);
    } else {
      log.warn("security.notify {}", joiner);
    }
  }
}
