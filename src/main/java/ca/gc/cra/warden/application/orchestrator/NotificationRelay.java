package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.SecurityNotificationPort;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.events.SecurityNotification;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends notifications and contains failures of the outbound port. */
final class NotificationRelay {
  private static final Logger log = LoggerFactory.getLogger(NotificationRelay.class);

  private final SecurityNotificationPort port;
  private final ClockPort clock;

  NotificationRelay(SecurityNotificationPort port, ClockPort clock) {
    this.port = Objects.requireNonNull(port, "port");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  void send(NotificationType type, String projectId, String incidentId, Map<String, String> attributes) {
    try {
      port.publish(new SecurityNotification(type, clock.now(), projectId, incidentId, attributes));
    } catch (RuntimeException ex) {
      log.warn("Notification {} failed for incident {}", type.eventName(), incidentId, ex);
    }
  }
}
