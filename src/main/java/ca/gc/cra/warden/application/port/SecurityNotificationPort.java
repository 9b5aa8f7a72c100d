package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.events.SecurityNotification;

/**
 * Outbound notification contract consumed by schedulers, dashboards and CLIs.
 *
 * <p>Implementations should not throw; the orchestrator logs and counts failures when they do.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SecurityNotificationPort {
  void publish(SecurityNotification notification);

  /** Port that ignores every notification. */
  SecurityNotificationPort NO_OP = notification -> {};
}
