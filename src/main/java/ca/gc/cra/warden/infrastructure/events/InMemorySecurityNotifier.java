package ca.gc.cra.warden.infrastructure.events;

import ca.gc.cra.warden.application.port.SecurityNotificationPort;
import ca.gc.cra.warden.domain.events.NotificationType;
import ca.gc.cra.warden.domain.events.SecurityNotification;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory notifier used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemorySecurityNotifier implements SecurityNotificationPort {
  private final CopyOnWriteArrayList<SecurityNotification> notifications = new CopyOnWriteArrayList<>();

  @Override
  public void publish(SecurityNotification notification) {
    notifications.add(Objects.requireNonNull(notification, "notification"));
  }

  /**
   * Returns a snapshot of published notifications.
   *
   * @return immutable list in publication order
   */
  public List<SecurityNotification> snapshot() {
    return List.copyOf(notifications);
  }

  public List<SecurityNotification> ofType(NotificationType type) {
    return notifications.stream().filter(n -> n.type() == type).collect(Collectors.toUnmodifiableList());
  }

  public void clear() {
    notifications.clear();
  }
}
