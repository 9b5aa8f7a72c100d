package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.events.SecurityEvent;

/**
 * Channel the leaf subsystems publish {@link SecurityEvent}s into.
 *
 * <p>Implementations must not block the publisher and must not throw for a full channel.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SecurityEventSink {
  /**
   * Publishes an event towards the orchestrator.
   *
   * @param event event to deliver; must not be {@code null}
   */
  void publish(SecurityEvent event);

  /** Sink that discards every event. */
  SecurityEventSink NO_OP = event -> {};
}
