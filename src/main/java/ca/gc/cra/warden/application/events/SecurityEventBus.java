package ca.gc.cra.warden.application.events;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SecurityEventSink;
import ca.gc.cra.warden.domain.events.SecurityEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded queue connecting event publishers to the orchestrator.
 * <p><strong>Why:</strong> Publishers never call into the orchestrator directly, so a slow incident response cannot
 * stall a watcher poll or an access check.</p>
 * <p><strong>Thread-safety:</strong> Any thread may publish; a single consumer drains.</p>
 * <p><strong>Observability:</strong> Counts {@code events.published} and {@code events.dropped}; drops are logged
 * at WARN.</p>
 *
 * @since 0.1.0
 */
public final class SecurityEventBus implements SecurityEventSink {
  private static final Logger log = LoggerFactory.getLogger(SecurityEventBus.class);

  private final BlockingQueue<SecurityEvent> queue;
  private final MetricsPort metrics;

  /**
   * Creates a bus.
   *
   * @param capacity maximum queued events
   * @param metrics metrics sink
   */
  public SecurityEventBus(int capacity, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void publish(SecurityEvent event) {
    Objects.requireNonNull(event, "event");
    if (queue.offer(event)) {
      metrics.increment("events.published");
      return;
    }
    metrics.increment("events.dropped");
    log.warn("Security event queue full; dropping {} for project {}",
        event.getClass().getSimpleName(), event.projectId());
  }

  /**
   * Removes all queued events and hands them to {@code consumer} in publication order.
   *
   * @param consumer event handler; exceptions propagate after the failing event has been removed
   * @return number of events handed to the consumer
   */
  public int drain(Consumer<SecurityEvent> consumer) {
    Objects.requireNonNull(consumer, "consumer");
    List<SecurityEvent> batch = new ArrayList<>();
    queue.drainTo(batch);
    for (SecurityEvent event : batch) {
      consumer.accept(event);
    }
    return batch.size();
  }

  public int pending() {
    return queue.size();
  }
}
