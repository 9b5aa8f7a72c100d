package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Logback appender retaining the most recent formatted log lines in memory.
 *
 * <p>Emergency evidence bundles embed these lines so responders see what led up to a critical incident.</p>
 *
 * @since 0.1.0
 */
public final class RecentLogBuffer extends AppenderBase<ILoggingEvent> {
  /** Appender name used when attaching to the root logger. */
  public static final String NAME = "WARDEN_RECENT";

  private final int capacity;
  private final Deque<String> lines;

  public RecentLogBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.lines = new ArrayDeque<>(capacity);
    setName(NAME);
  }

  @Override
  protected void append(ILoggingEvent event) {
    String line = Instant.ofEpochMilli(event.getTimeStamp())
        + " " + event.getLevel()
        + " " + event.getLoggerName()
        + " - " + Logs.truncate(event.getFormattedMessage(), 1024);
    synchronized (lines) {
      lines.addLast(line);
      while (lines.size() > capacity) {
        lines.removeFirst();
      }
    }
  }

  /**
   * Returns up to {@code limit} recent lines, oldest first.
   *
   * @param limit maximum number of lines
   * @return snapshot of buffered lines
   */
  public List<String> recent(int limit) {
    synchronized (lines) {
      List<String> all = new ArrayList<>(lines);
      int from = Math.max(0, all.size() - Math.max(0, limit));
      return List.copyOf(all.subList(from, all.size()));
    }
  }

  public int capacity() {
    return capacity;
  }
}
