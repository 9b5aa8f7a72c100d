package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Warden runtime logging at startup.
 * <p><strong>Why:</strong> Operators raise verbosity while investigating incidents, and the emergency protocol needs
 * access to recent log output without reading log files.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap thread; Logback synchronizes internally.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Attaches a {@link RecentLogBuffer} to the root logger, reusing one that is already attached.
   *
   * @param capacity number of lines to retain
   * @return the attached buffer, or empty when the backend is not Logback
   */
  public static Optional<RecentLogBuffer> installRecentLogBuffer(int capacity) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Recent log capture unavailable for backend {}", factory.getClass().getName());
      return Optional.empty();
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    synchronized (LoggingConfigurator.class) {
      Appender<ILoggingEvent> existing = root.getAppender(RecentLogBuffer.NAME);
      if (existing instanceof RecentLogBuffer buffer) {
        return Optional.of(buffer);
      }
      RecentLogBuffer buffer = new RecentLogBuffer(capacity);
      buffer.setContext(context);
      buffer.start();
      root.addAppender(buffer);
      return Optional.of(buffer);
    }
  }
}
