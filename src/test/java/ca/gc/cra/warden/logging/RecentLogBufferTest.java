package ca.gc.cra.warden.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class RecentLogBufferTest {
  private static final Logger log = LoggerFactory.getLogger(RecentLogBufferTest.class);

  @Test
  void installedBufferCapturesRecentLines() {
    RecentLogBuffer buffer = LoggingConfigurator.installRecentLogBuffer(50).orElseThrow();

    log.warn("security.incident id={} project={}", "INC-1", "proj1");

    List<String> lines = buffer.recent(buffer.capacity());
    assertTrue(lines.get(lines.size() - 1).endsWith(
        "WARN " + RecentLogBufferTest.class.getName() + " - security.incident id=INC-1 project=proj1"));
    assertSame(buffer, LoggingConfigurator.installRecentLogBuffer(10).orElseThrow());
  }

  @Test
  void bufferKeepsOnlyItsCapacity() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    RecentLogBuffer buffer = new RecentLogBuffer(2);
    buffer.setContext(context);
    buffer.start();
    ch.qos.logback.classic.Logger logger = context.getLogger("capacity-test");
    logger.addAppender(buffer);
    try {
      logger.warn("one");
      logger.warn("two");
      logger.warn("three");
    } finally {
      logger.detachAppender(buffer);
    }

    List<String> lines = buffer.recent(10);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).endsWith("- two"));
    assertTrue(lines.get(1).endsWith("- three"));
    assertEquals(1, buffer.recent(1).size());
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new RecentLogBuffer(0));
  }
}
