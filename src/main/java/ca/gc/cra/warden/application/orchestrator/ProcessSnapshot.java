package ca.gc.cra.warden.application.orchestrator;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the JVM, captured for forensic snapshots and evidence bundles.
 *
 * @param capturedAt capture time
 * @param pid process id
 * @param uptimeMillis JVM uptime
 * @param heapUsedBytes used heap
 * @param heapMaxBytes maximum heap, or -1 when undefined
 * @param threadCount live threads
 * @param availableProcessors processors available to the JVM
 * @since 0.1.0
 */
public record ProcessSnapshot(
    Instant capturedAt,
    long pid,
    long uptimeMillis,
    long heapUsedBytes,
    long heapMaxBytes,
    int threadCount,
    int availableProcessors) {

  /**
   * Captures the current process state from the platform MXBeans.
   *
   * @param now capture time
   * @return snapshot
   */
  public static ProcessSnapshot capture(Instant now) {
    MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
    return new ProcessSnapshot(
        now,
        ProcessHandle.current().pid(),
        ManagementFactory.getRuntimeMXBean().getUptime(),
        heap.getUsed(),
        heap.getMax(),
        ManagementFactory.getThreadMXBean().getThreadCount(),
        Runtime.getRuntime().availableProcessors());
  }

  public Map<String, Object> toMap() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("captured_at", capturedAt.toString());
    document.put("pid", pid);
    document.put("uptime_ms", uptimeMillis);
    document.put("heap_used_bytes", heapUsedBytes);
    document.put("heap_max_bytes", heapMaxBytes);
    document.put("thread_count", threadCount);
    document.put("available_processors", availableProcessors);
    return document;
  }
}
