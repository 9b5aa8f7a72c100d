package ca.gc.cra.warden.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("warden.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.active(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " was not exported"));
  }

  @Test
  void incrementRecordsCounterWithKeyAndResource() {
    adapter.increment("path.attempt.basic_traversal");
    adapter.increment("path.attempt.basic_traversal");
    adapter.forceFlush();

    MetricData counter = metric("path.attempt.basic_traversal");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("path.attempt.basic_traversal", point.getAttributes().get(METRIC_KEY));
    assertEquals("warden", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("boundary.poll.latency_ms", 4);
    adapter.observe("boundary.poll.latency_ms", 6);
    adapter.forceFlush();

    MetricData histogram = metric("boundary.poll.latency_ms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum(), 1e-9);
    assertEquals("boundary.poll.latency_ms", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void keysAreSanitizedButKeptAsAttributes() {
    adapter.increment("9 Events/Dropped");
    adapter.forceFlush();

    MetricData counter = metric("m9_events_dropped");
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("9 Events/Dropped", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeFallsBackForBlankKeys() {
    assertEquals("warden.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("incident.created", OpenTelemetryMetricsAdapter.sanitizeName("Incident.Created"));
    assertTrue(OpenTelemetryMetricsAdapter.sanitizeName("_x").startsWith("m"));
  }
}
