package ca.gc.cra.ldiftap.infrastructure.metrics;

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
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementAndAddAccumulateOnOneCounter() {
    adapter.increment("ldif.entries.emitted");
    adapter.add("ldif.entries.emitted", 4);
    adapter.add("ldif.entries.emitted", 0);
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "ldif.entries.emitted");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(5L, point.getValue());
    assertEquals("ldif.entries.emitted",
        point.getAttributes().get(AttributeKey.stringKey("ldiftap.metric.key")));
    assertEquals("ldif-tap", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("ldif.entry.sizeBytes", 100);
    adapter.observe("ldif.entry.sizeBytes", 300);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "ldif.entry.sizebytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum());
    assertEquals("ldif.entry.sizeBytes",
        point.getAttributes().get(AttributeKey.stringKey("ldiftap.metric.key")));
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("ldif.files_failed", OpenTelemetryMetricsAdapter.sanitizeName("ldif.files failed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("ldiftap.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    MetricData match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElse(null);
    assertTrue(match != null, "Expected metric " + name + " to be exported");
    return match;
  }
}
