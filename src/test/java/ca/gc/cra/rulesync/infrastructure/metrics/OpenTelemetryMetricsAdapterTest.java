package ca.gc.cra.rulesync.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("rulesync.metric.key");

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
  void incrementRecordsCounterWithOriginalKey() {
    adapter.increment("fetch.cache.hit");
    adapter.increment("fetch.cache.hit");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "fetch.cache.hit");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("fetch.cache.hit", point.getAttributes().get(METRIC_KEY));
    assertEquals("rulesync", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertTrue(adapter.isExporting());
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("fetch.latencyMillis", 120);
    adapter.observe("fetch.latencyMillis", 80);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "fetch.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200d, point.getSum());
    assertEquals("fetch.latencyMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("rulesync.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m1.retry", OpenTelemetryMetricsAdapter.sanitizeName("1.retry"));
    assertEquals("merge_values_total", OpenTelemetryMetricsAdapter.sanitizeName("Merge values/total"));
  }

  @Test
  void resourceAttributesParseKeyValuePairs() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, team = net ,=x");

    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("net", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter()) {
      noop.increment("ruleset.success");
      assertFalse(noop.isExporting());
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name));
  }
}
