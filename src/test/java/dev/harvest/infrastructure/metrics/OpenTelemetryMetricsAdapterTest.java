package dev.harvest.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("harvest.metric.key");

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
  void incrementExportsCounterWithOriginalKey() {
    adapter.increment("build.stage.success");
    adapter.increment("build.stage.success");
    adapter.increment("cache.miss");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "build.stage.success");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("build.stage.success", point.getAttributes().get(METRIC_KEY));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeExportsHistogramInMilliseconds() {
    adapter.observe("build.stage.duration.ms", 40L);
    adapter.observe("build.stage.duration.ms", 60L);
    adapter.forceFlush();

    MetricData histogram = metric(reader.collectAllMetrics(), "build.stage.duration.ms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
  }

  @Test
  void resourceIdentifiesTheService() {
    adapter.increment("cache.hit");
    adapter.forceFlush();

    MetricData data = metric(reader.collectAllMetrics(), "cache.hit");
    assertEquals("harvest", data.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("dev.harvest", data.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("store.prune.removed", OpenTelemetryMetricsAdapter.instrumentName("store.prune.removed"));
    assertEquals("m5xx_errors", OpenTelemetryMetricsAdapter.instrumentName("5xx errors"));
    assertEquals("harvest.metric", OpenTelemetryMetricsAdapter.instrumentName("   "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported: " + metrics));
  }
}
