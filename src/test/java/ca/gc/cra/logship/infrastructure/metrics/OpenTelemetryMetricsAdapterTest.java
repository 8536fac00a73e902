package ca.gc.cra.logship.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Map;
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
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("sink.write.accepted");
    adapter.increment("sink.write.accepted");
    adapter.forceFlush();

    MetricData counter = metric("sink.write.accepted");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("sink.write.accepted", point.getAttributes().get(AttributeKey.stringKey("logship.metric.key")));

    assertEquals("logship", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertEquals("test", counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("sink.close.latencyMillis", 40);
    adapter.observe("sink.close.latencyMillis", 60);

    MetricData histogram = metric("sink.close.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
    assertEquals("sink.close.latencyMillis",
        point.getAttributes().get(AttributeKey.stringKey("logship.metric.key")));
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("logger.emit.dropped", OpenTelemetryMetricsAdapter.sanitizeName("Logger.Emit.Dropped"));
    assertEquals("m5xx_errors", OpenTelemetryMetricsAdapter.sanitizeName("5xx errors"));
    assertEquals("logship.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void exportIsDisabledByDefault() {
    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(Map.of())) {
      assertTrue(disabled.isNoop());
      disabled.increment("ignored");
      disabled.observe("ignored", 1);
      disabled.forceFlush();
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter disabled =
        new OpenTelemetryMetricsAdapter(Map.of("OTEL_METRICS_EXPORTER", "prometheus"))) {
      assertTrue(disabled.isNoop());
    }
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("missing metric " + name));
  }
}
