package ca.gc.cra.lattice.infrastructure.metrics;

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
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void perKindCountersShareOneInstrument() {
    adapter.increment("query.hosts.published");
    adapter.increment("query.hosts.published");
    adapter.increment("query.actors.published");

    MetricData metric = find(reader.collectAllMetrics(), "lattice.query.published");

    assertEquals(MetricDataType.LONG_SUM, metric.getType());
    assertEquals(2L, pointFor(metric, "hosts").getValue());
    assertEquals(1L, pointFor(metric, "actors").getValue());
    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("lattice-client", metric.getResource().getAttribute(serviceName));
  }

  @Test
  void latencyIsRecordedAsHistogram() {
    adapter.observe("query.hosts.latencyMs", 120);
    adapter.observe("query.hosts.latencyMs", 80);

    MetricData metric = find(reader.collectAllMetrics(), "lattice.query.latencyMs");

    assertEquals(MetricDataType.HISTOGRAM, metric.getType());
    HistogramPointData point = metric.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum());
    assertEquals("hosts", point.getAttributes().get(OpenTelemetryMetricsAdapter.KIND_ATTRIBUTE));
  }

  @Test
  void sharedKeysCarryNoKindAttribute() {
    adapter.increment("query.decode.failed");
    adapter.increment("transport.publish.failed");

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData decode = find(metrics, "lattice.query.decode.failed");
    LongPointData point = decode.getLongSumData().getPoints().iterator().next();

    assertTrue(point.getAttributes().isEmpty());
    assertEquals(1L, find(metrics, "lattice.transport.publish.failed")
        .getLongSumData().getPoints().iterator().next().getValue());
  }

  @Test
  void instrumentNamesFollowKeyShape() {
    assertEquals("lattice.query.earlyStop", OpenTelemetryMetricsAdapter.instrumentName("query.links.earlyStop"));
    assertEquals("lattice.query.reply.late", OpenTelemetryMetricsAdapter.instrumentName("query.reply.late"));
    assertEquals("lattice.events.received", OpenTelemetryMetricsAdapter.instrumentName("events.received"));
  }

  @Test
  void disabledExporterIsNoop() {
    OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter("none", "");
    try {
      assertTrue(disabled.isNoop());
      disabled.increment("query.hosts.published");
    } finally {
      disabled.close();
    }
    assertFalse(adapter.isNoop());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }

  private static LongPointData pointFor(MetricData metric, String kind) {
    return metric.getLongSumData().getPoints().stream()
        .filter(point -> kind.equals(point.getAttributes().get(OpenTelemetryMetricsAdapter.KIND_ATTRIBUTE)))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no point for kind " + kind));
  }
}
