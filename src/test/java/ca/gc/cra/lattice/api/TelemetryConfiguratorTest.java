package ca.gc.cra.lattice.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void acceptsKnownExportersAndHttpEndpoints() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validate(Map.of()));
    assertDoesNotThrow(() -> TelemetryConfigurator.validate(
        Map.of("metricsExporter", "OTLP", "otelEndpoint", "https://collector:4318/v1/metrics")));
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.validate(Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void rejectsEndpointsWithoutHttpSchemeOrHost() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.validate(Map.of("metricsExporter", "otlp", "otelEndpoint", "ftp://x")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.validate(Map.of("metricsExporter", "otlp", "otelEndpoint", "http:///path")));
  }

  @Test
  void endpointIsIgnoredWhenExportDisabled() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validate(
        Map.of("metricsExporter", "none", "otelEndpoint", "not a uri")));
  }
}
