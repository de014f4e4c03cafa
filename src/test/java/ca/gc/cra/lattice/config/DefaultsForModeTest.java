package ca.gc.cra.lattice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void listDefaultsMatchConfigDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("list", Map.of());

    assertEquals("", defaults.get("kafkaBootstrap"));
    assertEquals("600", defaults.get("timeoutMillis"));
    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("false", defaults.get("json"));
    assertEquals(LatticeConfig.defaults(), LatticeConfig.fromMap(defaults));
  }

  @Test
  void watchDisablesMetricsExport() {
    assertEquals("none", DefaultsForMode.asFlatMap("WATCH", Map.of()).get("metricsExporter"));
  }

  @Test
  void environmentSuppliesBootstrapAndTimeout() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("list", Map.of(
        DefaultsForMode.ENV_KAFKA_BOOTSTRAP, "kafka:9092",
        DefaultsForMode.ENV_RPC_TIMEOUT, "2000"));

    assertEquals("kafka:9092", defaults.get("kafkaBootstrap"));
    assertEquals("2000", defaults.get("timeoutMillis"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("deploy", Map.of()));
  }
}
