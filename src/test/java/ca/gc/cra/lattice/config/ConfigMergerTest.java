package ca.gc.cra.lattice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "list",
        Optional.of(Map.of("timeoutMillis", "900", "namespace", "staging")),
        Map.of("timeoutMillis", "1200"),
        DefaultsForMode.asFlatMap("list", Map.of()),
        warnings::add);

    assertEquals("1200", effective.get("timeoutMillis"));
    assertEquals("staging", effective.get("namespace"));
    assertEquals("_INBOX", effective.get("inboxPrefix"));
    assertEquals(List.of("CLI overrides YAML for key: timeoutMillis"), warnings);
  }

  @Test
  void withoutYamlNoWarningIsRaised() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "list", Optional.empty(), Map.of("json", "true"), Map.of("json", "false"), warnings::add);

    assertEquals("true", effective.get("json"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void invalidBootstrapOrCollidingSubjectsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "list", Optional.empty(), Map.of("kafkaBootstrap", "nohostport"), Map.of(), null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "list", Optional.of(Map.of("namespace", "bus")), Map.of("inboxPrefix", "bus"), Map.of(), null));
  }
}
