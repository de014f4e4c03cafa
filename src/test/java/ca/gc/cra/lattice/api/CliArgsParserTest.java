package ca.gc.cra.lattice.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void aliasesMapToCanonicalKeys() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"t=250", "url=broker:9092", "ns=prod", "host = h1 "});

    assertEquals("250", map.get("timeoutMillis"));
    assertEquals("broker:9092", map.get("kafkaBootstrap"));
    assertEquals("prod", map.get("namespace"));
    assertEquals("h1", map.get("host"));
  }

  @Test
  void emptyValuesAreKept() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelEndpoint="});

    assertEquals("", map.get("otelEndpoint"));
  }

  @Test
  void laterArgumentsWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"timeout=100", "timeoutMillis=300"});

    assertEquals("300", map.get("timeoutMillis"));
  }

  @Test
  void nullArgumentsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void malformedArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"hosts"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"ns=a\u0007b"}));
  }
}
