package ca.gc.cra.lattice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonAndAliasesApply() throws Exception {
    Path file = write("""
        common:
          kafka:
            bootstrap: broker:9092
            replyTopic: lattice.replies.v2
          timeoutMillis: 800
        list:
          timeoutMillis: 1500
          json: true
        watch:
          otel:
            exporter: none
        """);

    Map<String, String> list = YamlConfigLoader.load(file, "list").orElseThrow();
    Map<String, String> watch = YamlConfigLoader.load(file, "Watch").orElseThrow();

    assertEquals("broker:9092", list.get("kafkaBootstrap"));
    assertEquals("lattice.replies.v2", list.get("kafkaReplyTopic"));
    assertEquals("1500", list.get("timeoutMillis"));
    assertEquals("true", list.get("json"));
    assertEquals("800", watch.get("timeoutMillis"));
    assertEquals("none", watch.get("metricsExporter"));
  }

  @Test
  void missingFileIsEmptyAndBlankFileIsEmptyMap() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "list").isEmpty());
    assertTrue(YamlConfigLoader.load(write(""), "list").orElseThrow().isEmpty());
  }

  @Test
  void arraysAndMalformedYamlAreRejected() throws Exception {
    Path arrays = write("""
        common:
          kafka:
            bootstrap: [a:1, b:2]
        """);
    Path malformed = write("common: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "list"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(malformed, "list"));
  }

  @Test
  void nonMappingRootIsRejected() throws Exception {
    Path scalar = write("just-a-string");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "list"));
  }

  private Path write(String content) throws Exception {
    Path file = Files.createTempFile(tempDir, "lattice", ".yaml");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
