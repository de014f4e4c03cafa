package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.config.ConfigMerger;
import ca.gc.cra.lattice.config.DefaultsForMode;
import ca.gc.cra.lattice.config.LatticeConfig;
import ca.gc.cra.lattice.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared CLI steps: parse {@code key=value} options, load YAML, merge with defaults and build a
 * {@link LatticeConfig}.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Outcome of resolving configuration: either a config or the exit code to stop with.
   *
   * @param config effective configuration, {@code null} on failure
   * @param effective merged flat map, {@code null} on failure
   * @param failure exit code when resolution failed
   */
  record Resolved(LatticeConfig config, Map<String, String> effective, ExitCode failure) {
    boolean ok() {
      return failure == null;
    }

    static Resolved failed(ExitCode code) {
      return new Resolved(null, null, code);
    }
  }

  static Resolved resolve(String mode, Map<String, String> cliArgs, boolean jsonFlag, Logger log, String usage) {
    Map<String, String> kv = new LinkedHashMap<>(cliArgs);
    String configPath = extractConfigPath(kv);
    if (jsonFlag) {
      kv.put("json", "true");
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolved.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolved.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolved.failed(ExitCode.CONFIG_ERROR);
      }
    }

    Map<String, String> effective;
    LatticeConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      TelemetryConfigurator.validate(effective);
      config = LatticeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolved.failed(ExitCode.INVALID_ARGS);
    }
    return new Resolved(config, effective, null);
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }

  static List<String> describe(LatticeConfig config, String mode) {
    return List.of(
        "latticectl " + mode + " dry-run: no connection will be made.",
        " Kafka bootstrap   : " + config.kafkaBootstrap().orElse("<none>"),
        " Request topic     : " + config.kafkaRequestTopic(),
        " Reply topic       : " + config.kafkaReplyTopic(),
        " Event topic       : " + config.kafkaEventTopic(),
        " Namespace         : " + config.namespace(),
        " Inbox prefix      : " + config.inboxPrefix(),
        " Timeout           : " + config.timeout().toMillis() + " ms",
        " JSON output       : " + config.json(),
        " Metrics exporter  : " + config.metricsExporter(),
        " OTLP endpoint     : " + config.otelEndpoint().orElse("<default>"));
  }
}
