package ca.gc.cra.lattice.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode, seeded from the environment.
 *
 * <p>{@code LATTICE_KAFKA_BOOTSTRAP} and {@code LATTICE_RPC_TIMEOUT_MILLIS} override the built-in
 * bootstrap and timeout defaults; YAML and CLI values override both.</p>
 */
public final class DefaultsForMode {
  static final String ENV_KAFKA_BOOTSTRAP = "LATTICE_KAFKA_BOOTSTRAP";
  static final String ENV_RPC_TIMEOUT = "LATTICE_RPC_TIMEOUT_MILLIS";

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} using the process environment.
   *
   * @param mode CLI mode ({@code list} or {@code watch})
   * @return unmodifiable defaults
   */
  public static Map<String, String> asFlatMap(String mode) {
    return asFlatMap(mode, System.getenv());
  }

  static Map<String, String> asFlatMap(String mode, Map<String, String> environment) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> env = environment == null ? Map.of() : environment;
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(commonDefaults(env));
    defaults.putAll(switch (normalized) {
      case "list" -> listDefaults();
      case "watch" -> watchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> commonDefaults(Map<String, String> env) {
    LatticeConfig defaults = LatticeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kafkaBootstrap", env.getOrDefault(ENV_KAFKA_BOOTSTRAP, ""));
    map.put("kafkaRequestTopic", defaults.kafkaRequestTopic());
    map.put("kafkaReplyTopic", defaults.kafkaReplyTopic());
    map.put("kafkaEventTopic", defaults.kafkaEventTopic());
    map.put("namespace", defaults.namespace());
    map.put("inboxPrefix", defaults.inboxPrefix());
    map.put("timeoutMillis", env.getOrDefault(ENV_RPC_TIMEOUT, Long.toString(defaults.timeout().toMillis())));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> listDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("json", "false");
    return map;
  }

  private static Map<String, String> watchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("json", "false");
    // watch runs until interrupted; exporting per-event metrics over OTLP is opt-in
    map.put("metricsExporter", "none");
    return map;
  }
}
