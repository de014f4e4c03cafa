package ca.gc.cra.lattice.config;

import ca.gc.cra.lattice.application.query.TopicConventions;
import ca.gc.cra.lattice.validation.Net;
import ca.gc.cra.lattice.validation.Numbers;
import ca.gc.cra.lattice.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings for connecting to a lattice and running queries.
 * <p><strong>Why:</strong> Collects the Kafka, subject, timeout and telemetry options the CLI merges from
 * defaults, YAML and {@code key=value} arguments.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param kafkaBootstrap Kafka bootstrap servers; empty until configured
 * @param kafkaRequestTopic topic carrying requests and control commands
 * @param kafkaReplyTopic topic carrying replies to inbox subjects
 * @param kafkaEventTopic topic carrying lattice events
 * @param namespace lattice subject namespace
 * @param inboxPrefix first token of reply subjects
 * @param timeout default collection window
 * @param json render CLI output as JSON
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; empty uses the exporter default
 * @since 0.1.0
 */
public record LatticeConfig(
    Optional<String> kafkaBootstrap,
    String kafkaRequestTopic,
    String kafkaReplyTopic,
    String kafkaEventTopic,
    String namespace,
    String inboxPrefix,
    Duration timeout,
    boolean json,
    String metricsExporter,
    Optional<String> otelEndpoint) {

  public static final String DEFAULT_REQUEST_TOPIC = "lattice.requests";
  public static final String DEFAULT_REPLY_TOPIC = "lattice.replies";
  public static final String DEFAULT_EVENT_TOPIC = "lattice.events";
  public static final long DEFAULT_TIMEOUT_MILLIS = 600L;
  public static final long MAX_TIMEOUT_MILLIS = 600_000L;

  public LatticeConfig {
    kafkaBootstrap = Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    kafkaRequestTopic = Strings.sanitizeTopic("kafkaRequestTopic", kafkaRequestTopic);
    kafkaReplyTopic = Strings.sanitizeTopic("kafkaReplyTopic", kafkaReplyTopic);
    kafkaEventTopic = Strings.sanitizeTopic("kafkaEventTopic", kafkaEventTopic);
    namespace = Strings.requireSubject("namespace", namespace);
    inboxPrefix = Strings.requireSubject("inboxPrefix", inboxPrefix);
    Objects.requireNonNull(timeout, "timeout");
    Numbers.requireRange("timeoutMillis", timeout.toMillis(), 1, MAX_TIMEOUT_MILLIS);
    metricsExporter = parseExporter(metricsExporter);
    otelEndpoint = Objects.requireNonNull(otelEndpoint, "otelEndpoint");
    if (namespace.equals(inboxPrefix)) {
      throw new IllegalArgumentException("inboxPrefix must differ from namespace");
    }
  }

  /**
   * Returns the configuration used when nothing is supplied.
   *
   * @return defaults without a Kafka bootstrap
   */
  public static LatticeConfig defaults() {
    return new LatticeConfig(
        Optional.empty(),
        DEFAULT_REQUEST_TOPIC,
        DEFAULT_REPLY_TOPIC,
        DEFAULT_EVENT_TOPIC,
        TopicConventions.DEFAULT_NAMESPACE,
        TopicConventions.DEFAULT_INBOX_PREFIX,
        Duration.ofMillis(DEFAULT_TIMEOUT_MILLIS),
        false,
        "otlp",
        Optional.empty());
  }

  /**
   * Builds a configuration from flat {@code key=value} options; absent keys fall back to {@link #defaults()}.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static LatticeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    LatticeConfig defaults = defaults();

    Optional<String> bootstrap = optionalString(options.get("kafkaBootstrap")).map(Net::validateBootstrapServers);
    long timeoutMillis = optionalString(options.get("timeoutMillis"))
        .map(raw -> Numbers.parseRange("timeoutMillis", raw, 1, MAX_TIMEOUT_MILLIS))
        .orElse(defaults.timeout().toMillis());

    return new LatticeConfig(
        bootstrap,
        optionalString(options.get("kafkaRequestTopic")).orElse(defaults.kafkaRequestTopic()),
        optionalString(options.get("kafkaReplyTopic")).orElse(defaults.kafkaReplyTopic()),
        optionalString(options.get("kafkaEventTopic")).orElse(defaults.kafkaEventTopic()),
        optionalString(options.get("namespace")).orElse(defaults.namespace()),
        optionalString(options.get("inboxPrefix")).orElse(defaults.inboxPrefix()),
        Duration.ofMillis(timeoutMillis),
        parseBoolean(options.get("json"), defaults.json()),
        optionalString(options.get("metricsExporter")).orElse(defaults.metricsExporter()),
        optionalString(options.get("otelEndpoint")));
  }

  public TopicConventions topicConventions() {
    return new TopicConventions(namespace, inboxPrefix);
  }

  public boolean metricsEnabled() {
    return !"none".equals(metricsExporter);
  }

  /**
   * Returns the bootstrap servers, failing when none were configured.
   *
   * @return bootstrap servers
   * @throws IllegalArgumentException when {@code kafkaBootstrap} is missing
   */
  public String requireKafkaBootstrap() {
    return kafkaBootstrap.orElseThrow(() ->
        new IllegalArgumentException("kafkaBootstrap is required (set kafkaBootstrap=HOST:PORT or LATTICE_KAFKA_BOOTSTRAP)"));
  }

  private static String parseExporter(String raw) {
    String normalized = raw == null ? "otlp" : raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return "otlp";
    }
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected true or false but was '" + value + "'");
    };
  }
}
