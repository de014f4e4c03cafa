package ca.gc.cra.lattice.config;

import ca.gc.cra.lattice.adapter.kafka.KafkaTopics;
import ca.gc.cra.lattice.adapter.kafka.KafkaTransportAdapter;
import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.LatticeCodec;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.TransportPort;
import ca.gc.cra.lattice.application.query.LatticeClient;
import ca.gc.cra.lattice.infrastructure.codec.JsonLatticeCodec;
import ca.gc.cra.lattice.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.lattice.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.lattice.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the Kafka transport, JSON codec, metrics and clock into a {@link LatticeClient}.
 * <p><strong>Why:</strong> Keeps adapter construction out of the CLI and the application layer.</p>
 * <p><strong>Role:</strong> Composition root used by the CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Build on one thread; the returned client is thread-safe.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and closes it with {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final LatticeConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock = new SystemClockAdapter();
  private final LatticeCodec codec = new JsonLatticeCodec();

  /**
   * Creates a root whose metrics follow {@link LatticeConfig#metricsExporter()}.
   *
   * @param config effective configuration
   */
  public CompositionRoot(LatticeConfig config) {
    this(config, createMetrics(config));
  }

  /**
   * Creates a root with an explicit metrics adapter, used by tests.
   *
   * @param config effective configuration
   * @param metrics metrics adapter
   */
  public CompositionRoot(LatticeConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public LatticeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public LatticeCodec codec() {
    return codec;
  }

  /**
   * Builds the Kafka transport.
   *
   * @return transport connected to {@link LatticeConfig#requireKafkaBootstrap()}
   * @throws IllegalArgumentException when no bootstrap servers are configured
   */
  public TransportPort kafkaTransport() {
    KafkaTopics topics = new KafkaTopics(
        config.kafkaRequestTopic(), config.kafkaReplyTopic(), config.kafkaEventTopic(), config.inboxPrefix());
    return new KafkaTransportAdapter(config.requireKafkaBootstrap(), topics, metrics, clock);
  }

  /**
   * Builds a client over the Kafka transport.
   *
   * @return client owning a new Kafka transport
   */
  public LatticeClient latticeClient() {
    return latticeClient(kafkaTransport());
  }

  /**
   * Builds a client over a caller-supplied transport.
   *
   * @param transport transport the client takes ownership of
   * @return configured client
   */
  public LatticeClient latticeClient(TransportPort transport) {
    log.debug("Building lattice client: namespace={}, inboxPrefix={}, timeout={} ms",
        config.namespace(), config.inboxPrefix(), config.timeout().toMillis());
    return new LatticeClient(
        transport, codec, metrics, clock, config.topicConventions(), config.timeout(), null, null);
  }

  /**
   * Flushes and shuts down the metrics pipeline.
   */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static MetricsPort createMetrics(LatticeConfig config) {
    Objects.requireNonNull(config, "config");
    if (!config.metricsEnabled()) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint().orElse(""));
  }
}
