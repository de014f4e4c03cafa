package ca.gc.cra.lattice.infrastructure.metrics;

import ca.gc.cra.lattice.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Forwards lattice counters and observations to OpenTelemetry.
 *
 * <p>Per-kind query keys ({@code query.<kind>.<measure>}) share one instrument named
 * {@code lattice.query.<measure>} and carry the kind as the {@code lattice.query.kind} attribute, so
 * dashboards can compare kinds. Other keys map to {@code lattice.<key>} with no attributes.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  static final AttributeKey<String> KIND_ATTRIBUTE = AttributeKey.stringKey("lattice.query.kind");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting via OTLP.
   *
   * @param exporter {@code otlp} or {@code none}; blank uses the environment
   * @param endpoint OTLP endpoint; blank uses the environment
   */
  public OpenTelemetryMetricsAdapter(String exporter, String endpoint) {
    this(OpenTelemetryBootstrap.initialize(exporter, endpoint));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> resolve(k, name -> meter.counterBuilder(name).setUnit("1").build()));
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> resolve(k, name -> meter.histogramBuilder(name).ofLongs().build()));
    instrument.handle().record(value, instrument.attributes());
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  static String instrumentName(String key) {
    String[] parts = key.split("\\.");
    if (isPerKindQueryKey(parts)) {
      return "lattice.query." + parts[2];
    }
    return "lattice." + key;
  }

  private static boolean isPerKindQueryKey(String[] parts) {
    return parts.length == 3
        && "query".equals(parts[0])
        && !"decode".equals(parts[1])
        && !"correlation".equals(parts[1])
        && !"reply".equals(parts[1]);
  }

  private static <T> Instrument<T> resolve(String key, Function<String, T> builder) {
    String[] parts = key.split("\\.");
    Attributes attributes = isPerKindQueryKey(parts)
        ? Attributes.of(KIND_ATTRIBUTE, parts[1])
        : Attributes.empty();
    return new Instrument<>(builder.apply(instrumentName(key)), attributes);
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
