package ca.gc.cra.lattice.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the telemetry options before the OpenTelemetry SDK is built from them.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Validates {@code metricsExporter} and {@code otelEndpoint}.
   *
   * @param effective merged configuration
   * @throws IllegalArgumentException when either value is unusable
   */
  static void validate(Map<String, String> effective) {
    if (effective == null || effective.isEmpty()) {
      return;
    }
    String exporter = effective.getOrDefault("metricsExporter", "").trim().toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = effective.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      if (exporter.equals("none")) {
        log.warn("otelEndpoint {} ignored because metricsExporter=none", endpoint);
        return;
      }
      validateEndpoint(endpoint);
      log.debug("Metrics will be exported to {}", endpoint);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
