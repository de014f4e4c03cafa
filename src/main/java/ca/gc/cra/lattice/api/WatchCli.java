package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.application.events.EventWatcher;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.query.LatticeClient;
import ca.gc.cra.lattice.config.CompositionRoot;
import ca.gc.cra.lattice.config.LatticeConfig;
import ca.gc.cra.lattice.logging.LoggingConfigurator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code latticectl watch}: prints lattice events until interrupted.
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final String MODE = "watch";
  private static final long LIVENESS_CHECK_MILLIS = 1_000L;
  private static final String SUMMARY_USAGE =
      "usage: latticectl watch [kafkaBootstrap=HOST:PORT] [json=true|--json] [config=PATH] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      latticectl watch: follow lattice events

      Usage:
        latticectl watch kafkaBootstrap=broker:9092 [options]

      Options:
        kafkaBootstrap=HOST:PORT Kafka bootstrap servers (env LATTICE_KAFKA_BOOTSTRAP)
        kafkaEventTopic=TOPIC    Topic carrying events (default lattice.events)
        namespace=NS             Lattice subject namespace (default wasmbus)
        json=true | --json       Print each event as one JSON line
        config=PATH              YAML file; 'common' and 'watch' sections apply
        metricsExporter=otlp|none  Metrics exporter (default none for watch)
        --dry-run                Print the effective configuration without connecting
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private WatchCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CountDownLatch stop = new CountDownLatch(1);
    Thread hook = new Thread(stop::countDown, "latticectl-watch-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return run(args, ClientFactory.KAFKA, stop);
  }

  /**
   * Runs the watch until {@code stop} is released, the thread is interrupted or the subscription fails.
   */
  static ExitCode run(String[] args, ClientFactory clients, CountDownLatch stop) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for watch");
    }
    if (!input.positionals().isEmpty()) {
      log.error("Unexpected arguments: {}", input.positionals());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve(MODE, kv, input.json(), log, SUMMARY_USAGE);
    if (!resolved.ok()) {
      return resolved.failure();
    }
    LatticeConfig config = resolved.config();
    if (input.dryRun() || ConfigCliUtils.parseBoolean(resolved.effective(), "dryRun")) {
      CliPrinter.printLines(ConfigCliUtils.describe(config, MODE));
      return ExitCode.SUCCESS;
    }

    boolean json = config.json();
    try (CompositionRoot root = new CompositionRoot(config);
        LatticeClient client = clients.open(root);
        EventWatcher watcher = client.watchEvents(
            event -> CliPrinter.println(SnapshotRenderer.renderEvent(event, json)))) {
      if (!json) {
        CliPrinter.println("Watching lattice events, Ctrl+C to abort...");
      }
      while (!stop.await(LIVENESS_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
        if (!watcher.isRunning()) {
          log.error("Event subscription ended unexpectedly");
          return ExitCode.TRANSPORT_ERROR;
        }
      }
      log.info("Watch stopped after {} event(s)", watcher.deliveredCount());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Watch interrupted");
      return ExitCode.INTERRUPTED;
    } catch (TransportException | KafkaException ex) {
      log.error("Lattice unreachable: {}", ex.getMessage(), ex);
      return ExitCode.TRANSPORT_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while watching events", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
