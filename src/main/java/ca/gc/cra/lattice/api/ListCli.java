package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.query.LatticeClient;
import ca.gc.cra.lattice.application.query.QueryException;
import ca.gc.cra.lattice.config.CompositionRoot;
import ca.gc.cra.lattice.config.LatticeConfig;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.logging.LoggingConfigurator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code latticectl list <hosts|actors|bindings|capabilities>}: one scatter-gather query, rendered.
 *
 * @since 0.1.0
 */
public final class ListCli {
  private static final Logger log = LoggerFactory.getLogger(ListCli.class);
  private static final String MODE = "list";
  private static final String SUMMARY_USAGE =
      "usage: latticectl list <hosts|actors|bindings|capabilities|caps> [kafkaBootstrap=HOST:PORT] "
          + "[timeoutMillis=MS] [host=HOST_ID] [json=true|--json] [config=PATH] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      latticectl list: list entities in the lattice

      Usage:
        latticectl list hosts kafkaBootstrap=broker:9092 [options]

      Entity types:
        hosts                    Hosts that answered, with uptime and label keys
        actors                   Running actors grouped by host
        bindings                 Actor to capability provider link bindings
        capabilities | caps      Loaded capability providers grouped by host

      Options:
        kafkaBootstrap=HOST:PORT Kafka bootstrap servers (env LATTICE_KAFKA_BOOTSTRAP)
        kafkaRequestTopic=TOPIC  Topic carrying requests (default lattice.requests)
        kafkaReplyTopic=TOPIC    Topic carrying replies (default lattice.replies)
        kafkaEventTopic=TOPIC    Topic carrying events (default lattice.events)
        namespace=NS             Lattice subject namespace (default wasmbus)
        inboxPrefix=PREFIX       Reply subject prefix (default _INBOX)
        timeoutMillis=MS         Collection window, 1..600000 (default 600, env LATTICE_RPC_TIMEOUT_MILLIS)
        host=HOST_ID             Ask a single host instead of the whole lattice (not for bindings)
        json=true | --json       Render JSON instead of text
        config=PATH              YAML file; 'common' and 'list' sections apply
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL         OTLP metrics endpoint
        --dry-run                Print the effective configuration without connecting
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ListCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, ClientFactory.KAFKA);
  }

  static ExitCode run(String[] args, ClientFactory clients) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for list");
    }

    List<String> words = input.positionals();
    if (words.size() != 1) {
      log.error(words.isEmpty() ? "Missing entity type" : "Expected one entity type but got {}", words);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ListTarget target;
    Map<String, String> kv;
    try {
      target = ListTarget.fromString(words.get(0));
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String hostId = kv.remove("host");
    if (hostId != null && target == ListTarget.BINDINGS) {
      log.error("host= is not supported for bindings");
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

    QueryScope scope;
    try {
      scope = hostId == null || hostId.isBlank() ? QueryScope.all() : QueryScope.host(hostId);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid host: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config);
        LatticeClient client = clients.open(root)) {
      AggregatedSnapshot snapshot = query(client, target, scope);
      if (!snapshot.hasResponses()) {
        log.info("No hosts responded within {} ms", config.timeout().toMillis());
      }
      if (config.json()) {
        CliPrinter.println(SnapshotRenderer.renderJson(target, snapshot));
      } else {
        CliPrinter.printLines(SnapshotRenderer.renderText(target, snapshot));
      }
      return ExitCode.SUCCESS;
    } catch (QueryException ex) {
      return switch (ex.kind()) {
        case TRANSPORT -> {
          log.error("Lattice unreachable: {}", ex.getMessage());
          yield ExitCode.TRANSPORT_ERROR;
        }
        case CANCELLED -> {
          log.error("Listing {} was interrupted", target);
          yield ExitCode.INTERRUPTED;
        }
        case INSUFFICIENT -> {
          log.error("Listing {} failed: {}", target, ex.getMessage());
          yield ExitCode.RUNTIME_FAILURE;
        }
      };
    } catch (TransportException | KafkaException ex) {
      log.error("Lattice unreachable: {}", ex.getMessage(), ex);
      return ExitCode.TRANSPORT_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure listing {}", target, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static AggregatedSnapshot query(LatticeClient client, ListTarget target, QueryScope scope) {
    return switch (target) {
      case HOSTS -> scope.type() == QueryScope.Type.HOST
          ? client.probeHost(scope.target())
          : client.probeAll();
      case ACTORS -> client.queryWorkloads(scope);
      case CAPABILITIES -> client.queryCapabilities(scope);
      case BINDINGS -> client.queryLinks();
    };
  }
}
