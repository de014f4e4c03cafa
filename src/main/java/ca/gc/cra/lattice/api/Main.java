package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.logging.LoggingConfigurator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code latticectl} dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: latticectl <list|watch> [options]";
  private static final String HELP_TEXT = """
      latticectl: interact with a lattice the same way its hosts do

      Usage:
        latticectl <command> [options]

      Commands:
        list <type>  List hosts, actors, bindings or capabilities (list --help for details)
        watch        Follow lattice events (watch --help for details)

      Global flags:
        --help       Show this message
        --verbose    Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    List<String> words = input.positionals();
    if (words.isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = words.get(0).toLowerCase(Locale.ROOT);
    String[] delegateArgs = input.remainderAfter(1);
    return switch (command) {
      case "list" -> ListCli.run(delegateArgs);
      case "watch" -> WatchCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
