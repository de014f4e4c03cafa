package ca.gc.cra.lattice.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line split into positional words ({@code list hosts}), {@code key=value} options and flags.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> JSON_FLAGS = Set.of("--json", "-j");

  private final List<String> positionals;
  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> positionals, List<String> keyValueArgs, Set<String> flags) {
    this.positionals = List.copyOf(positionals);
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are ignored.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> positionals = new ArrayList<>();
    List<String> keyValues = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(positionals, keyValues, flags);
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (JSON_FLAGS.contains(lower)) {
        flags.add("--json");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (arg.contains("=")) {
        keyValues.add(arg);
      } else {
        positionals.add(arg);
      }
    }
    return new CliInput(positionals, keyValues, flags);
  }

  public List<String> positionals() {
    return positionals;
  }

  /**
   * Returns positional words after the first {@code count}, re-joined with the options and flags so a
   * subcommand can parse them again.
   *
   * @param count number of leading positionals consumed by the caller
   * @return remaining arguments
   */
  public String[] remainderAfter(int count) {
    List<String> rest = new ArrayList<>();
    if (count < positionals.size()) {
      rest.addAll(positionals.subList(count, positionals.size()));
    }
    rest.addAll(keyValueArgs);
    rest.addAll(flags);
    return rest.toArray(String[]::new);
  }

  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  public boolean dryRun() {
    return flags.contains("--dry-run");
  }

  public boolean json() {
    return flags.contains("--json");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
