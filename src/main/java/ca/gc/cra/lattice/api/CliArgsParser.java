package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a configuration map.
 *
 * <p>Short aliases match the flags operators know from the original lattice tooling:
 * {@code timeout} and {@code t} for {@code timeoutMillis}, {@code url} and {@code bootstrap} for
 * {@code kafkaBootstrap}.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final Map<String, String> ALIASES = Map.of(
      "timeout", "timeoutMillis",
      "t", "timeoutMillis",
      "url", "kafkaBootstrap",
      "bootstrap", "kafkaBootstrap",
      "ns", "namespace");

  private CliArgsParser() {}

  /**
   * Parses arguments split on the first {@code '='}; later duplicates win.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map of canonical keys to trimmed values
   * @throws IllegalArgumentException on malformed arguments
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(ALIASES.getOrDefault(key, key), value);
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
