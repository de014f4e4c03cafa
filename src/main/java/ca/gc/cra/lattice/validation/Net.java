package ca.gc.cra.lattice.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates broker endpoints supplied on the command line or in YAML.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern IPV4 = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern HOSTNAME_LABEL = Pattern.compile("\\A[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated Kafka bootstrap list.
   *
   * @param value e.g. {@code broker1:9092,broker2:9092}
   * @return normalized list with whitespace removed
   * @throws IllegalArgumentException if any entry is not a valid {@code host:port}
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> endpoints = new ArrayList<>();
    for (String entry : sanitized.split(",")) {
      if (entry.isBlank()) {
        throw new IllegalArgumentException("kafkaBootstrap must not contain empty entries");
      }
      endpoints.add(validateHostPort(entry));
    }
    return String.join(",", endpoints);
  }

  /**
   * Validates a {@code host:port} string supporting hostnames, IPv4 and bracketed IPv6 literals.
   *
   * @param value endpoint text
   * @return normalized endpoint
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String port;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("IPv6 endpoint must look like [addr]:port (was " + sanitized + ")");
      }
      validateIpv6(sanitized.substring(1, close));
      host = sanitized.substring(0, close + 1);
      port = sanitized.substring(close + 2);
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      port = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4.matcher(host).matches()) {
        for (String octet : host.split("\\.")) {
          Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
        }
      } else {
        validateHostname(host);
      }
    }
    return host + ':' + Numbers.parseRange("port", port, 1, 65535);
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("hostname longer than " + MAX_HOSTNAME_LENGTH + " characters");
    }
    for (String label : host.split("\\.", -1)) {
      if (!HOSTNAME_LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname label '" + label + "' in " + host);
      }
    }
  }

  private static void validateIpv6(String literal) {
    try {
      if (!(InetAddress.getByName(literal) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + literal);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + literal, ex);
    }
  }
}
