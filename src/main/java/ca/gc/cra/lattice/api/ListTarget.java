package ca.gc.cra.lattice.api;

import java.util.Locale;

/**
 * Entity types {@code latticectl list} can show.
 */
enum ListTarget {
  HOSTS,
  ACTORS,
  BINDINGS,
  CAPABILITIES;

  static ListTarget fromString(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("missing entity type");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "hosts" -> HOSTS;
      case "actors" -> ACTORS;
      case "bindings" -> BINDINGS;
      case "capabilities", "caps" -> CAPABILITIES;
      default -> throw new IllegalArgumentException(
          "Unknown entity type. Valid types are: hosts, actors, capabilities, bindings");
    };
  }
}
