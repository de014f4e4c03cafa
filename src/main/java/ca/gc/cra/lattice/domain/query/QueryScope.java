package ca.gc.cra.lattice.domain.query;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects which part of the lattice a query addresses.
 *
 * @param type scope type; never {@code null}
 * @param target host or workload identifier; {@code null} for {@link Type#ALL_HOSTS}
 *
 * @since 0.1.0
 */
public record QueryScope(Type type, String target) {

  private static final QueryScope ALL = new QueryScope(Type.ALL_HOSTS, null);

  /** Scope selector. */
  public enum Type {
    /** Every host listening on the bus. */
    ALL_HOSTS,
    /** A single host addressed by its identity. */
    HOST,
    /** Hosts running a specific workload. */
    WORKLOAD;

    /**
     * Resolves a scope type name case-insensitively.
     *
     * @param raw scope type name
     * @return matching type
     * @throws IllegalArgumentException when unknown
     */
    public static Type fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return ALL_HOSTS;
      }
      String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      return switch (normalized) {
        case "ALL", "ALL_HOSTS" -> ALL_HOSTS;
        case "HOST" -> HOST;
        case "WORKLOAD" -> WORKLOAD;
        default -> throw new IllegalArgumentException("Unknown scope type: " + raw);
      };
    }
  }

  /**
   * Validates that targeted scopes name a target and broadcast scopes do not.
   */
  public QueryScope {
    type = Objects.requireNonNull(type, "type");
    if (type == Type.ALL_HOSTS) {
      target = null;
    } else {
      target = Objects.requireNonNull(target, "target").trim();
      if (target.isEmpty()) {
        throw new IllegalArgumentException(type + " scope requires a target");
      }
    }
  }

  /**
   * Returns the broadcast scope.
   *
   * @return scope addressing every host
   */
  public static QueryScope all() {
    return ALL;
  }

  /**
   * Returns a scope addressing a single host.
   *
   * @param hostId host identity
   * @return host scope
   */
  public static QueryScope host(String hostId) {
    return new QueryScope(Type.HOST, hostId);
  }

  /**
   * Returns a scope addressing the hosts running a workload.
   *
   * @param workloadId workload identifier
   * @return workload scope
   */
  public static QueryScope workload(String workloadId) {
    return new QueryScope(Type.WORKLOAD, workloadId);
  }

  /**
   * Returns the target identifier when the scope is targeted.
   *
   * @return target identifier, empty for {@link Type#ALL_HOSTS}
   */
  public Optional<String> targetId() {
    return Optional.ofNullable(target);
  }

  @Override
  public String toString() {
    return target == null ? type.name() : type.name() + ':' + target;
  }
}
