package ca.gc.cra.lattice.domain.inventory;

import java.util.Locale;

/**
 * Tag discriminating the workloads a lattice host can run.
 *
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and safe to share.
 *
 * @since 0.1.0
 */
public enum WorkloadKind {
  /** A WebAssembly actor. */
  ACTOR("actor"),
  /** A native capability provider that actors bind to. */
  CAPABILITY_PROVIDER("capability-provider"),
  /** Any workload tag this client does not recognize. */
  OTHER("other");

  private final String wireTag;

  WorkloadKind(String wireTag) {
    this.wireTag = wireTag;
  }

  /**
   * Returns the tag used on the wire for this kind.
   *
   * @return lower-case wire tag
   */
  public String wireTag() {
    return wireTag;
  }

  /**
   * Resolves a wire tag; unknown or blank tags map to {@link #OTHER}.
   *
   * @param raw tag received from a host; may be {@code null}
   * @return matching kind, never {@code null}
   */
  public static WorkloadKind fromWireTag(String raw) {
    if (raw == null || raw.isBlank()) {
      return OTHER;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (WorkloadKind kind : values()) {
      if (kind.wireTag.equals(normalized)) {
        return kind;
      }
    }
    return OTHER;
  }
}
