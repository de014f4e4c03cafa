package ca.gc.cra.lattice.domain.query;

import java.util.Locale;

/**
 * Kinds of scatter-gather requests a lattice client can broadcast.
 *
 * <p>Each kind names the subject suffix hosts listen on and the wire tag echoed in their replies.
 * The facet of {@link ca.gc.cra.lattice.domain.inventory.HostInventory} populated by a reply depends
 * on the kind.</p>
 *
 * @since 0.1.0
 */
public enum QueryKind {
  /** Host probe: identity, labels and uptime. */
  HOSTS("hosts", "inventory.hosts"),
  /** Actors running on each host. */
  ACTORS("actors", "inventory.actors"),
  /** Capability providers loaded on each host. */
  CAPABILITIES("capabilities", "inventory.capabilities"),
  /** Link bindings originating from each host. */
  BINDINGS("bindings", "inventory.bindings"),
  /** Launch auction; each reply is a bid from a host able to run the actor. */
  AUCTION("auction", "control.auction.request"),
  /** Launch command acknowledgement from a single host. */
  LAUNCH("launch", "actor.launch");

  private final String wireTag;
  private final String subjectSuffix;

  QueryKind(String wireTag, String subjectSuffix) {
    this.wireTag = wireTag;
    this.subjectSuffix = subjectSuffix;
  }

  /**
   * Returns the tag carried by requests and replies of this kind.
   *
   * @return lower-case wire tag
   */
  public String wireTag() {
    return wireTag;
  }

  /**
   * Returns the subject suffix appended to the lattice namespace.
   *
   * @return dotted subject suffix
   */
  public String subjectSuffix() {
    return subjectSuffix;
  }

  /**
   * Resolves a wire tag.
   *
   * @param raw tag as received on the wire
   * @return matching kind
   * @throws IllegalArgumentException when the tag is unknown
   */
  public static QueryKind fromWireTag(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (QueryKind kind : values()) {
        if (kind.wireTag.equals(normalized)) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown query kind: " + raw);
  }
}
