package ca.gc.cra.lattice.domain.query;

import ca.gc.cra.lattice.domain.inventory.HostInventory;
import java.util.Objects;

/**
 * Decoded reply from one host to one scatter-gather request.
 *
 * @param correlationId correlation identifier echoed by the responder; never {@code null}
 * @param kind kind of the request being answered; never {@code null}
 * @param inventory host inventory facet carried by the reply; never {@code null}
 *
 * @since 0.1.0
 */
public record ReplyRecord(String correlationId, QueryKind kind, HostInventory inventory) {

  /**
   * Validates non-null invariants.
   */
  public ReplyRecord {
    correlationId = Objects.requireNonNull(correlationId, "correlationId");
    kind = Objects.requireNonNull(kind, "kind");
    inventory = Objects.requireNonNull(inventory, "inventory");
  }

  /**
   * Returns the responder identity used as the deduplication key.
   *
   * @return host identity of the responder
   */
  public String responder() {
    return inventory.hostId();
  }
}
