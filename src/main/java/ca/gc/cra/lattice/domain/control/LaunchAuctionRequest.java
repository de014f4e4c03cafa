package ca.gc.cra.lattice.domain.control;

import java.util.Map;
import java.util.Objects;

/**
 * Broadcast asking every host that can run an actor under the given constraints to bid.
 *
 * <p>Hosts meeting the constraints reply with their identity; hosts that cannot run the actor stay
 * silent.</p>
 *
 * @param actorId actor to place; never {@code null} or blank
 * @param revision actor revision to launch; never negative
 * @param constraints host label constraints every bidder must satisfy; never {@code null}
 *
 * @since 0.1.0
 */
public record LaunchAuctionRequest(String actorId, int revision, Map<String, String> constraints) {

  public LaunchAuctionRequest {
    actorId = Objects.requireNonNull(actorId, "actorId").trim();
    if (actorId.isEmpty()) {
      throw new IllegalArgumentException("actorId must not be blank");
    }
    if (revision < 0) {
      throw new IllegalArgumentException("revision must not be negative");
    }
    constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
  }
}
