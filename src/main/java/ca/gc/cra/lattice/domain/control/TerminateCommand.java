package ca.gc.cra.lattice.domain.control;

import java.util.Objects;

/**
 * Command instructing one host to stop an actor. Hosts do not acknowledge it.
 *
 * @param actorId actor to stop; never {@code null} or blank
 *
 * @since 0.1.0
 */
public record TerminateCommand(String actorId) {

  public TerminateCommand {
    actorId = Objects.requireNonNull(actorId, "actorId").trim();
    if (actorId.isEmpty()) {
      throw new IllegalArgumentException("actorId must not be blank");
    }
  }
}
