package ca.gc.cra.lattice.domain.control;

import java.util.Objects;

/**
 * Command instructing one host to load and start an actor.
 *
 * @param actorId actor to launch; never {@code null} or blank
 * @param revision actor revision; never negative
 *
 * @since 0.1.0
 */
public record LaunchCommand(String actorId, int revision) {

  public LaunchCommand {
    actorId = Objects.requireNonNull(actorId, "actorId").trim();
    if (actorId.isEmpty()) {
      throw new IllegalArgumentException("actorId must not be blank");
    }
    if (revision < 0) {
      throw new IllegalArgumentException("revision must not be negative");
    }
  }
}
