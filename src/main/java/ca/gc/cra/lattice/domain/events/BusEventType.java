package ca.gc.cra.lattice.domain.events;

import java.util.Locale;

/**
 * Lifecycle events hosts publish on the lattice event subject.
 *
 * <p>Each type records which payload fields it carries so decoders can reject events missing a
 * required field.</p>
 *
 * @since 0.1.0
 */
public enum BusEventType {
  HOST_STARTED("host_started", Shape.HOST),
  HOST_STOPPED("host_stopped", Shape.HOST),
  ACTOR_STARTING("actor_starting", Shape.ACTOR),
  ACTOR_STARTED("actor_started", Shape.ACTOR),
  ACTOR_STOPPED("actor_stopped", Shape.ACTOR),
  ACTOR_UPDATING("actor_updating", Shape.ACTOR),
  ACTOR_UPDATE_COMPLETE("actor_update_complete", Shape.ACTOR_OUTCOME),
  PROVIDER_LOADED("provider_loaded", Shape.PROVIDER),
  PROVIDER_REMOVED("provider_removed", Shape.PROVIDER),
  ACTOR_BINDING_CREATED("actor_binding_created", Shape.BINDING),
  ACTOR_BINDING_REMOVED("actor_binding_removed", Shape.BINDING),
  ACTOR_BECAME_HEALTHY("actor_became_healthy", Shape.ACTOR),
  ACTOR_BECAME_UNHEALTHY("actor_became_unhealthy", Shape.ACTOR);

  /** Prefix shared by every event type string. */
  public static final String EVENT_TYPE_PREFIX = "wasmbus.events";

  /** Payload fields carried by a family of event types. */
  public enum Shape {
    /** Host identity only. */
    HOST,
    /** Host and actor. */
    ACTOR,
    /** Host, actor and success flag. */
    ACTOR_OUTCOME,
    /** Host, capability id and instance name. */
    PROVIDER,
    /** Host, actor, capability id and instance name. */
    BINDING
  }

  private final String suffix;
  private final Shape shape;

  BusEventType(String suffix, Shape shape) {
    this.suffix = suffix;
    this.shape = shape;
  }

  /**
   * Returns the snake-case suffix used on the wire.
   *
   * @return event suffix
   */
  public String suffix() {
    return suffix;
  }

  /**
   * Returns the payload shape of this type.
   *
   * @return payload shape
   */
  public Shape shape() {
    return shape;
  }

  /**
   * Returns the fully-qualified CloudEvents type string.
   *
   * @return {@code wasmbus.events.<suffix>}
   */
  public String eventType() {
    return EVENT_TYPE_PREFIX + '.' + suffix;
  }

  /**
   * Resolves a suffix or fully-qualified event type.
   *
   * @param raw {@code actor_started} or {@code wasmbus.events.actor_started}
   * @return matching type
   * @throws IllegalArgumentException when the type is unknown
   */
  public static BusEventType fromWire(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.startsWith(EVENT_TYPE_PREFIX + '.')) {
        normalized = normalized.substring(EVENT_TYPE_PREFIX.length() + 1);
      }
      for (BusEventType type : values()) {
        if (type.suffix.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown bus event type: " + raw);
  }
}
