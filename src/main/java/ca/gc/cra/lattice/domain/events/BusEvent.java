package ca.gc.cra.lattice.domain.events;

import java.util.Objects;

/**
 * <strong>What:</strong> One lifecycle event observed on the lattice event subject.
 * <p><strong>Why:</strong> Gives watchers a typed view of host, actor, provider and binding changes without
 * exposing the envelope format.</p>
 * <p><strong>Role:</strong> Domain value decoded from the {@code data} member of a {@link CloudEvent}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Fields not carried by the event's {@link BusEventType.Shape} are {@code null}.</p>
 *
 * @param type event type; never {@code null}
 * @param host identity of the host that raised the event; never {@code null}
 * @param actor actor identifier for actor and binding events
 * @param capabilityId capability contract id for provider and binding events
 * @param instanceName provider instance (binding) name for provider and binding events
 * @param success outcome flag for {@link BusEventType#ACTOR_UPDATE_COMPLETE}
 *
 * @since 0.1.0
 */
public record BusEvent(
    BusEventType type,
    String host,
    String actor,
    String capabilityId,
    String instanceName,
    Boolean success) {

  /**
   * Validates that the fields required by the type's shape are present.
   */
  public BusEvent {
    type = Objects.requireNonNull(type, "type");
    host = require(host, "host");
    switch (type.shape()) {
      case HOST -> {
        actor = null;
        capabilityId = null;
        instanceName = null;
        success = null;
      }
      case ACTOR -> {
        actor = require(actor, "actor");
        capabilityId = null;
        instanceName = null;
        success = null;
      }
      case ACTOR_OUTCOME -> {
        actor = require(actor, "actor");
        Objects.requireNonNull(success, "success");
        capabilityId = null;
        instanceName = null;
      }
      case PROVIDER -> {
        capabilityId = require(capabilityId, "capid");
        instanceName = require(instanceName, "instance_name");
        actor = null;
        success = null;
      }
      case BINDING -> {
        actor = require(actor, "actor");
        capabilityId = require(capabilityId, "capid");
        instanceName = require(instanceName, "instance_name");
        success = null;
      }
      default -> throw new IllegalStateException("Unhandled shape " + type.shape());
    }
  }

  /**
   * Builds a host lifecycle event.
   *
   * @param type {@link BusEventType.Shape#HOST} type
   * @param host host identity
   * @return event
   */
  public static BusEvent host(BusEventType type, String host) {
    return new BusEvent(type, host, null, null, null, null);
  }

  /**
   * Builds an actor lifecycle event.
   *
   * @param type {@link BusEventType.Shape#ACTOR} type
   * @param host host identity
   * @param actor actor identifier
   * @return event
   */
  public static BusEvent actor(BusEventType type, String host, String actor) {
    return new BusEvent(type, host, actor, null, null, null);
  }

  /**
   * Builds an update-complete event.
   *
   * @param host host identity
   * @param actor actor identifier
   * @param success whether the update succeeded
   * @return event
   */
  public static BusEvent updateComplete(String host, String actor, boolean success) {
    return new BusEvent(BusEventType.ACTOR_UPDATE_COMPLETE, host, actor, null, null, success);
  }

  /**
   * Builds a provider event.
   *
   * @param type {@link BusEventType.Shape#PROVIDER} type
   * @param host host identity
   * @param capabilityId capability contract id
   * @param instanceName provider instance name
   * @return event
   */
  public static BusEvent provider(BusEventType type, String host, String capabilityId, String instanceName) {
    return new BusEvent(type, host, null, capabilityId, instanceName, null);
  }

  /**
   * Builds a binding event.
   *
   * @param type {@link BusEventType.Shape#BINDING} type
   * @param host host identity
   * @param actor bound actor
   * @param capabilityId capability contract id
   * @param instanceName provider instance name
   * @return event
   */
  public static BusEvent binding(
      BusEventType type, String host, String actor, String capabilityId, String instanceName) {
    return new BusEvent(type, host, actor, capabilityId, instanceName, null);
  }

  /**
   * Returns the fully-qualified CloudEvents type.
   *
   * @return {@code wasmbus.events.<suffix>}
   */
  public String eventType() {
    return type.eventType();
  }

  /**
   * Returns the entity the event is about.
   *
   * @return host id, actor id, {@code capid.instance} or {@code actor.capid.instance}
   */
  public String subject() {
    return switch (type.shape()) {
      case HOST -> host;
      case ACTOR, ACTOR_OUTCOME -> actor;
      case PROVIDER -> capabilityId + '.' + instanceName;
      case BINDING -> actor + '.' + capabilityId + '.' + instanceName;
    };
  }

  @Override
  public String toString() {
    String prefix = "[" + host + "] ";
    return prefix + switch (type) {
      case HOST_STARTED -> "Host started";
      case HOST_STOPPED -> "Host stopped";
      case ACTOR_STARTING -> "Actor " + actor + " starting";
      case ACTOR_STARTED -> "Actor " + actor + " started";
      case ACTOR_STOPPED -> "Actor " + actor + " stopped";
      case ACTOR_UPDATING -> "Actor " + actor + " updating";
      case ACTOR_UPDATE_COMPLETE ->
          "Actor " + actor + " update " + (Boolean.TRUE.equals(success) ? "succeeded" : "failed");
      case PROVIDER_LOADED -> "Provider " + capabilityId + ',' + instanceName + " loaded";
      case PROVIDER_REMOVED -> "Provider " + capabilityId + ',' + instanceName + " removed";
      case ACTOR_BINDING_CREATED ->
          "Actor " + actor + " bound to " + capabilityId + ',' + instanceName;
      case ACTOR_BINDING_REMOVED ->
          "Actor " + actor + " un-bound from " + capabilityId + ',' + instanceName;
      case ACTOR_BECAME_HEALTHY -> "Actor " + actor + " became healthy";
      case ACTOR_BECAME_UNHEALTHY -> "Actor " + actor + " became unhealthy";
    };
  }

  private static String require(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value.trim();
  }
}
