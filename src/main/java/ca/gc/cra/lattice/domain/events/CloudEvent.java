package ca.gc.cra.lattice.domain.events;

import java.time.Instant;
import java.util.Objects;

/**
 * CloudEvents 1.0 envelope wrapping a JSON-encoded {@link BusEvent}.
 *
 * @param specVersion CloudEvents spec version, {@code 1.0} for events built here
 * @param type fully-qualified event type
 * @param typeVersion version of the event payload schema
 * @param source URI identifying the event producer
 * @param id unique event identifier
 * @param time event timestamp
 * @param dataContentType media type of {@code data}
 * @param subject entity the event concerns; may be {@code null}
 * @param data serialized bus event
 *
 * @since 0.1.0
 */
public record CloudEvent(
    String specVersion,
    String type,
    String typeVersion,
    String source,
    String id,
    Instant time,
    String dataContentType,
    String subject,
    String data) {

  public static final String SPEC_VERSION = "1.0";
  public static final String TYPE_VERSION = "0.1";
  public static final String SOURCE = "https://wascc.dev/lattice/events";
  public static final String CONTENT_TYPE = "application/json";

  public CloudEvent {
    specVersion = Objects.requireNonNull(specVersion, "specversion");
    type = Objects.requireNonNull(type, "type");
    typeVersion = Objects.requireNonNull(typeVersion, "typeversion");
    source = Objects.requireNonNull(source, "source");
    id = Objects.requireNonNull(id, "id");
    time = Objects.requireNonNull(time, "time");
    dataContentType = Objects.requireNonNull(dataContentType, "datacontenttype");
    data = Objects.requireNonNull(data, "data");
  }

  /**
   * Wraps an already-serialized bus event.
   *
   * @param event event being wrapped
   * @param serializedData JSON encoding of {@code event}
   * @param id unique event identifier
   * @param time event timestamp
   * @return envelope
   */
  public static CloudEvent wrap(BusEvent event, String serializedData, String id, Instant time) {
    return new CloudEvent(
        SPEC_VERSION,
        event.eventType(),
        TYPE_VERSION,
        SOURCE,
        id,
        time,
        CONTENT_TYPE,
        event.subject(),
        serializedData);
  }
}
