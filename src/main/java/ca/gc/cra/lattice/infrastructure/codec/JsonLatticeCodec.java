package ca.gc.cra.lattice.infrastructure.codec;

import ca.gc.cra.lattice.application.port.DecodeError;
import ca.gc.cra.lattice.application.port.DecodeResult;
import ca.gc.cra.lattice.application.port.LatticeCodec;
import ca.gc.cra.lattice.domain.control.TerminateCommand;
import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.domain.events.BusEventType;
import ca.gc.cra.lattice.domain.events.CloudEvent;
import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.inventory.LinkBinding;
import ca.gc.cra.lattice.domain.inventory.WorkloadDescriptor;
import ca.gc.cra.lattice.domain.inventory.WorkloadKind;
import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> JSON implementation of {@link LatticeCodec} built on the Jackson streaming API.
 * <p><strong>Why:</strong> Lattice hosts speak JSON; streaming keeps the client free of a data-binding layer.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the collector (replies), the façade (requests,
 * commands) and the event watcher (CloudEvents envelopes).</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent use.</p>
 *
 * <p>Reply document:</p>
 * <pre>{@code
 * {"correlationId":"c1","kind":"actors","host":"N1","uptimeMs":1200,
 *  "labels":{"os":"linux"},
 *  "workloads":[{"id":"M1","kind":"actor","revision":"2"}],
 *  "bindings":[{"actor":"M1","capabilityId":"wascc:keyvalue","bindingName":"default",
 *               "configuration":{"URL":"redis://"}}]}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonLatticeCodec implements LatticeCodec {
  private final JsonFactory factory = new JsonFactory();
  private final JsonTree tree = new JsonTree(factory);

  @Override
  public byte[] encodeRequest(QueryRequest request) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("correlationId", request.correlationId());
      gen.writeStringField("kind", request.kind().wireTag());
      gen.writeObjectFieldStart("scope");
      gen.writeStringField("type", request.scope().type().name());
      if (request.scope().target() != null) {
        gen.writeStringField("target", request.scope().target());
      }
      gen.writeEndObject();
      gen.writeStringField("replyTo", request.replySubject());
      gen.writeNumberField("timeoutMillis", request.timeout().toMillis());
      writeStringMap(gen, "parameters", request.parameters());
      gen.writeEndObject();
    });
  }

  @Override
  public DecodeResult<QueryRequest> decodeRequest(byte[] payload) {
    return decode(payload, root -> {
      String correlationId = requireCorrelation(root);
      Map<String, Object> scope = optionalObject(root, "scope");
      QueryScope.Type type = QueryScope.Type.fromString(optionalString(scope, "type"));
      QueryScope resolved = new QueryScope(type, optionalString(scope, "target"));
      long timeoutMillis = requireNumber(root, "timeoutMillis").longValue();
      return new QueryRequest(
          correlationId,
          QueryKind.fromWireTag(requireString(root, "kind")),
          resolved,
          requireString(root, "replyTo"),
          Duration.ofMillis(timeoutMillis),
          stringMap(root, "parameters"));
    });
  }

  @Override
  public byte[] encodeReply(ReplyRecord reply) {
    HostInventory inventory = reply.inventory();
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("correlationId", reply.correlationId());
      gen.writeStringField("kind", reply.kind().wireTag());
      gen.writeStringField("host", inventory.hostId());
      gen.writeNumberField("uptimeMs", inventory.uptimeMillis());
      writeStringMap(gen, "labels", inventory.labels());
      gen.writeArrayFieldStart("workloads");
      for (WorkloadDescriptor workload : inventory.workloads()) {
        gen.writeStartObject();
        gen.writeStringField("id", workload.id());
        gen.writeStringField("kind", workload.kind().wireTag());
        if (workload.instanceName() != null) {
          gen.writeStringField("instanceName", workload.instanceName());
        }
        if (workload.revision() != null) {
          gen.writeStringField("revision", workload.revision());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("bindings");
      for (LinkBinding binding : inventory.bindings()) {
        gen.writeStartObject();
        gen.writeStringField("actor", binding.workloadId());
        gen.writeStringField("capabilityId", binding.contractId());
        gen.writeStringField("bindingName", binding.bindingName());
        writeStringMap(gen, "configuration", binding.configuration());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  @Override
  public DecodeResult<ReplyRecord> decodeReply(byte[] payload) {
    return decode(payload, root -> {
      String correlationId = requireCorrelation(root);
      QueryKind kind = QueryKind.fromWireTag(requireString(root, "kind"));
      List<WorkloadDescriptor> workloads = new ArrayList<>();
      for (Map<String, Object> item : objectList(root, "workloads")) {
        workloads.add(new WorkloadDescriptor(
            requireString(item, "id"),
            WorkloadKind.fromWireTag(optionalString(item, "kind")),
            optionalString(item, "instanceName"),
            optionalString(item, "revision")));
      }
      List<LinkBinding> bindings = new ArrayList<>();
      for (Map<String, Object> item : objectList(root, "bindings")) {
        bindings.add(new LinkBinding(
            requireString(item, "actor"),
            requireString(item, "capabilityId"),
            optionalString(item, "bindingName"),
            stringMap(item, "configuration")));
      }
      Number uptime = optionalNumber(root, "uptimeMs");
      HostInventory inventory = new HostInventory(
          requireString(root, "host"),
          workloads,
          bindings,
          stringMap(root, "labels"),
          uptime == null ? 0L : uptime.longValue());
      return new ReplyRecord(correlationId, kind, inventory);
    });
  }

  @Override
  public byte[] encodeTerminate(TerminateCommand command) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("actorId", command.actorId());
      gen.writeEndObject();
    });
  }

  @Override
  public DecodeResult<TerminateCommand> decodeTerminate(byte[] payload) {
    return decode(payload, root -> new TerminateCommand(requireString(root, "actorId")));
  }

  @Override
  public byte[] encodeEvent(BusEvent event, String eventId, Instant time) {
    String data = new String(encodeBusEvent(event), StandardCharsets.UTF_8);
    CloudEvent envelope = CloudEvent.wrap(event, data, eventId, time);
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("specversion", envelope.specVersion());
      gen.writeStringField("type", envelope.type());
      gen.writeStringField("typeversion", envelope.typeVersion());
      gen.writeStringField("source", envelope.source());
      gen.writeStringField("id", envelope.id());
      gen.writeStringField("time", envelope.time().toString());
      gen.writeStringField("datacontenttype", envelope.dataContentType());
      if (envelope.subject() != null) {
        gen.writeStringField("subject", envelope.subject());
      }
      gen.writeStringField("data", envelope.data());
      gen.writeEndObject();
    });
  }

  @Override
  public DecodeResult<BusEvent> decodeEvent(byte[] payload) {
    DecodeResult<CloudEvent> envelope = decodeEnvelope(payload);
    if (!envelope.isSuccess()) {
      DecodeError error = envelope.error().orElseThrow();
      return DecodeResult.failure(error.kind(), error.detail());
    }
    CloudEvent cloudEvent = envelope.orElseThrow();
    DecodeResult<BusEvent> event = decode(
        cloudEvent.data().getBytes(StandardCharsets.UTF_8), this::readBusEvent);
    if (event.isSuccess() && !event.orElseThrow().eventType().equals(cloudEvent.type())) {
      return DecodeResult.failure(
          DecodeError.Kind.SCHEMA_MISMATCH,
          "envelope type " + cloudEvent.type() + " does not match data type "
              + event.orElseThrow().eventType());
    }
    return event;
  }

  /**
   * Decodes only the CloudEvents envelope; {@code data} is returned as JSON text.
   *
   * @param payload raw envelope bytes
   * @return envelope or the reason it was rejected
   */
  public DecodeResult<CloudEvent> decodeEnvelope(byte[] payload) {
    return decode(payload, root -> {
      Object data = root.get("data");
      String dataJson;
      if (data instanceof String text) {
        dataJson = text;
      } else if (data instanceof Map<?, ?> inline) {
        dataJson = new String(writeObject(inline), StandardCharsets.UTF_8);
      } else {
        throw new SchemaException("member 'data' must be a string or object");
      }
      return new CloudEvent(
          requireString(root, "specversion"),
          requireString(root, "type"),
          defaultString(optionalString(root, "typeversion"), CloudEvent.TYPE_VERSION),
          defaultString(optionalString(root, "source"), CloudEvent.SOURCE),
          requireString(root, "id"),
          parseInstant(requireString(root, "time")),
          defaultString(optionalString(root, "datacontenttype"), CloudEvent.CONTENT_TYPE),
          optionalString(root, "subject"),
          dataJson);
    });
  }

  byte[] encodeBusEvent(BusEvent event) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("type", event.type().suffix());
      gen.writeStringField("host", event.host());
      if (event.actor() != null) {
        gen.writeStringField("actor", event.actor());
      }
      if (event.capabilityId() != null) {
        gen.writeStringField("capid", event.capabilityId());
      }
      if (event.instanceName() != null) {
        gen.writeStringField("instance_name", event.instanceName());
      }
      if (event.success() != null) {
        gen.writeBooleanField("success", event.success());
      }
      gen.writeEndObject();
    });
  }

  private BusEvent readBusEvent(Map<String, Object> root) {
    Object success = root.get("success");
    if (success != null && !(success instanceof Boolean)) {
      throw new SchemaException("member 'success' must be a boolean");
    }
    return new BusEvent(
        BusEventType.fromWire(requireString(root, "type")),
        requireString(root, "host"),
        optionalString(root, "actor"),
        optionalString(root, "capid"),
        optionalString(root, "instance_name"),
        (Boolean) success);
  }

  private <T> DecodeResult<T> decode(byte[] payload, ObjectReader<T> reader) {
    Object root;
    try {
      root = tree.parse(payload);
    } catch (JsonTree.MalformedJsonException ex) {
      return DecodeResult.failure(DecodeError.Kind.MALFORMED_ENCODING, ex.getMessage());
    }
    if (!(root instanceof Map<?, ?>)) {
      return DecodeResult.failure(DecodeError.Kind.SCHEMA_MISMATCH, "top-level JSON value is not an object");
    }
    try {
      @SuppressWarnings("unchecked")
      Map<String, Object> object = (Map<String, Object>) root;
      return DecodeResult.success(reader.read(object));
    } catch (CorrelationMissingException ex) {
      return DecodeResult.failure(DecodeError.Kind.CORRELATION_MISSING, ex.getMessage());
    } catch (IllegalArgumentException | NullPointerException ex) {
      return DecodeResult.failure(DecodeError.Kind.SCHEMA_MISMATCH, ex.getMessage());
    }
  }

  private byte[] write(GeneratorBody body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode JSON", ex);
    }
    return out.toByteArray();
  }

  private byte[] writeObject(Map<?, ?> value) {
    return write(gen -> writeValue(gen, value));
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof List<?> list) {
      gen.writeStartArray();
      for (Object item : list) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.toString());
    } else {
      gen.writeString(value.toString());
    }
  }

  private static void writeStringMap(JsonGenerator gen, String field, Map<String, String> values)
      throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, String> entry : new TreeMap<>(values).entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static String requireCorrelation(Map<String, Object> root) {
    Object value = root.get("correlationId");
    if (value == null) {
      throw new CorrelationMissingException();
    }
    if (!(value instanceof String text)) {
      throw new SchemaException("member 'correlationId' must be a string");
    }
    if (text.isBlank()) {
      throw new CorrelationMissingException();
    }
    return text;
  }

  private static String requireString(Map<String, Object> object, String field) {
    String value = optionalString(object, field);
    if (value == null || value.isBlank()) {
      throw new SchemaException("missing member '" + field + "'");
    }
    return value;
  }

  private static String optionalString(Map<String, Object> object, String field) {
    if (object == null) {
      return null;
    }
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new SchemaException("member '" + field + "' must be a string");
    }
    return text;
  }

  private static Number requireNumber(Map<String, Object> object, String field) {
    Number value = optionalNumber(object, field);
    if (value == null) {
      throw new SchemaException("missing member '" + field + "'");
    }
    return value;
  }

  private static Number optionalNumber(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Number number)) {
      throw new SchemaException("member '" + field + "' must be a number");
    }
    return number;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> optionalObject(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?>)) {
      throw new SchemaException("member '" + field + "' must be an object");
    }
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> objectList(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new SchemaException("member '" + field + "' must be an array");
    }
    List<Map<String, Object>> items = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof Map<?, ?>)) {
        throw new SchemaException("elements of '" + field + "' must be objects");
      }
      items.add((Map<String, Object>) item);
    }
    return items;
  }

  private static Map<String, String> stringMap(Map<String, Object> object, String field) {
    Map<String, Object> raw = optionalObject(object, field);
    if (raw == null) {
      return Map.of();
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      Object value = entry.getValue();
      if (value == null || value instanceof Map<?, ?> || value instanceof List<?>) {
        throw new SchemaException("values of '" + field + "' must be scalars");
      }
      values.put(entry.getKey(), value.toString());
    }
    return values;
  }

  private static Instant parseInstant(String raw) {
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new SchemaException("member 'time' is not an RFC 3339 timestamp: " + raw);
    }
  }

  private static String defaultString(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  @FunctionalInterface
  private interface ObjectReader<T> {
    T read(Map<String, Object> root);
  }

  @FunctionalInterface
  private interface GeneratorBody {
    void write(JsonGenerator gen) throws IOException;
  }

  private static final class SchemaException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    SchemaException(String message) {
      super(message);
    }
  }

  private static final class CorrelationMissingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    CorrelationMissingException() {
      super("member 'correlationId' is missing or blank");
    }
  }
}
