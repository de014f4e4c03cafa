package ca.gc.cra.lattice.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lattice.application.port.DecodeError;
import ca.gc.cra.lattice.application.port.DecodeResult;
import ca.gc.cra.lattice.domain.control.TerminateCommand;
import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.domain.events.BusEventType;
import ca.gc.cra.lattice.domain.events.CloudEvent;
import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.inventory.WorkloadKind;
import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLatticeCodecTest {
  private final JsonLatticeCodec codec = new JsonLatticeCodec();

  @Test
  void requestSurvivesEncoding() {
    QueryRequest request = new QueryRequest(
        "cid-1", QueryKind.ACTORS, QueryScope.workload("Mecho"), "_INBOX.cid-1", Duration.ofMillis(750),
        Map.of("constraint.zone", "east"));

    QueryRequest decoded = codec.decodeRequest(codec.encodeRequest(request)).orElseThrow();

    assertEquals(request, decoded);
  }

  @Test
  void replyFromHostJsonIsDecoded() {
    String json = "{\"correlationId\":\"cid-2\",\"kind\":\"bindings\",\"host\":\"h1\",\"uptimeMs\":1500,"
        + "\"labels\":{\"zone\":\"east\"},"
        + "\"workloads\":[{\"id\":\"Mecho\",\"kind\":\"actor\",\"revision\":\"4\"},"
        + "{\"id\":\"wascc:http_server\",\"kind\":\"capability-provider\"}],"
        + "\"bindings\":[{\"actor\":\"Mecho\",\"capabilityId\":\"wascc:http_server\","
        + "\"configuration\":{\"PORT\":\"8080\"}}],\"extra\":[1,2,3]}";

    ReplyRecord reply = codec.decodeReply(bytes(json)).orElseThrow();

    HostInventory inventory = reply.inventory();
    assertEquals("cid-2", reply.correlationId());
    assertEquals(QueryKind.BINDINGS, reply.kind());
    assertEquals("h1", reply.responder());
    assertEquals(1500L, inventory.uptimeMillis());
    assertEquals("east", inventory.labels().get("zone"));
    assertEquals(WorkloadKind.CAPABILITY_PROVIDER, inventory.workloads().get(1).kind());
    assertEquals("4", inventory.workloads().get(0).revision());
    assertEquals("default", inventory.bindings().get(0).bindingName());
    assertEquals("8080", inventory.bindings().get(0).configuration().get("PORT"));
  }

  @Test
  void decodeFailuresAreClassified() {
    assertEquals(DecodeError.Kind.MALFORMED_ENCODING, errorKind(codec.decodeReply(bytes("{\"a\":"))));
    assertEquals(DecodeError.Kind.MALFORMED_ENCODING, errorKind(codec.decodeReply(null)));
    assertEquals(DecodeError.Kind.MALFORMED_ENCODING, errorKind(codec.decodeReply(bytes("{} {}"))));
    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH, errorKind(codec.decodeReply(bytes("[1]"))));
    assertEquals(DecodeError.Kind.CORRELATION_MISSING,
        errorKind(codec.decodeReply(bytes("{\"kind\":\"hosts\",\"host\":\"h1\"}"))));
    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH,
        errorKind(codec.decodeReply(bytes("{\"correlationId\":\"c\",\"kind\":\"hosts\"}"))));
    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH,
        errorKind(codec.decodeReply(bytes("{\"correlationId\":\"c\",\"kind\":\"nodes\",\"host\":\"h1\"}"))));
    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH,
        errorKind(codec.decodeReply(bytes("{\"correlationId\":7,\"kind\":\"hosts\",\"host\":\"h1\"}"))));
  }

  @Test
  void truncatedJsonReportsParserMessageWithoutSourceLocation() {
    DecodeError error = codec.decodeReply(bytes("{\"correlationId\":\"c\",\"kind\":")).error().orElseThrow();

    assertEquals(DecodeError.Kind.MALFORMED_ENCODING, error.kind());
    assertFalse(error.detail().isBlank());
    assertFalse(error.detail().contains("[Source:"), error.detail());
  }

  @Test
  void eventEnvelopeCarriesCloudEventAttributes() {
    BusEvent event = BusEvent.updateComplete("h1", "Mecho", true);
    Instant time = Instant.parse("2026-02-03T04:05:06Z");

    byte[] payload = codec.encodeEvent(event, "evt-1", time);
    CloudEvent envelope = codec.decodeEnvelope(payload).orElseThrow();

    assertEquals("1.0", envelope.specVersion());
    assertEquals("wasmbus.events.actor_update_complete", envelope.type());
    assertEquals("evt-1", envelope.id());
    assertEquals(time, envelope.time());
    assertEquals("Mecho", envelope.subject());
    assertEquals(event, codec.decodeEvent(payload).orElseThrow());
  }

  @Test
  void inlineEventDataAndDefaultsAreAccepted() {
    String json = "{\"specversion\":\"1.0\",\"type\":\"wasmbus.events.provider_loaded\",\"id\":\"e\","
        + "\"time\":\"2026-02-03T04:05:06Z\",\"data\":{\"type\":\"provider_loaded\",\"host\":\"h1\","
        + "\"capid\":\"wascc:keyvalue\",\"instance_name\":\"default\"}}";

    BusEvent event = codec.decodeEvent(bytes(json)).orElseThrow();
    CloudEvent envelope = codec.decodeEnvelope(bytes(json)).orElseThrow();

    assertEquals(BusEventType.PROVIDER_LOADED, event.type());
    assertEquals("wascc:keyvalue", event.capabilityId());
    assertNull(event.actor());
    assertEquals(CloudEvent.SOURCE, envelope.source());
    assertEquals(CloudEvent.CONTENT_TYPE, envelope.dataContentType());
  }

  @Test
  void envelopeTypeMustMatchData() {
    String json = "{\"specversion\":\"1.0\",\"type\":\"wasmbus.events.host_stopped\",\"id\":\"e\","
        + "\"time\":\"2026-02-03T04:05:06Z\",\"data\":\"{\\\"type\\\":\\\"host_started\\\",\\\"host\\\":\\\"h1\\\"}\"}";

    DecodeResult<BusEvent> result = codec.decodeEvent(bytes(json));

    assertFalse(result.isSuccess());
    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH, errorKind(result));
  }

  @Test
  void eventMissingRequiredFieldIsRejected() {
    String json = "{\"specversion\":\"1.0\",\"type\":\"wasmbus.events.actor_started\",\"id\":\"e\","
        + "\"time\":\"2026-02-03T04:05:06Z\",\"data\":{\"type\":\"actor_started\",\"host\":\"h1\"}}";

    assertEquals(DecodeError.Kind.SCHEMA_MISMATCH, errorKind(codec.decodeEvent(bytes(json))));
  }

  @Test
  void terminateCommandCarriesActorId() {
    byte[] payload = codec.encodeTerminate(new TerminateCommand("Mecho"));

    assertTrue(new String(payload, StandardCharsets.UTF_8).contains("\"actorId\":\"Mecho\""));
    assertEquals("Mecho", codec.decodeTerminate(payload).orElseThrow().actorId());
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  private static DecodeError.Kind errorKind(DecodeResult<?> result) {
    return result.error().orElseThrow().kind();
  }
}
