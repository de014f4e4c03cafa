package ca.gc.cra.lattice.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class BusEventTest {

  @Test
  void renderingPrefixesHost() {
    assertEquals("[h1] Host started", BusEvent.host(BusEventType.HOST_STARTED, "h1").toString());
    assertEquals("[h1] Actor Mecho update failed", BusEvent.updateComplete("h1", "Mecho", false).toString());
    assertEquals("[h1] Provider wascc:keyvalue,default loaded",
        BusEvent.provider(BusEventType.PROVIDER_LOADED, "h1", "wascc:keyvalue", "default").toString());
    assertEquals("[h1] Actor Mecho un-bound from wascc:keyvalue,default",
        BusEvent.binding(BusEventType.ACTOR_BINDING_REMOVED, "h1", "Mecho", "wascc:keyvalue", "default")
            .toString());
  }

  @Test
  void shapeDropsFieldsTheTypeDoesNotCarry() {
    BusEvent event = new BusEvent(BusEventType.HOST_STOPPED, "h1", "Mecho", "cap", "inst", true);

    assertNull(event.actor());
    assertNull(event.capabilityId());
    assertNull(event.success());
    assertEquals("h1", event.subject());
  }

  @Test
  void missingRequiredFieldIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> BusEvent.actor(BusEventType.ACTOR_STARTED, "h1", " "));
    assertThrows(NullPointerException.class,
        () -> new BusEvent(BusEventType.ACTOR_UPDATE_COMPLETE, "h1", "Mecho", null, null, null));
  }

  @Test
  void typeResolvesSuffixOrQualifiedName() {
    assertEquals(BusEventType.ACTOR_STARTED, BusEventType.fromWire("actor_started"));
    assertEquals(BusEventType.ACTOR_STARTED, BusEventType.fromWire("wasmbus.events.actor_started"));
    assertThrows(IllegalArgumentException.class, () -> BusEventType.fromWire("actor_exploded"));
  }

  @Test
  void envelopeCarriesTypeAndSubject() {
    BusEvent event = BusEvent.binding(BusEventType.ACTOR_BINDING_CREATED, "h1", "Mecho", "wascc:kv", "default");
    CloudEvent envelope = CloudEvent.wrap(event, "{}", "id-1", Instant.EPOCH);

    assertEquals("wasmbus.events.actor_binding_created", envelope.type());
    assertEquals("Mecho.wascc:kv.default", envelope.subject());
    assertEquals(CloudEvent.SPEC_VERSION, envelope.specVersion());
  }
}
