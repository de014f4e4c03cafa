package ca.gc.cra.lattice.application.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryScope;
import org.junit.jupiter.api.Test;

class TopicConventionsTest {
  private final TopicConventions topics = TopicConventions.defaults();

  @Test
  void probesUseNamespaceAndSuffix() {
    assertEquals("wasmbus.inventory.hosts", topics.requestSubject(QueryKind.HOSTS, QueryScope.all()));
    assertEquals("wasmbus.inventory.actors.h1", topics.requestSubject(QueryKind.ACTORS, QueryScope.host("h1")));
    assertEquals("wasmbus.control.auction.request", topics.requestSubject(QueryKind.AUCTION, QueryScope.all()));
  }

  @Test
  void workloadScopeBroadcasts() {
    assertEquals("wasmbus.inventory.capabilities",
        topics.requestSubject(QueryKind.CAPABILITIES, QueryScope.workload("Mecho")));
  }

  @Test
  void controlSubjectsAddressOneHost() {
    assertEquals("wasmbus.control.h1.actor.launch", topics.requestSubject(QueryKind.LAUNCH, QueryScope.host("h1")));
    assertEquals("wasmbus.control.h1.actor.terminate", topics.terminateSubject("h1"));
    assertThrows(IllegalArgumentException.class, () -> topics.requestSubject(QueryKind.LAUNCH, QueryScope.all()));
  }

  @Test
  void replyAndEventSubjects() {
    TopicConventions custom = new TopicConventions("prod.wasmbus", "_R");

    assertEquals("_INBOX.abc-1", topics.replySubject("abc-1"));
    assertEquals("_R.abc-1", custom.replySubject("abc-1"));
    assertEquals("prod.wasmbus.events", custom.eventSubject());
  }

  @Test
  void tokensThatWouldChangeRoutingAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> topics.replySubject("a.b"));
    assertThrows(IllegalArgumentException.class, () -> topics.requestSubject(QueryKind.HOSTS, QueryScope.host("h*")));
    assertThrows(IllegalArgumentException.class, () -> new TopicConventions("wasmbus.>", "_INBOX"));
  }
}
