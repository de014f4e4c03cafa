package ca.gc.cra.lattice.adapter.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.testutil.ManualClock;
import ca.gc.cra.lattice.testutil.RecordingMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InMemoryTransportAdapterTest {
  private final ManualClock clock = new ManualClock(5_000L);
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final InMemoryTransportAdapter bus = new InMemoryTransportAdapter(clock, metrics, 64);

  @AfterEach
  void tearDown() {
    bus.close();
  }

  @Test
  void wildcardSubscriptionReceivesMatchingSubjectsStampedWithClock() throws Exception {
    Subscription subscription = bus.subscribeEphemeral("wasmbus.inventory.*");

    bus.publish("wasmbus.inventory.hosts", new byte[] {1});
    bus.publish("wasmbus.events", new byte[] {2});

    InboundMessage message = subscription.poll(Duration.ofMillis(100)).orElseThrow();
    assertEquals("wasmbus.inventory.hosts", message.subject());
    assertEquals(Instant.ofEpochMilli(5_000L), message.arrival());
    assertTrue(subscription.poll(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void messagesBeforeSubscribingAreNotDelivered() throws Exception {
    bus.publish("_INBOX.a", new byte[] {1});
    Subscription subscription = bus.subscribeEphemeral("_INBOX.a");

    assertTrue(subscription.poll(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void closeWakesBlockedPollerAndUnregisters() throws Exception {
    Subscription subscription = bus.subscribeEphemeral("_INBOX.a");
    Thread closer = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      subscription.close();
    });
    closer.start();

    long started = System.nanoTime();
    assertTrue(subscription.poll(Duration.ofSeconds(10)).isEmpty());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 5_000);
    closer.join();
    assertTrue(subscription.isClosed());
    assertEquals(0, bus.openSubscriptions());
  }

  @Test
  void listenersRunSynchronouslyAndFailuresAreIsolated() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    AutoCloseable failing = bus.subscribe("a.>", message -> {
      throw new IllegalStateException("listener bug");
    });
    AutoCloseable recording = bus.subscribe("a.>", message -> seen.add(message.subject()));

    bus.publish("a.b.c", new byte[] {1});
    recording.close();
    bus.publish("a.b.d", new byte[] {1});
    failing.close();

    assertEquals(List.of("a.b.c"), seen);
  }

  @Test
  void disconnectedOrOversizedPublishFails() {
    bus.disconnect();
    assertThrows(TransportException.class, () -> bus.publish("a", new byte[] {1}));
    bus.reconnect();
    bus.publish("a", new byte[] {1});

    assertThrows(TransportException.class, () -> bus.publish("a", new byte[65]));
    assertEquals(2, metrics.count("transport.publish.failed"));
  }

  @Test
  void closedBusRejectsSubscriptions() {
    Subscription subscription = bus.subscribeEphemeral("a");
    bus.close();

    assertTrue(subscription.isClosed());
    assertThrows(TransportException.class, () -> bus.subscribeEphemeral("a"));
    assertThrows(IllegalArgumentException.class,
        () -> new InMemoryTransportAdapter(clock, MetricsPort.NO_OP, 0));
  }
}
