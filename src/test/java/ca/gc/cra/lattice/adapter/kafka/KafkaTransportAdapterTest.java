package ca.gc.cra.lattice.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.query.ScatterGatherCollector;
import ca.gc.cra.lattice.application.query.SnapshotAggregator;
import ca.gc.cra.lattice.application.query.TopicConventions;
import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import ca.gc.cra.lattice.infrastructure.codec.JsonLatticeCodec;
import ca.gc.cra.lattice.testutil.ManualClock;
import ca.gc.cra.lattice.testutil.RecordingMetrics;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaTransportAdapterTest {
  private static final String REPLIES = "lattice.replies";

  private final KafkaTopics topics =
      new KafkaTopics("lattice.requests", REPLIES, "lattice.events", "_INBOX");
  private final ManualClock clock = new ManualClock(1_700_000_000_000L);
  private MockProducer<String, byte[]> producer;
  private MockConsumer<String, byte[]> consumer;
  private RecordingMetrics metrics;
  private KafkaTransportAdapter adapter;

  @BeforeEach
  void setUp() {
    producer = MockProducers.subjectKeyed();
    consumer = new MockConsumer<>(OffsetResetStrategy.LATEST);
    metrics = new RecordingMetrics();
    adapter = new KafkaTransportAdapter(producer, () -> consumer, topics, metrics, clock);
  }

  @Test
  void publishKeysRecordBySubjectOnRoutedTopic() {
    adapter.publish("wasmbus.inventory.hosts", bytes("{}"));
    adapter.publish("_INBOX.cid-1", bytes("{\"r\":1}"));

    List<ProducerRecord<String, byte[]>> sent = producer.history();
    assertEquals(2, sent.size());
    assertEquals("lattice.requests", sent.get(0).topic());
    assertEquals("wasmbus.inventory.hosts", sent.get(0).key());
    assertEquals(REPLIES, sent.get(1).topic());
    assertArrayEquals(bytes("{\"r\":1}"), sent.get(1).value());
  }

  @Test
  void publishAfterProducerFailureRaisesTransportException() {
    producer.close();

    assertThrows(TransportException.class, () -> adapter.publish("wasmbus.inventory.hosts", bytes("{}")));
    assertEquals(1, metrics.count("transport.publish.failed"));
  }

  @Test
  void subscriptionDeliversOnlyMatchingSubjects() throws Exception {
    TopicPartition partition = prepareReplyTopic();
    Subscription subscription = adapter.subscribeEphemeral("_INBOX.cid-1");

    consumer.addRecord(new ConsumerRecord<>(REPLIES, 0, 0L, "_INBOX.cid-2", bytes("other")));
    consumer.addRecord(new ConsumerRecord<>(REPLIES, 0, 1L, "_INBOX.cid-1", bytes("mine")));

    Optional<InboundMessage> message = subscription.poll(Duration.ofMillis(200));
    assertTrue(message.isPresent());
    assertEquals("_INBOX.cid-1", message.get().subject());
    assertArrayEquals(bytes("mine"), message.get().payload());
    assertTrue(subscription.poll(Duration.ofMillis(20)).isEmpty());
    assertEquals(List.of(partition), List.copyOf(consumer.assignment()));

    subscription.close();
    assertTrue(subscription.isClosed());
    assertTrue(consumer.closed());
    assertEquals(0, adapter.openSubscriptions());
  }

  @Test
  void arrivalIsStampedWithLocalClockNotRecordTimestamp() throws Exception {
    prepareReplyTopic();
    Subscription subscription = adapter.subscribeEphemeral("_INBOX.cid-1");
    long responderClock = clock.nowMillis() + 3_600_000L;

    consumer.addRecord(timestamped(0L, responderClock, "_INBOX.cid-1", bytes("mine")));

    InboundMessage message = subscription.poll(Duration.ofMillis(200)).orElseThrow();
    assertEquals(Instant.ofEpochMilli(clock.nowMillis()), message.arrival());
    subscription.close();
  }

  @Test
  void replyFromHostWithClockAheadIsCollectedInTime() {
    prepareReplyTopic();
    KafkaTransportAdapter systemClocked =
        new KafkaTransportAdapter(producer, () -> consumer, topics, metrics, ClockPort.SYSTEM);
    JsonLatticeCodec codec = new JsonLatticeCodec();
    TopicConventions conventions = TopicConventions.defaults();
    String replySubject = conventions.replySubject("cid-skew");
    byte[] reply = codec.encodeReply(new ReplyRecord("cid-skew", QueryKind.HOSTS, HostInventory.identityOnly("h1")));
    consumer.schedulePollTask(() ->
        consumer.addRecord(timestamped(0L, System.currentTimeMillis() + 60_000L, replySubject, reply)));
    QueryRequest request = new QueryRequest(
        "cid-skew", QueryKind.HOSTS, QueryScope.all(), replySubject, Duration.ofMillis(300), Map.of());

    AggregatedSnapshot snapshot = new ScatterGatherCollector(
        systemClocked, codec, new SnapshotAggregator(), metrics, ClockPort.SYSTEM)
        .collect("wasmbus.inventory.hosts", request, 1, 0);

    assertEquals(List.of("h1"), snapshot.hostIds());
    assertEquals(0, snapshot.discardedReplies());
    assertEquals(0, metrics.count("query.reply.late"));
  }

  @Test
  void missingTopicFailsSubscription() {
    assertThrows(TransportException.class, () -> adapter.subscribeEphemeral("_INBOX.cid-1"));
    assertTrue(consumer.closed());
  }

  @Test
  void closingAdapterClosesSubscriptionsAndRejectsWork() {
    prepareReplyTopic();
    Subscription subscription = adapter.subscribeEphemeral("_INBOX.cid-1");

    adapter.close();

    assertTrue(subscription.isClosed());
    assertTrue(producer.closed());
    assertThrows(TransportException.class, () -> adapter.publish("wasmbus.events", bytes("{}")));
    assertThrows(TransportException.class, () -> adapter.subscribeEphemeral("_INBOX.cid-2"));
  }

  private TopicPartition prepareReplyTopic() {
    TopicPartition partition = new TopicPartition(REPLIES, 0);
    Node node = new Node(0, "localhost", 9092);
    PartitionInfo info = new PartitionInfo(REPLIES, 0, node, new Node[] {node}, new Node[] {node});
    consumer.updatePartitions(REPLIES, List.of(info));
    consumer.updateEndOffsets(Map.of(partition, 0L));
    return partition;
  }

  private static ConsumerRecord<String, byte[]> timestamped(long offset, long timestamp, String key, byte[] value) {
    return new ConsumerRecord<>(REPLIES, 0, offset, timestamp, TimestampType.CREATE_TIME,
        key.length(), value.length, key, value, new RecordHeaders(), Optional.empty());
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
