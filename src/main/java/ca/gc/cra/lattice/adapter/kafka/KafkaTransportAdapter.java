package ca.gc.cra.lattice.adapter.kafka;

import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.SubjectPattern;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.port.TransportPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link TransportPort} carrying lattice subjects as record keys.
 * <p><strong>Why:</strong> Kafka has no per-message subjects or ephemeral inboxes, so subjects are mapped onto a
 * small set of shared topics and filtered on the consumer side.</p>
 * <p><strong>Role:</strong> Production transport adapter wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Route each subject to the request, reply or event topic and key the record by subject.</li>
 *   <li>Give every ephemeral subscription its own consumer, assigned to all partitions of the routed
 *       topic and positioned at the end before the subscription is returned.</li>
 *   <li>Stamp consumed records with the local clock on receipt.</li>
 *   <li>Wake and close a subscription's consumer from any thread.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Publishing is thread-safe (the {@link KafkaProducer} is). Each subscription
 * must be polled by one thread at a time; {@link Subscription#close()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Increments {@code transport.publish.failed}; Kafka client metrics are exposed
 * by the clients themselves.</p>
 *
 * @since 0.1.0
 */
public final class KafkaTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaTransportAdapter.class);
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<String, byte[]> producer;
  private final Supplier<Consumer<String, byte[]>> consumerFactory;
  private final KafkaTopics topics;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final List<KafkaSubscription> open = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates a transport connected to the given brokers.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topics subject-to-topic routing
   * @param metrics metrics sink
   * @param clock local clock stamping the arrival of every consumed record
   * @throws IllegalArgumentException if {@code bootstrapServers} is blank
   */
  public KafkaTransportAdapter(String bootstrapServers, KafkaTopics topics, MetricsPort metrics, ClockPort clock) {
    this(createProducer(bootstrapServers), () -> createConsumer(bootstrapServers), topics, metrics, clock);
  }

  KafkaTransportAdapter(
      Producer<String, byte[]> producer,
      Supplier<Consumer<String, byte[]>> consumerFactory,
      KafkaTopics topics,
      MetricsPort metrics,
      ClockPort clock) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.topics = Objects.requireNonNull(topics, "topics");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void publish(String subject, byte[] payload) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(payload, "payload");
    if (closed) {
      metrics.increment("transport.publish.failed");
      throw new TransportException("Kafka transport is closed");
    }
    String topic = topics.topicFor(subject);
    try {
      producer.send(new ProducerRecord<>(topic, subject, payload))
          .get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("transport.publish.failed");
      throw new TransportException("Interrupted while publishing to " + subject, ex);
    } catch (ExecutionException ex) {
      metrics.increment("transport.publish.failed");
      throw new TransportException("Kafka rejected message for " + subject, ex.getCause());
    } catch (TimeoutException ex) {
      metrics.increment("transport.publish.failed");
      throw new TransportException("Timed out publishing to " + subject, ex);
    } catch (KafkaException | IllegalStateException ex) {
      metrics.increment("transport.publish.failed");
      throw new TransportException("Kafka publish failed for " + subject, ex);
    }
  }

  @Override
  public Subscription subscribeEphemeral(String subjectPattern) {
    if (closed) {
      throw new TransportException("Kafka transport is closed");
    }
    SubjectPattern pattern = SubjectPattern.compile(subjectPattern);
    String topic = topics.topicFor(pattern.toString());
    Consumer<String, byte[]> consumer = consumerFactory.get();
    try {
      List<TopicPartition> partitions = new ArrayList<>();
      List<PartitionInfo> infos = consumer.partitionsFor(topic);
      if (infos == null || infos.isEmpty()) {
        throw new TransportException("Kafka topic " + topic + " has no partitions");
      }
      for (PartitionInfo info : infos) {
        partitions.add(new TopicPartition(info.topic(), info.partition()));
      }
      consumer.assign(partitions);
      consumer.seekToEnd(partitions);
      for (TopicPartition partition : partitions) {
        // Resolve the lazy seek now so records published after this call are not skipped.
        consumer.position(partition);
      }
    } catch (KafkaException | IllegalStateException ex) {
      consumer.close(CLOSE_TIMEOUT);
      throw new TransportException("Unable to subscribe to " + topic, ex);
    } catch (TransportException ex) {
      consumer.close(CLOSE_TIMEOUT);
      throw ex;
    }
    KafkaSubscription subscription = new KafkaSubscription(pattern, consumer);
    open.add(subscription);
    log.debug("Subscribed to {} via Kafka topic {}", pattern, topic);
    return subscription;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (KafkaSubscription subscription : open) {
      subscription.close();
    }
    try {
      producer.flush();
      producer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("Kafka producer did not close cleanly", ex);
    }
  }

  int openSubscriptions() {
    return open.size();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, requireBootstrap(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (int) SEND_TIMEOUT.toMillis());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, requireBootstrap(bootstrapServers));
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
    return new KafkaConsumer<>(props);
  }

  private static String requireBootstrap(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    return trimmed;
  }

  /**
   * Subscription owning one consumer. The polling thread is the only thread touching the consumer
   * apart from {@link Consumer#wakeup()}; whichever side finishes last closes it.
   */
  private final class KafkaSubscription implements Subscription {
    private final SubjectPattern pattern;
    private final Consumer<String, byte[]> consumer;
    private final Deque<InboundMessage> buffered = new ArrayDeque<>();
    private final ReentrantLock pollLock = new ReentrantLock();
    private volatile boolean subscriptionClosed;
    private boolean consumerClosed;

    private KafkaSubscription(SubjectPattern pattern, Consumer<String, byte[]> consumer) {
      this.pattern = pattern;
      this.consumer = consumer;
    }

    @Override
    public String subjectPattern() {
      return pattern.toString();
    }

    @Override
    public Optional<InboundMessage> poll(Duration timeout) throws InterruptedException {
      pollLock.lock();
      try {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        while (!subscriptionClosed) {
          InboundMessage next = buffered.pollFirst();
          if (next != null) {
            return Optional.of(next);
          }
          if (Thread.interrupted()) {
            throw new InterruptedException("interrupted while polling " + pattern);
          }
          long remaining = deadline - System.nanoTime();
          if (remaining <= 0) {
            return Optional.empty();
          }
          fill(Duration.ofNanos(remaining));
        }
        return Optional.empty();
      } catch (WakeupException ex) {
        return Optional.empty();
      } catch (KafkaException ex) {
        throw new TransportException("Kafka poll failed for " + pattern, ex);
      } finally {
        pollLock.unlock();
        if (subscriptionClosed) {
          closeConsumerIfIdle();
        }
      }
    }

    private void fill(Duration wait) {
      ConsumerRecords<String, byte[]> records = consumer.poll(wait);
      if (records.isEmpty()) {
        return;
      }
      // Arrival is the local receive time, never the producer-stamped record timestamp.
      Instant arrival = Instant.ofEpochMilli(clock.nowMillis());
      for (ConsumerRecord<String, byte[]> record : records) {
        if (record.value() != null && pattern.matches(record.key())) {
          buffered.addLast(new InboundMessage(record.key(), record.value(), arrival));
        }
      }
    }

    @Override
    public boolean isClosed() {
      return subscriptionClosed;
    }

    @Override
    public void close() {
      if (subscriptionClosed) {
        return;
      }
      subscriptionClosed = true;
      open.remove(this);
      consumer.wakeup();
      closeConsumerIfIdle();
    }

    private void closeConsumerIfIdle() {
      if (!pollLock.tryLock()) {
        return;
      }
      try {
        if (!consumerClosed) {
          consumerClosed = true;
          buffered.clear();
          consumer.close(CLOSE_TIMEOUT);
        }
      } catch (KafkaException ex) {
        log.warn("Kafka consumer for {} did not close cleanly", pattern, ex);
      } finally {
        pollLock.unlock();
      }
    }
  }
}
