package ca.gc.cra.lattice.adapter.memory;

import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.SubjectPattern;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.port.TransportPort;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-process {@link TransportPort} delivering messages to matching subscribers.
 * <p><strong>Why:</strong> Lets the whole scatter-gather protocol run in tests and demos without a broker.</p>
 * <p><strong>Role:</strong> Adapter standing in for Kafka; also hosts persistent listeners used by test responders.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Listeners run on the publishing thread; ephemeral
 * subscriptions buffer messages until polled.</p>
 * <p><strong>Observability:</strong> Increments {@code transport.publish.failed} when publishing while disconnected.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTransportAdapter.class);
  private static final int DEFAULT_MAX_PAYLOAD_BYTES = 1024 * 1024;

  private final List<Receiver> receivers = new CopyOnWriteArrayList<>();
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int maxPayloadBytes;
  private volatile boolean connected = true;
  private volatile boolean closed;

  public InMemoryTransportAdapter() {
    this(ClockPort.SYSTEM, MetricsPort.NO_OP, DEFAULT_MAX_PAYLOAD_BYTES);
  }

  /**
   * Creates an in-memory bus.
   *
   * @param clock clock stamping message arrival
   * @param metrics metrics sink
   * @param maxPayloadBytes largest accepted payload
   */
  public InMemoryTransportAdapter(ClockPort clock, MetricsPort metrics, int maxPayloadBytes) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (maxPayloadBytes <= 0) {
      throw new IllegalArgumentException("maxPayloadBytes must be positive");
    }
    this.maxPayloadBytes = maxPayloadBytes;
  }

  @Override
  public void publish(String subject, byte[] payload) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(payload, "payload");
    if (closed || !connected) {
      metrics.increment("transport.publish.failed");
      throw new TransportException("in-memory transport is not connected");
    }
    if (payload.length > maxPayloadBytes) {
      metrics.increment("transport.publish.failed");
      throw new TransportException(
          "payload of " + payload.length + " bytes exceeds limit of " + maxPayloadBytes);
    }
    InboundMessage message =
        new InboundMessage(subject, payload.clone(), Instant.ofEpochMilli(clock.nowMillis()));
    for (Receiver receiver : receivers) {
      if (receiver.pattern().matches(subject)) {
        receiver.deliver(message);
      }
    }
  }

  @Override
  public Subscription subscribeEphemeral(String subjectPattern) {
    ensureOpen();
    QueueSubscription subscription = new QueueSubscription(SubjectPattern.compile(subjectPattern));
    receivers.add(subscription);
    return subscription;
  }

  /**
   * Registers a listener invoked synchronously for every matching message until the returned
   * handle is closed.
   *
   * @param subjectPattern subject pattern
   * @param listener callback receiving matching messages
   * @return handle removing the listener
   */
  public AutoCloseable subscribe(String subjectPattern, Consumer<InboundMessage> listener) {
    ensureOpen();
    ListenerReceiver receiver =
        new ListenerReceiver(SubjectPattern.compile(subjectPattern), Objects.requireNonNull(listener, "listener"));
    receivers.add(receiver);
    return () -> receivers.remove(receiver);
  }

  /** Simulates a broken connection: every publish fails until {@link #reconnect()}. */
  public void disconnect() {
    connected = false;
  }

  public void reconnect() {
    connected = true;
  }

  /**
   * Returns the number of open ephemeral subscriptions.
   *
   * @return open subscription count
   */
  public int openSubscriptions() {
    int count = 0;
    for (Receiver receiver : receivers) {
      if (receiver instanceof QueueSubscription) {
        count++;
      }
    }
    return count;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (Receiver receiver : receivers) {
      if (receiver instanceof QueueSubscription subscription) {
        subscription.close();
      }
    }
    receivers.clear();
  }

  private void ensureOpen() {
    if (closed) {
      throw new TransportException("in-memory transport is closed");
    }
  }

  private interface Receiver {
    SubjectPattern pattern();

    void deliver(InboundMessage message);
  }

  private record ListenerReceiver(SubjectPattern pattern, Consumer<InboundMessage> listener)
      implements Receiver {
    @Override
    public void deliver(InboundMessage message) {
      try {
        listener.accept(message);
      } catch (RuntimeException ex) {
        log.warn("In-memory listener on {} failed", pattern, ex);
      }
    }
  }

  private final class QueueSubscription implements Subscription, Receiver {
    private final Object closedMarker = new Object();
    private final SubjectPattern pattern;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private volatile boolean subscriptionClosed;

    private QueueSubscription(SubjectPattern pattern) {
      this.pattern = pattern;
    }

    @Override
    public SubjectPattern pattern() {
      return pattern;
    }

    @Override
    public void deliver(InboundMessage message) {
      if (!subscriptionClosed) {
        queue.offer(message);
      }
    }

    @Override
    public String subjectPattern() {
      return pattern.toString();
    }

    @Override
    public Optional<InboundMessage> poll(Duration timeout) throws InterruptedException {
      if (subscriptionClosed) {
        return Optional.empty();
      }
      long waitNanos = Math.max(0L, timeout.toNanos());
      Object next = queue.poll(waitNanos, TimeUnit.NANOSECONDS);
      if (next instanceof InboundMessage message && !subscriptionClosed) {
        return Optional.of(message);
      }
      return Optional.empty();
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
      receivers.remove(this);
      queue.clear();
      queue.offer(closedMarker);
    }
  }
}
