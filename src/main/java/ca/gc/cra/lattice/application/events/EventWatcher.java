package ca.gc.cra.lattice.application.events;

import ca.gc.cra.lattice.application.port.DecodeResult;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.LatticeCodec;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.port.TransportPort;
import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.lattice.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Long-lived subscription to the lattice event subject that hands decoded events to a
 * listener.
 * <p><strong>Why:</strong> Operators follow host and actor lifecycle changes as they happen instead of polling
 * with inventory probes.</p>
 * <p><strong>Role:</strong> Application service returned by {@code LatticeClient.watchEvents}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Poll the event subscription on a dedicated daemon thread.</li>
 *   <li>Drop malformed envelopes and keep watching.</li>
 *   <li>Isolate listener failures from the delivery loop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #close()} may be called from any thread, including the listener.</p>
 * <p><strong>Observability:</strong> Emits {@code events.received} and {@code events.decode.failed}.</p>
 *
 * @implNote Events are not cached; a watcher only sees events published after it subscribed.
 * @since 0.1.0
 */
public final class EventWatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventWatcher.class);
  static final Duration POLL_INTERVAL = Duration.ofMillis(250);
  private static final long JOIN_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(2);

  private final Subscription subscription;
  private final LatticeCodec codec;
  private final MetricsPort metrics;
  private final BusEventListener listener;
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private volatile boolean closed;
  private volatile Thread worker;

  private EventWatcher(
      Subscription subscription, LatticeCodec codec, MetricsPort metrics, BusEventListener listener) {
    this.subscription = subscription;
    this.codec = codec;
    this.metrics = metrics;
    this.listener = listener;
  }

  /**
   * Subscribes to {@code eventSubject} and starts delivering events.
   *
   * @param transport shared transport
   * @param codec codec decoding CloudEvents envelopes
   * @param metrics metrics sink
   * @param eventSubject subject hosts publish events on
   * @param listener receives each decoded event
   * @return running watcher; close it to stop watching
   * @throws TransportException if the subscription cannot be opened
   */
  public static EventWatcher start(
      TransportPort transport,
      LatticeCodec codec,
      MetricsPort metrics,
      String eventSubject,
      BusEventListener listener) {
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(eventSubject, "eventSubject");
    EventWatcher watcher = new EventWatcher(
        transport.subscribeEphemeral(eventSubject),
        Objects.requireNonNull(codec, "codec"),
        Objects.requireNonNull(metrics, "metrics"),
        Objects.requireNonNull(listener, "listener"));
    watcher.worker = ExecutorFactories.startDaemon("lattice-events", watcher::deliverLoop);
    log.info("Watching lattice events on {}", eventSubject);
    return watcher;
  }

  public boolean isRunning() {
    Thread thread = worker;
    return !closed && thread != null && thread.isAlive();
  }

  /** Number of events handed to the listener so far. */
  public long deliveredCount() {
    return delivered.get();
  }

  /** Number of payloads dropped because they could not be decoded. */
  public long rejectedCount() {
    return rejected.get();
  }

  /**
   * Stops watching: closes the subscription and waits briefly for the delivery thread to exit.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    subscription.close();
    Thread thread = worker;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    try {
      thread.join(JOIN_TIMEOUT_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      log.warn("Event delivery thread {} did not stop within {} ms", thread.getName(), JOIN_TIMEOUT_MILLIS);
    }
  }

  private void deliverLoop() {
    while (!closed) {
      Optional<InboundMessage> next;
      try {
        next = subscription.poll(POLL_INTERVAL);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      } catch (TransportException ex) {
        if (!closed) {
          log.error("Event subscription {} failed; watch stopped", subscription.subjectPattern(), ex);
        }
        break;
      }
      if (next.isEmpty()) {
        if (subscription.isClosed()) {
          break;
        }
        continue;
      }
      deliver(next.get());
    }
    log.debug("Event delivery stopped after {} event(s)", delivered.get());
  }

  private void deliver(InboundMessage message) {
    DecodeResult<BusEvent> decoded = codec.decodeEvent(message.payload());
    if (!decoded.isSuccess()) {
      rejected.incrementAndGet();
      metrics.increment("events.decode.failed");
      log.debug("Dropping malformed event on {}: {} payload={}",
          message.subject(), decoded.error().orElseThrow(), Logs.truncate(message.payload()));
      return;
    }
    BusEvent event = decoded.orElseThrow();
    metrics.increment("events.received");
    try {
      listener.onEvent(event);
      delivered.incrementAndGet();
    } catch (RuntimeException ex) {
      log.warn("Event listener failed on {}", event.eventType(), ex);
    }
  }
}
