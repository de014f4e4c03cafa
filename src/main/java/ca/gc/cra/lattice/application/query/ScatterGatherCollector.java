package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.DecodeResult;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.port.LatticeCodec;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.Subscription;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.port.TransportPort;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import ca.gc.cra.lattice.domain.query.CompletionReason;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import ca.gc.cra.lattice.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one scatter-gather query: subscribe, publish, collect until the deadline or early
 * stop, then aggregate.
 * <p><strong>Why:</strong> Lattice membership is unknown, so replies are gathered over a bounded window rather
 * than counted against a fixed participant list.</p>
 * <p><strong>Role:</strong> Application service created fresh by {@link LatticeClient} for every query.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the reply subscription before publishing so fast replies are not lost.</li>
 *   <li>Wait on the next reply and the deadline at once; wake on whichever comes first.</li>
 *   <li>Drop undecodable, foreign and late replies without failing the query.</li>
 *   <li>Stop early once the expected number of distinct hosts replied.</li>
 *   <li>Close the subscription on every exit path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #collect} runs on one thread and only once; {@link #cancel()} may be
 * called from any thread.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code correlationId} while collecting; emits
 * {@code query.<kind>.published|replies|latencyMs|earlyStop|timeout|cancelled}, {@code query.decode.failed},
 * {@code query.correlation.mismatch} and {@code query.reply.late}.</p>
 *
 * @since 0.1.0
 */
public final class ScatterGatherCollector {
  private static final Logger log = LoggerFactory.getLogger(ScatterGatherCollector.class);
  static final String MDC_CORRELATION_ID = "correlationId";

  private final TransportPort transport;
  private final LatticeCodec codec;
  private final SnapshotAggregator aggregator;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicReference<CollectorState> state = new AtomicReference<>(CollectorState.IDLE);
  private volatile boolean cancelled;
  private volatile Subscription subscription;

  public ScatterGatherCollector(
      TransportPort transport,
      LatticeCodec codec,
      SnapshotAggregator aggregator,
      MetricsPort metrics,
      ClockPort clock) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Publishes the request and collects replies into a snapshot.
   *
   * @param requestSubject subject the request is published to
   * @param request request carrying the correlation id, reply subject and timeout
   * @param expectedReplies early-stop hint; {@code 0} waits for the full timeout
   * @param minimumReplies replies required for success; {@code 0} accepts an empty snapshot
   * @return snapshot of every matching reply received within the window
   * @throws QueryException with kind {@code TRANSPORT} if subscribing or publishing fails,
   *     {@code CANCELLED} if {@link #cancel()} was called, or {@code INSUFFICIENT} if fewer than
   *     {@code minimumReplies} hosts replied
   * @throws IllegalStateException if this collector already ran
   */
  public AggregatedSnapshot collect(
      String requestSubject, QueryRequest request, int expectedReplies, int minimumReplies) {
    Objects.requireNonNull(requestSubject, "requestSubject");
    Objects.requireNonNull(request, "request");
    if (!state.compareAndSet(CollectorState.IDLE, CollectorState.PUBLISHING)) {
      throw new IllegalStateException("collector already used (state " + state.get() + ")");
    }
    String previousCorrelation = MDC.get(MDC_CORRELATION_ID);
    MDC.put(MDC_CORRELATION_ID, request.correlationId());
    try {
      return run(requestSubject, request, expectedReplies, minimumReplies);
    } finally {
      Subscription open = subscription;
      if (open != null) {
        open.close();
      }
      state.set(CollectorState.CLOSED);
      if (previousCorrelation == null) {
        MDC.remove(MDC_CORRELATION_ID);
      } else {
        MDC.put(MDC_CORRELATION_ID, previousCorrelation);
      }
    }
  }

  /**
   * Aborts the query. Accumulated replies are discarded and {@link #collect} throws a
   * {@code CANCELLED} {@link QueryException}. Safe to call repeatedly and from any thread.
   */
  public void cancel() {
    cancelled = true;
    Subscription open = subscription;
    if (open != null) {
      open.close();
    }
  }

  public CollectorState state() {
    return state.get();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  private AggregatedSnapshot run(
      String requestSubject, QueryRequest request, int expectedReplies, int minimumReplies) {
    String kindTag = request.kind().wireTag();
    String correlationId = request.correlationId();
    if (cancelled) {
      throw cancelledOutcome(kindTag, correlationId);
    }
    Subscription replies;
    try {
      replies = transport.subscribeEphemeral(request.replySubject());
    } catch (TransportException ex) {
      log.warn("Unable to open reply subscription {}", request.replySubject(), ex);
      throw QueryException.transport(correlationId, ex);
    }
    subscription = replies;
    if (cancelled) {
      throw cancelledOutcome(kindTag, correlationId);
    }

    long startNanos = clock.monotonicNanos();
    Instant windowStart = Instant.ofEpochMilli(clock.nowMillis());
    Instant windowDeadline = windowStart.plus(request.timeout());
    try {
      transport.publish(requestSubject, codec.encodeRequest(request));
    } catch (TransportException ex) {
      log.warn("Publishing {} request to {} failed", kindTag, requestSubject, ex);
      throw QueryException.transport(correlationId, ex);
    }
    metrics.increment("query." + kindTag + ".published");
    log.debug("Published {} request to {}; collecting on {} for {} ms",
        kindTag, requestSubject, request.replySubject(), request.timeout().toMillis());
    state.set(CollectorState.COLLECTING);

    long deadlineNanos = startNanos + request.timeout().toNanos();
    List<ReplyRecord> accepted = new ArrayList<>();
    Set<String> responders = new HashSet<>();
    int decodeFailures = 0;
    int discarded = 0;
    CompletionReason reason = CompletionReason.TIMEOUT;

    while (!cancelled) {
      long remaining = deadlineNanos - clock.monotonicNanos();
      if (remaining <= 0) {
        break;
      }
      Optional<InboundMessage> next;
      try {
        next = replies.poll(Duration.ofNanos(remaining));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        cancelled = true;
        break;
      } catch (TransportException ex) {
        throw QueryException.transport(correlationId, ex);
      }
      if (next.isEmpty()) {
        if (replies.isClosed() && !cancelled) {
          throw QueryException.transport(
              correlationId, new TransportException("reply subscription closed by transport"));
        }
        continue;
      }
      InboundMessage message = next.get();
      if (message.arrival().isAfter(windowDeadline)) {
        discarded++;
        metrics.increment("query.reply.late");
        log.debug("Discarding reply that arrived after the window on {}", message.subject());
        continue;
      }
      DecodeResult<ReplyRecord> decoded = codec.decodeReply(message.payload());
      if (!decoded.isSuccess()) {
        decodeFailures++;
        metrics.increment("query.decode.failed");
        log.debug("Dropping undecodable reply on {}: {} payload={}",
            message.subject(), decoded.error().orElseThrow(), Logs.truncate(message.payload()));
        continue;
      }
      ReplyRecord reply = decoded.orElseThrow();
      if (!correlationId.equals(reply.correlationId())) {
        discarded++;
        metrics.increment("query.correlation.mismatch");
        log.debug("Ignoring reply from {} for foreign query {}", reply.responder(), reply.correlationId());
        continue;
      }
      if (reply.kind() != request.kind()) {
        decodeFailures++;
        metrics.increment("query.decode.failed");
        log.debug("Dropping {} reply from {} to a {} request", reply.kind(), reply.responder(), request.kind());
        continue;
      }
      accepted.add(reply);
      responders.add(reply.responder());
      if (expectedReplies > 0 && responders.size() >= expectedReplies) {
        reason = CompletionReason.EXPECTED_REPLIES;
        metrics.increment("query." + kindTag + ".earlyStop");
        log.debug("Expected {} replies received; stopping early", expectedReplies);
        break;
      }
    }

    state.set(CollectorState.DRAINING);
    replies.close();
    if (cancelled) {
      throw cancelledOutcome(kindTag, correlationId);
    }
    long elapsedMillis = Duration.ofNanos(clock.monotonicNanos() - startNanos).toMillis();
    Instant windowEnd = windowStart.plusMillis(Math.max(0L, elapsedMillis));
    if (reason == CompletionReason.TIMEOUT) {
      metrics.increment("query." + kindTag + ".timeout");
    }
    metrics.observe("query." + kindTag + ".latencyMs", elapsedMillis);

    AggregatedSnapshot snapshot = aggregator.aggregate(new ReplySet(
        request, accepted, windowStart, windowEnd, reason, decodeFailures, discarded));
    metrics.observe("query." + kindTag + ".replies", snapshot.hosts().size());
    log.info("{} query finished after {} ms: {} host(s), reason {}",
        kindTag, elapsedMillis, snapshot.hosts().size(), reason);
    if (minimumReplies > 0 && snapshot.hosts().size() < minimumReplies) {
      throw QueryException.insufficient(correlationId, minimumReplies, snapshot);
    }
    return snapshot;
  }

  private QueryException cancelledOutcome(String kindTag, String correlationId) {
    metrics.increment("query." + kindTag + ".cancelled");
    log.info("{} query cancelled; discarding accumulated replies", kindTag);
    return QueryException.cancelled(correlationId);
  }
}
