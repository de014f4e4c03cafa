package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.application.events.BusEventListener;
import ca.gc.cra.lattice.application.events.EventWatcher;
import ca.gc.cra.lattice.application.port.ClockPort;
import ca.gc.cra.lattice.application.port.LatticeCodec;
import ca.gc.cra.lattice.application.port.MetricsPort;
import ca.gc.cra.lattice.application.port.TransportException;
import ca.gc.cra.lattice.application.port.TransportPort;
import ca.gc.cra.lattice.domain.control.LaunchAuctionRequest;
import ca.gc.cra.lattice.domain.control.LaunchCommand;
import ca.gc.cra.lattice.domain.control.TerminateCommand;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Public entry points for querying and steering a lattice.
 * <p><strong>Why:</strong> Each operation is a thin configuration of one collector and the aggregator: scope,
 * timeout, early-stop hint and minimum reply count.</p>
 * <p><strong>Role:</strong> Application façade used by the CLI and embedding applications.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Generate a correlation id and reply subject per query and build a fresh collector for it.</li>
 *   <li>Run queries synchronously on the caller thread or asynchronously on the query pool.</li>
 *   <li>Issue control-plane requests (auction, launch, terminate) and open event watches.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; concurrent queries share the transport and are kept apart by
 * their correlation ids and reply subjects.</p>
 *
 * @since 0.1.0
 */
public final class LatticeClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LatticeClient.class);

  /** Collection window used when the caller does not pass one. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(600);
  static final int DEFAULT_MAX_CONCURRENT_QUERIES = 8;

  static final String PARAM_ACTOR_ID = "actorId";
  static final String PARAM_REVISION = "revision";
  static final String PARAM_CONSTRAINT_PREFIX = "constraint.";

  private final TransportPort transport;
  private final LatticeCodec codec;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final TopicConventions topics;
  private final Duration defaultTimeout;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final Supplier<String> correlationIds;
  private final SnapshotAggregator aggregator = new SnapshotAggregator();
  private volatile boolean closed;

  /**
   * Creates a client with default subjects, timeout, clock and query pool.
   *
   * @param transport shared transport; closed with the client
   * @param codec wire codec
   * @param metrics metrics sink
   */
  public LatticeClient(TransportPort transport, LatticeCodec codec, MetricsPort metrics) {
    this(transport, codec, metrics, ClockPort.SYSTEM, TopicConventions.defaults(), DEFAULT_TIMEOUT, null, null);
  }

  /**
   * Creates a fully configured client.
   *
   * @param transport shared transport; closed with the client
   * @param codec wire codec
   * @param metrics metrics sink
   * @param clock clock stamping snapshot windows
   * @param topics subject conventions
   * @param defaultTimeout window used by operations that take no timeout
   * @param executor pool for {@link #submit}; {@code null} creates an owned pool
   * @param correlationIds correlation id source; {@code null} uses random UUIDs
   */
  public LatticeClient(
      TransportPort transport,
      LatticeCodec codec,
      MetricsPort metrics,
      ClockPort clock,
      TopicConventions topics,
      Duration defaultTimeout,
      ExecutorService executor,
      Supplier<String> correlationIds) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.topics = Objects.requireNonNull(topics, "topics");
    this.defaultTimeout = QueryOptions.of(Objects.requireNonNull(defaultTimeout, "defaultTimeout")).timeout();
    this.ownsExecutor = executor == null;
    this.executor = executor != null
        ? executor
        : ExecutorFactories.newQueryPool(DEFAULT_MAX_CONCURRENT_QUERIES, "lattice-query");
    this.correlationIds = correlationIds != null ? correlationIds : () -> UUID.randomUUID().toString();
  }

  public TopicConventions topics() {
    return topics;
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  public AggregatedSnapshot probeAll() {
    return probeAll(defaultTimeout);
  }

  /**
   * Asks every host to identify itself.
   *
   * @param timeout collection window
   * @return hosts that answered within the window; possibly empty
   */
  public AggregatedSnapshot probeAll(Duration timeout) {
    return query(QueryKind.HOSTS, QueryScope.all(), QueryOptions.of(timeout));
  }

  public AggregatedSnapshot probeHost(String hostId) {
    return probeHost(hostId, defaultTimeout);
  }

  /**
   * Asks one host to identify itself, returning as soon as it answers.
   *
   * @param hostId host identity
   * @param timeout upper bound on the wait
   * @return snapshot with at most one host
   */
  public AggregatedSnapshot probeHost(String hostId, Duration timeout) {
    return query(QueryKind.HOSTS, QueryScope.host(hostId), QueryOptions.of(timeout).withExpectedReplies(1));
  }

  public AggregatedSnapshot queryLinks() {
    return queryLinks(defaultTimeout);
  }

  /**
   * Collects the link bindings every host holds.
   *
   * @param timeout collection window
   * @return snapshot whose inventories carry bindings only
   */
  public AggregatedSnapshot queryLinks(Duration timeout) {
    return query(QueryKind.BINDINGS, QueryScope.all(), QueryOptions.of(timeout));
  }

  public AggregatedSnapshot queryWorkloads(QueryScope scope) {
    return queryWorkloads(scope, defaultTimeout);
  }

  /**
   * Collects running actors within a scope.
   *
   * @param scope all hosts, one host, or the hosts running one workload
   * @param timeout collection window
   * @return snapshot whose inventories carry actors only
   */
  public AggregatedSnapshot queryWorkloads(QueryScope scope, Duration timeout) {
    return query(QueryKind.ACTORS, scope, scopedOptions(scope, timeout));
  }

  public AggregatedSnapshot queryCapabilities(QueryScope scope) {
    return queryCapabilities(scope, defaultTimeout);
  }

  /**
   * Collects loaded capability providers within a scope.
   *
   * @param scope all hosts, one host, or the hosts running one workload
   * @param timeout collection window
   * @return snapshot whose inventories carry capability providers only
   */
  public AggregatedSnapshot queryCapabilities(QueryScope scope, Duration timeout) {
    return query(QueryKind.CAPABILITIES, scope, scopedOptions(scope, timeout));
  }

  /**
   * Runs a query on the calling thread.
   *
   * @param kind query kind
   * @param scope scope selector
   * @param options window, hint and minimum
   * @return aggregated snapshot; a timeout yields a (possibly empty) snapshot
   * @throws QueryException on transport failure, cancellation (thread interrupt) or an unmet minimum
   */
  public AggregatedSnapshot query(QueryKind kind, QueryScope scope, QueryOptions options) {
    return query(kind, scope, options, Map.of());
  }

  /**
   * Starts a query on the query pool.
   *
   * @param kind query kind
   * @param scope scope selector
   * @param options window, hint and minimum
   * @return handle for awaiting or cancelling the query
   * @throws IllegalStateException if the client is closed or the pool has stopped accepting queries
   */
  public PendingQuery submit(QueryKind kind, QueryScope scope, QueryOptions options) {
    Prepared prepared = prepare(kind, scope, options, Map.of());
    Future<AggregatedSnapshot> future;
    try {
      future = executor.submit(prepared::run);
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("Query pool rejected query " + prepared.request.correlationId(), ex);
    }
    return new PendingQuery(prepared.request.correlationId(), prepared.collector, future);
  }

  /**
   * Runs a launch auction: every host able to run the actor under the constraints bids.
   *
   * @param auction actor, revision and host constraints
   * @param options window, hint and minimum
   * @return bidding host ids, sorted ascending
   */
  public List<String> auction(LaunchAuctionRequest auction, QueryOptions options) {
    Objects.requireNonNull(auction, "auction");
    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put(PARAM_ACTOR_ID, auction.actorId());
    parameters.put(PARAM_REVISION, Integer.toString(auction.revision()));
    auction.constraints().forEach((key, value) -> parameters.put(PARAM_CONSTRAINT_PREFIX + key, value));
    AggregatedSnapshot bids = query(QueryKind.AUCTION, QueryScope.all(), options, parameters);
    log.debug("Auction for {} drew {} bid(s)", auction.actorId(), bids.hosts().size());
    return bids.hostIds();
  }

  /**
   * Asks one host to launch an actor and waits for its acknowledgement.
   *
   * @param hostId target host
   * @param actorId actor to launch
   * @param revision actor revision
   * @param timeout how long to wait for the acknowledgement
   * @return snapshot holding the acknowledging host
   * @throws QueryException with kind {@code INSUFFICIENT} if the host did not acknowledge in time
   */
  public AggregatedSnapshot launchActor(String hostId, String actorId, int revision, Duration timeout) {
    LaunchCommand command = new LaunchCommand(actorId, revision);
    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put(PARAM_ACTOR_ID, command.actorId());
    parameters.put(PARAM_REVISION, Integer.toString(command.revision()));
    QueryOptions options = QueryOptions.of(timeout).withExpectedReplies(1).withMinimumReplies(1);
    return query(QueryKind.LAUNCH, QueryScope.host(hostId), options, parameters);
  }

  /**
   * Tells one host to stop an actor. Hosts do not acknowledge terminations.
   *
   * @param hostId target host
   * @param actorId actor to stop
   * @throws TransportException if the command cannot be published
   */
  public void terminateActor(String hostId, String actorId) {
    ensureOpen();
    TerminateCommand command = new TerminateCommand(actorId);
    String subject = topics.terminateSubject(hostId);
    transport.publish(subject, codec.encodeTerminate(command));
    log.info("Sent terminate for actor {} to {}", command.actorId(), subject);
  }

  /**
   * Starts watching lattice events.
   *
   * @param listener receives each decoded event on the watcher thread
   * @return running watcher; close it to stop
   * @throws TransportException if the event subscription cannot be opened
   */
  public EventWatcher watchEvents(BusEventListener listener) {
    ensureOpen();
    return EventWatcher.start(transport, codec, metrics, topics.eventSubject(), listener);
  }

  /**
   * Stops the owned query pool and closes the transport. Queries still queued on the owned pool are
   * cancelled, so their {@link PendingQuery#await()} throws {@link QueryException} of kind
   * {@code CANCELLED}.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (ownsExecutor) {
      List<Runnable> queued = executor.shutdownNow();
      for (Runnable task : queued) {
        if (task instanceof Future<?> pending) {
          pending.cancel(false);
        }
      }
      if (!queued.isEmpty()) {
        log.info("Cancelled {} queued quer{} on close", queued.size(), queued.size() == 1 ? "y" : "ies");
      }
      try {
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
          log.warn("Query pool did not terminate within 2 s");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    transport.close();
  }

  private AggregatedSnapshot query(
      QueryKind kind, QueryScope scope, QueryOptions options, Map<String, String> parameters) {
    return prepare(kind, scope, options, parameters).run();
  }

  private Prepared prepare(
      QueryKind kind, QueryScope scope, QueryOptions options, Map<String, String> parameters) {
    ensureOpen();
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(options, "options");
    String correlationId = correlationIds.get();
    QueryRequest request = new QueryRequest(
        correlationId, kind, scope, topics.replySubject(correlationId), options.timeout(), parameters);
    String subject = topics.requestSubject(kind, scope);
    ScatterGatherCollector collector = new ScatterGatherCollector(transport, codec, aggregator, metrics, clock);
    return new Prepared(subject, request, options, collector);
  }

  private static QueryOptions scopedOptions(QueryScope scope, Duration timeout) {
    QueryOptions options = QueryOptions.of(timeout);
    return scope.type() == QueryScope.Type.HOST ? options.withExpectedReplies(1) : options;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("lattice client is closed");
    }
  }

  private static final class Prepared {
    private final String subject;
    private final QueryRequest request;
    private final QueryOptions options;
    private final ScatterGatherCollector collector;

    Prepared(String subject, QueryRequest request, QueryOptions options, ScatterGatherCollector collector) {
      this.subject = subject;
      this.request = request;
      this.options = options;
      this.collector = collector;
    }

    AggregatedSnapshot run() {
      return collector.collect(subject, request, options.expectedReplies(), options.minimumReplies());
    }
  }
}
