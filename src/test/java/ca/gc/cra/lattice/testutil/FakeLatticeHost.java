package ca.gc.cra.lattice.testutil;

import ca.gc.cra.lattice.adapter.memory.InMemoryTransportAdapter;
import ca.gc.cra.lattice.application.port.DecodeResult;
import ca.gc.cra.lattice.application.port.InboundMessage;
import ca.gc.cra.lattice.application.query.TopicConventions;
import ca.gc.cra.lattice.domain.control.TerminateCommand;
import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.inventory.LinkBinding;
import ca.gc.cra.lattice.domain.inventory.WorkloadDescriptor;
import ca.gc.cra.lattice.domain.inventory.WorkloadKind;
import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import ca.gc.cra.lattice.infrastructure.codec.JsonLatticeCodec;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated lattice host answering inventory, auction and launch requests on an in-memory bus.
 *
 * <p>Replies are published synchronously from the request listener unless a reply delay is set.</p>
 */
public final class FakeLatticeHost implements AutoCloseable {
  private static final String CONSTRAINT_PREFIX = "constraint.";

  private final InMemoryTransportAdapter bus;
  private final TopicConventions topics;
  private final JsonLatticeCodec codec = new JsonLatticeCodec();
  private final String hostId;
  private final List<WorkloadDescriptor> workloads = new CopyOnWriteArrayList<>();
  private final List<LinkBinding> bindings = new CopyOnWriteArrayList<>();
  private final List<String> terminated = new CopyOnWriteArrayList<>();
  private final List<AutoCloseable> handles = new ArrayList<>();
  private final AtomicInteger requestsSeen = new AtomicInteger();
  private volatile Map<String, String> labels = Map.of();
  private volatile long uptimeMillis = 1_000L;
  private volatile Duration replyDelay = Duration.ZERO;
  private volatile int copies = 1;
  private volatile boolean silent;
  private volatile boolean acknowledgeLaunch = true;

  public FakeLatticeHost(InMemoryTransportAdapter bus, String hostId) {
    this(bus, TopicConventions.defaults(), hostId);
  }

  public FakeLatticeHost(InMemoryTransportAdapter bus, TopicConventions topics, String hostId) {
    this.bus = bus;
    this.topics = topics;
    this.hostId = hostId;
    for (QueryKind kind : QueryKind.values()) {
      if (kind == QueryKind.LAUNCH) {
        listen(topics.requestSubject(kind, QueryScope.host(hostId)));
        continue;
      }
      listen(topics.requestSubject(kind, QueryScope.all()));
      listen(topics.requestSubject(kind, QueryScope.host(hostId)));
    }
    handles.add(bus.subscribe(topics.terminateSubject(hostId), this::onTerminate));
  }

  public String hostId() {
    return hostId;
  }

  public FakeLatticeHost withActor(String actorId, String revision) {
    workloads.add(WorkloadDescriptor.actor(actorId, revision));
    return this;
  }

  public FakeLatticeHost withProvider(String capabilityId, String instanceName) {
    workloads.add(WorkloadDescriptor.provider(capabilityId, instanceName));
    return this;
  }

  public FakeLatticeHost withBinding(String actorId, String capabilityId, Map<String, String> values) {
    bindings.add(new LinkBinding(actorId, capabilityId, null, values));
    return this;
  }

  public FakeLatticeHost withLabels(Map<String, String> hostLabels) {
    this.labels = Map.copyOf(hostLabels);
    return this;
  }

  public FakeLatticeHost withUptime(long millis) {
    this.uptimeMillis = millis;
    return this;
  }

  /** Delays every reply; the listener sleeps on the publishing thread. */
  public FakeLatticeHost withReplyDelay(Duration delay) {
    this.replyDelay = delay;
    return this;
  }

  /** Sends each reply this many times. */
  public FakeLatticeHost withCopies(int count) {
    this.copies = count;
    return this;
  }

  public FakeLatticeHost silent() {
    this.silent = true;
    return this;
  }

  public FakeLatticeHost ignoringLaunches() {
    this.acknowledgeLaunch = false;
    return this;
  }

  public int requestsSeen() {
    return requestsSeen.get();
  }

  public List<String> terminatedActors() {
    return List.copyOf(terminated);
  }

  /** Publishes a bus event on the lattice event subject. */
  public void emit(BusEvent event) {
    bus.publish(topics.eventSubject(), codec.encodeEvent(event, UUID.randomUUID().toString(), Instant.now()));
  }

  @Override
  public void close() throws Exception {
    for (AutoCloseable handle : handles) {
      handle.close();
    }
    handles.clear();
  }

  private void listen(String subject) {
    handles.add(bus.subscribe(subject, this::onRequest));
  }

  private void onRequest(InboundMessage message) {
    DecodeResult<QueryRequest> decoded = codec.decodeRequest(message.payload());
    if (!decoded.isSuccess()) {
      return;
    }
    requestsSeen.incrementAndGet();
    QueryRequest request = decoded.orElseThrow();
    if (silent) {
      return;
    }
    HostInventory inventory = inventoryFor(request);
    if (inventory == null) {
      return;
    }
    if (!replyDelay.isZero()) {
      try {
        Thread.sleep(replyDelay.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
    byte[] reply = codec.encodeReply(new ReplyRecord(request.correlationId(), request.kind(), inventory));
    for (int i = 0; i < copies; i++) {
      bus.publish(request.replySubject(), reply);
    }
  }

  private HostInventory inventoryFor(QueryRequest request) {
    return switch (request.kind()) {
      case HOSTS -> new HostInventory(hostId, List.of(), List.of(), labels, uptimeMillis);
      case ACTORS -> new HostInventory(hostId, kindOnly(WorkloadKind.ACTOR), List.of(), Map.of(), 0L);
      case CAPABILITIES ->
          new HostInventory(hostId, kindOnly(WorkloadKind.CAPABILITY_PROVIDER), List.of(), Map.of(), 0L);
      case BINDINGS -> new HostInventory(hostId, List.of(), List.copyOf(bindings), Map.of(), 0L);
      case AUCTION -> satisfies(request.parameters()) ? HostInventory.identityOnly(hostId) : null;
      case LAUNCH -> acknowledgeLaunch ? launched(request.parameters()) : null;
    };
  }

  private List<WorkloadDescriptor> kindOnly(WorkloadKind kind) {
    List<WorkloadDescriptor> matches = new ArrayList<>();
    for (WorkloadDescriptor workload : workloads) {
      if (workload.kind() == kind) {
        matches.add(workload);
      }
    }
    return matches;
  }

  private boolean satisfies(Map<String, String> parameters) {
    for (Map.Entry<String, String> entry : parameters.entrySet()) {
      if (entry.getKey().startsWith(CONSTRAINT_PREFIX)) {
        String label = entry.getKey().substring(CONSTRAINT_PREFIX.length());
        if (!entry.getValue().equals(labels.get(label))) {
          return false;
        }
      }
    }
    return true;
  }

  private HostInventory launched(Map<String, String> parameters) {
    WorkloadDescriptor actor = WorkloadDescriptor.actor(parameters.get("actorId"), parameters.get("revision"));
    workloads.add(actor);
    return new HostInventory(hostId, List.of(actor), List.of(), Map.of(), 0L);
  }

  private void onTerminate(InboundMessage message) {
    DecodeResult<TerminateCommand> command = codec.decodeTerminate(message.payload());
    if (command.isSuccess()) {
      TerminateCommand terminate = command.orElseThrow();
      terminated.add(terminate.actorId());
      workloads.removeIf(workload -> workload.id().equals(terminate.actorId()));
    }
  }
}
