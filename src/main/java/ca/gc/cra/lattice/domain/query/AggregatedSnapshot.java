package ca.gc.cra.lattice.domain.query;

import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.inventory.LinkBinding;
import ca.gc.cra.lattice.domain.inventory.WorkloadDescriptor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Merged, deduplicated view of every host that answered one query.
 * <p><strong>Why:</strong> Callers and renderers need a deterministic result regardless of reply arrival order.</p>
 * <p><strong>Role:</strong> Domain value produced by the aggregator and returned by the query façade.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold exactly one inventory per responder identity, ordered by identity ascending.</li>
 *   <li>Expose derived summaries (total workload count, per-host counts, flattened bindings).</li>
 *   <li>Record the collection window and why it closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param kind kind of query that produced the snapshot; never {@code null}
 * @param correlationId correlation identifier of the query; never {@code null}
 * @param hosts host inventories sorted by identity; never {@code null}
 * @param totalWorkloadCount sum of per-host workload counts
 * @param windowStart instant the request was published; never {@code null}
 * @param windowEnd instant collection stopped; never {@code null}
 * @param completionReason why collection stopped; never {@code null}
 * @param decodeFailures replies dropped because they could not be decoded
 * @param discardedReplies replies dropped because they belonged to another query or arrived late
 *
 * @since 0.1.0
 */
public record AggregatedSnapshot(
    QueryKind kind,
    String correlationId,
    List<HostInventory> hosts,
    int totalWorkloadCount,
    Instant windowStart,
    Instant windowEnd,
    CompletionReason completionReason,
    int decodeFailures,
    int discardedReplies) {

  /**
   * Validates invariants: unique, sorted host identities and a well-formed window.
   */
  public AggregatedSnapshot {
    kind = Objects.requireNonNull(kind, "kind");
    correlationId = Objects.requireNonNull(correlationId, "correlationId");
    hosts = hosts == null ? List.of() : List.copyOf(hosts);
    windowStart = Objects.requireNonNull(windowStart, "windowStart");
    windowEnd = Objects.requireNonNull(windowEnd, "windowEnd");
    completionReason = Objects.requireNonNull(completionReason, "completionReason");
    if (windowEnd.isBefore(windowStart)) {
      throw new IllegalArgumentException("windowEnd must not precede windowStart");
    }
    Set<String> seen = new HashSet<>();
    String previous = null;
    for (HostInventory host : hosts) {
      if (!seen.add(host.hostId())) {
        throw new IllegalArgumentException("duplicate host in snapshot: " + host.hostId());
      }
      if (previous != null && previous.compareTo(host.hostId()) > 0) {
        throw new IllegalArgumentException("hosts must be sorted by identity");
      }
      previous = host.hostId();
    }
  }

  /**
   * Completeness flag: {@code true} when at least one host replied.
   *
   * @return whether any reply was accepted
   */
  public boolean hasResponses() {
    return !hosts.isEmpty();
  }

  /**
   * Returns the responder identities in snapshot order.
   *
   * @return sorted host identities
   */
  public List<String> hostIds() {
    List<String> ids = new ArrayList<>(hosts.size());
    for (HostInventory host : hosts) {
      ids.add(host.hostId());
    }
    return List.copyOf(ids);
  }

  /**
   * Looks up a host by identity.
   *
   * @param hostId responder identity
   * @return inventory when the host replied
   */
  public Optional<HostInventory> host(String hostId) {
    for (HostInventory host : hosts) {
      if (host.hostId().equals(hostId)) {
        return Optional.of(host);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns per-host workload counts in snapshot order.
   *
   * @return ordered map of host identity to workload count
   */
  public Map<String, Integer> workloadCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (HostInventory host : hosts) {
      counts.put(host.hostId(), host.workloadCount());
    }
    return counts;
  }

  /**
   * Returns workloads grouped by host in snapshot order.
   *
   * @return ordered map of host identity to workloads
   */
  public Map<String, List<WorkloadDescriptor>> workloadsByHost() {
    Map<String, List<WorkloadDescriptor>> grouped = new LinkedHashMap<>();
    for (HostInventory host : hosts) {
      grouped.put(host.hostId(), host.workloads());
    }
    return grouped;
  }

  /**
   * Returns link bindings grouped by host in snapshot order.
   *
   * @return ordered map of host identity to bindings
   */
  public Map<String, List<LinkBinding>> bindingsByHost() {
    Map<String, List<LinkBinding>> grouped = new LinkedHashMap<>();
    for (HostInventory host : hosts) {
      grouped.put(host.hostId(), host.bindings());
    }
    return grouped;
  }

  /**
   * Returns the wall-clock length of the collection window.
   *
   * @return window duration
   */
  public Duration window() {
    return Duration.between(windowStart, windowEnd);
  }
}
