package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Merges a collector's {@link ReplySet} into an {@link AggregatedSnapshot}.
 * <p><strong>Why:</strong> Replies arrive in any order and may repeat; callers need one deterministic view.</p>
 * <p><strong>Role:</strong> Pure application service; no I/O, no clock.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep one inventory per responder; the latest-arriving reply replaces earlier ones.</li>
 *   <li>Order hosts by responder identity, ascending.</li>
 *   <li>For workload-scoped queries, keep only hosts that run or bind the workload.</li>
 *   <li>Sum per-host workload counts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotAggregator {

  /**
   * Builds the snapshot for one query.
   *
   * @param replySet accumulated replies and window metadata
   * @return snapshot sorted by responder identity
   */
  public AggregatedSnapshot aggregate(ReplySet replySet) {
    Map<String, HostInventory> latest = new TreeMap<>();
    for (ReplyRecord reply : replySet.replies()) {
      latest.put(reply.responder(), reply.inventory());
    }
    QueryScope scope = replySet.request().scope();
    List<HostInventory> hosts = new ArrayList<>(latest.size());
    int totalWorkloads = 0;
    for (HostInventory inventory : latest.values()) {
      if (scope.type() == QueryScope.Type.WORKLOAD && !inventory.references(scope.target())) {
        continue;
      }
      hosts.add(inventory);
      totalWorkloads += inventory.workloadCount();
    }
    return new AggregatedSnapshot(
        replySet.request().kind(),
        replySet.request().correlationId(),
        hosts,
        totalWorkloads,
        replySet.windowStart(),
        replySet.windowEnd(),
        replySet.reason(),
        replySet.decodeFailures(),
        replySet.discardedReplies());
  }
}
