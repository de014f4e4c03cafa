package ca.gc.cra.lattice.domain.inventory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Point-in-time inventory reported by a single lattice host.
 * <p><strong>Why:</strong> Hosts answer probes with whichever facet was asked for (labels, actors, capability
 * providers, bindings); a uniform snapshot type lets the aggregator treat every probe the same way.</p>
 * <p><strong>Role:</strong> Domain value created fresh from each decoded reply and never mutated afterwards.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param hostId responder identity of the host; never {@code null} or blank
 * @param workloads running workloads, duplicates removed, first occurrence order kept; never {@code null}
 * @param bindings active link bindings; never {@code null}
 * @param labels free-form host labels; never {@code null}
 * @param uptimeMillis host uptime reported with the reply; {@code 0} when not reported
 *
 * @since 0.1.0
 */
public record HostInventory(
    String hostId,
    List<WorkloadDescriptor> workloads,
    List<LinkBinding> bindings,
    Map<String, String> labels,
    long uptimeMillis) {

  /**
   * Validates the host identity and copies all collections.
   */
  public HostInventory {
    hostId = Objects.requireNonNull(hostId, "hostId").trim();
    if (hostId.isEmpty()) {
      throw new IllegalArgumentException("hostId must not be blank");
    }
    workloads = workloads == null ? List.of() : List.copyOf(new LinkedHashSet<>(workloads));
    bindings = bindings == null ? List.of() : List.copyOf(bindings);
    labels = labels == null ? Map.of() : Map.copyOf(labels);
    if (uptimeMillis < 0) {
      throw new IllegalArgumentException("uptimeMillis must not be negative");
    }
  }

  /**
   * Creates an inventory carrying only the host identity.
   *
   * @param hostId host identity
   * @return identity-only inventory
   */
  public static HostInventory identityOnly(String hostId) {
    return new HostInventory(hostId, List.of(), List.of(), Map.of(), 0L);
  }

  /**
   * Returns the number of workloads running on the host.
   *
   * @return workload count
   */
  public int workloadCount() {
    return workloads.size();
  }

  /**
   * Returns the workloads of the requested kind.
   *
   * @param kind workload kind to filter on
   * @return matching workloads in report order
   */
  public List<WorkloadDescriptor> workloadsOfKind(WorkloadKind kind) {
    List<WorkloadDescriptor> matches = new ArrayList<>();
    for (WorkloadDescriptor workload : workloads) {
      if (workload.kind() == kind) {
        matches.add(workload);
      }
    }
    return List.copyOf(matches);
  }

  /**
   * Indicates whether the host runs (or binds) the given workload identifier.
   *
   * @param workloadId workload identifier
   * @return {@code true} when a workload or binding references the identifier
   */
  public boolean references(String workloadId) {
    if (workloadId == null) {
      return false;
    }
    for (WorkloadDescriptor workload : workloads) {
      if (workload.id().equals(workloadId)) {
        return true;
      }
    }
    for (LinkBinding binding : bindings) {
      if (binding.workloadId().equals(workloadId)) {
        return true;
      }
    }
    return false;
  }
}
