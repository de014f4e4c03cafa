package ca.gc.cra.lattice.domain.inventory;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one workload running on a lattice host.
 *
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param id workload identifier (actor public key or capability id); never {@code null}
 * @param kind workload kind; never {@code null}
 * @param instanceName binding/instance name for capability providers; may be {@code null}
 * @param revision revision or image reference; may be {@code null}
 *
 * @since 0.1.0
 */
public record WorkloadDescriptor(String id, WorkloadKind kind, String instanceName, String revision) {

  /**
   * Validates identifiers and normalizes blank optional fields to {@code null}.
   */
  public WorkloadDescriptor {
    id = Objects.requireNonNull(id, "id").trim();
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    kind = Objects.requireNonNull(kind, "kind");
    instanceName = normalize(instanceName);
    revision = normalize(revision);
  }

  /**
   * Builds an actor descriptor.
   *
   * @param id actor identifier
   * @param revision optional revision reference
   * @return actor descriptor
   */
  public static WorkloadDescriptor actor(String id, String revision) {
    return new WorkloadDescriptor(id, WorkloadKind.ACTOR, null, revision);
  }

  /**
   * Builds a capability provider descriptor.
   *
   * @param capabilityId capability contract identifier (e.g., {@code wascc:http_server})
   * @param instanceName binding name of the provider instance
   * @return provider descriptor
   */
  public static WorkloadDescriptor provider(String capabilityId, String instanceName) {
    return new WorkloadDescriptor(capabilityId, WorkloadKind.CAPABILITY_PROVIDER, instanceName, null);
  }

  /**
   * Returns the optional revision or image reference.
   *
   * @return revision when present
   */
  public Optional<String> revisionRef() {
    return Optional.ofNullable(revision);
  }

  /**
   * Returns the optional instance name.
   *
   * @return instance name when present
   */
  public Optional<String> instance() {
    return Optional.ofNullable(instanceName);
  }

  private static String normalize(String candidate) {
    if (candidate == null) {
      return null;
    }
    String trimmed = candidate.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
