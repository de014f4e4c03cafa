package ca.gc.cra.lattice.domain.inventory;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration binding from a workload (actor) to a named capability provider.
 *
 * <p><strong>Thread-safety:</strong> Records are immutable; the configuration map is copied on construction.</p>
 *
 * @param workloadId identifier of the bound actor; never {@code null}
 * @param contractId capability contract identifier (e.g., {@code wascc:keyvalue}); never {@code null}
 * @param bindingName name of the provider instance; defaults to {@code default} when blank
 * @param configuration bound configuration values; never {@code null}
 *
 * @since 0.1.0
 */
public record LinkBinding(
    String workloadId, String contractId, String bindingName, Map<String, String> configuration) {

  /** Binding name used by hosts when none is supplied. */
  public static final String DEFAULT_BINDING = "default";

  /**
   * Validates identifiers and copies the configuration map.
   */
  public LinkBinding {
    workloadId = Objects.requireNonNull(workloadId, "workloadId");
    contractId = Objects.requireNonNull(contractId, "contractId");
    bindingName = bindingName == null || bindingName.isBlank() ? DEFAULT_BINDING : bindingName.trim();
    configuration = configuration == null ? Map.of() : Map.copyOf(configuration);
  }
}
