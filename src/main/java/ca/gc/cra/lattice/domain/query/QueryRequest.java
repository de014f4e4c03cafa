package ca.gc.cra.lattice.domain.query;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * One outstanding scatter-gather request.
 *
 * <p>Created per invocation and discarded once the snapshot is produced. The correlation identifier
 * binds replies to this request; replies carrying any other identifier belong to a different query
 * sharing the bus.</p>
 *
 * @param correlationId opaque per-query token; never {@code null} or blank
 * @param kind request kind; never {@code null}
 * @param scope scope selector; never {@code null}
 * @param replySubject unique subject responders publish their replies to; never {@code null}
 * @param timeout collection window; must be positive
 * @param parameters kind-specific request parameters (e.g., auction constraints); never {@code null}
 *
 * @since 0.1.0
 */
public record QueryRequest(
    String correlationId,
    QueryKind kind,
    QueryScope scope,
    String replySubject,
    Duration timeout,
    Map<String, String> parameters) {

  /**
   * Validates request invariants and copies the parameter map.
   */
  public QueryRequest {
    correlationId = requireText(correlationId, "correlationId");
    kind = Objects.requireNonNull(kind, "kind");
    scope = Objects.requireNonNull(scope, "scope");
    replySubject = requireText(replySubject, "replySubject");
    timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  private static String requireText(String value, String name) {
    String trimmed = Objects.requireNonNull(value, name).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }
}
