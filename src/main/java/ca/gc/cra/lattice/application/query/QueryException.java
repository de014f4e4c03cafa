package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import java.util.Objects;
import java.util.Optional;

/**
 * Failed query outcome. A timeout is not a failure; it yields a snapshot.
 *
 * @since 0.1.0
 */
public class QueryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Failure categories. */
  public enum Kind {
    /** Publishing or subscribing failed; the query never ran. */
    TRANSPORT,
    /** Fewer replies than the caller's minimum arrived before the deadline. */
    INSUFFICIENT,
    /** The caller aborted the query; accumulated replies were discarded. */
    CANCELLED
  }

  private final Kind kind;
  private final String correlationId;
  private final transient AggregatedSnapshot partial;

  QueryException(Kind kind, String correlationId, String message, Throwable cause, AggregatedSnapshot partial) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.correlationId = correlationId;
    this.partial = partial;
  }

  static QueryException transport(String correlationId, Throwable cause) {
    return new QueryException(
        Kind.TRANSPORT, correlationId, "Transport failure for query " + correlationId + ": " + cause.getMessage(),
        cause, null);
  }

  static QueryException cancelled(String correlationId) {
    return new QueryException(Kind.CANCELLED, correlationId, "Query " + correlationId + " was cancelled", null, null);
  }

  static QueryException insufficient(String correlationId, int minimum, AggregatedSnapshot partial) {
    return new QueryException(
        Kind.INSUFFICIENT,
        correlationId,
        "Query " + correlationId + " received " + partial.hosts().size() + " of " + minimum + " required replies",
        null,
        partial);
  }

  public Kind kind() {
    return kind;
  }

  public String correlationId() {
    return correlationId;
  }

  /**
   * Returns the snapshot accumulated before an {@link Kind#INSUFFICIENT} outcome.
   *
   * @return partial snapshot; empty for other kinds
   */
  public Optional<AggregatedSnapshot> partialSnapshot() {
    return Optional.ofNullable(partial);
  }
}
