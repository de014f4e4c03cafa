package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a query running on the client's query pool.
 *
 * <p>{@link #cancel()} and a caller-side timeout in {@link #await(Duration)} both close the reply
 * subscription promptly; the query then ends with a {@link QueryException.Kind#CANCELLED} outcome and
 * never a partial snapshot.</p>
 *
 * @since 0.1.0
 */
public final class PendingQuery {
  private final String correlationId;
  private final ScatterGatherCollector collector;
  private final Future<AggregatedSnapshot> result;

  PendingQuery(String correlationId, ScatterGatherCollector collector, Future<AggregatedSnapshot> result) {
    this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
    this.collector = Objects.requireNonNull(collector, "collector");
    this.result = Objects.requireNonNull(result, "result");
  }

  public String correlationId() {
    return correlationId;
  }

  public CollectorState state() {
    return collector.state();
  }

  public boolean isDone() {
    return result.isDone();
  }

  /**
   * Aborts the query. Safe to call at any point, including after completion.
   */
  public void cancel() {
    collector.cancel();
  }

  /**
   * Waits for the query to finish on its own schedule.
   *
   * @return aggregated snapshot
   * @throws QueryException on transport failure, cancellation or an unmet minimum
   */
  public AggregatedSnapshot await() {
    try {
      return result.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cancel();
      throw QueryException.cancelled(correlationId);
    } catch (ExecutionException ex) {
      throw unwrap(ex);
    } catch (CancellationException ex) {
      throw QueryException.cancelled(correlationId);
    }
  }

  /**
   * Waits at most {@code callerTimeout}. When the wait elapses first the query is cancelled.
   *
   * @param callerTimeout caller-side bound, typically shorter than the protocol timeout
   * @return aggregated snapshot
   * @throws QueryException with kind {@code CANCELLED} if the caller-side bound elapsed
   */
  public AggregatedSnapshot await(Duration callerTimeout) {
    Objects.requireNonNull(callerTimeout, "callerTimeout");
    try {
      return result.get(Math.max(0L, callerTimeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      cancel();
      throw QueryException.cancelled(correlationId);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cancel();
      throw QueryException.cancelled(correlationId);
    } catch (ExecutionException ex) {
      throw unwrap(ex);
    } catch (CancellationException ex) {
      throw QueryException.cancelled(correlationId);
    }
  }

  private RuntimeException unwrap(ExecutionException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof QueryException query) {
      return query;
    }
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException("Query " + correlationId + " failed", cause);
  }
}
