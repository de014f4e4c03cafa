package ca.gc.cra.lattice.application.query;

/**
 * Lifecycle of a {@link ScatterGatherCollector}. Transitions only move forward.
 *
 * @since 0.1.0
 */
public enum CollectorState {
  /** Created; no subscription yet. */
  IDLE,
  /** Reply subscription open; request being published. */
  PUBLISHING,
  /** Request published; accepting replies until the deadline or early stop. */
  COLLECTING,
  /** No longer accepting replies; subscription being closed. */
  DRAINING,
  /** Terminal. */
  CLOSED
}
