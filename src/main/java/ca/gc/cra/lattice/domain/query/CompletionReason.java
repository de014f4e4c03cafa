package ca.gc.cra.lattice.domain.query;

/**
 * Why a collection window closed.
 *
 * @since 0.1.0
 */
public enum CompletionReason {
  /** The time budget elapsed; the snapshot holds whatever arrived (possibly nothing). */
  TIMEOUT,
  /** The expected number of distinct responders replied before the deadline. */
  EXPECTED_REPLIES
}
