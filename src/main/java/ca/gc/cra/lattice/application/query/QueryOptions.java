package ca.gc.cra.lattice.application.query;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Per-query collection settings.
 *
 * @param timeout collection window; must be positive
 * @param expectedReplies early-stop hint: stop once this many distinct hosts replied; {@code 0} disables
 * @param minimumReplies replies required for success; {@code 0} accepts an empty snapshot
 *
 * @since 0.1.0
 */
public record QueryOptions(Duration timeout, int expectedReplies, int minimumReplies) {

  public QueryOptions {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (expectedReplies < 0) {
      throw new IllegalArgumentException("expectedReplies must not be negative");
    }
    if (minimumReplies < 0) {
      throw new IllegalArgumentException("minimumReplies must not be negative");
    }
  }

  /**
   * Collects for the full window with no hint and no minimum.
   *
   * @param timeout collection window
   * @return options
   */
  public static QueryOptions of(Duration timeout) {
    return new QueryOptions(timeout, 0, 0);
  }

  public QueryOptions withExpectedReplies(int expected) {
    return new QueryOptions(timeout, expected, minimumReplies);
  }

  public QueryOptions withMinimumReplies(int minimum) {
    return new QueryOptions(timeout, expectedReplies, minimum);
  }

  public OptionalInt expectedHint() {
    return expectedReplies > 0 ? OptionalInt.of(expectedReplies) : OptionalInt.empty();
  }
}
