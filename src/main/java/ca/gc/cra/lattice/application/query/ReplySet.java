package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.domain.query.CompletionReason;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything a collector accumulated for one query, handed to {@link SnapshotAggregator}.
 *
 * @param request the request that was published
 * @param replies accepted replies in arrival order, duplicates included
 * @param windowStart instant the request was published
 * @param windowEnd instant collection stopped
 * @param reason why collection stopped
 * @param decodeFailures replies dropped because they failed to decode
 * @param discardedReplies replies dropped for a foreign correlation id or late arrival
 *
 * @since 0.1.0
 */
public record ReplySet(
    QueryRequest request,
    List<ReplyRecord> replies,
    Instant windowStart,
    Instant windowEnd,
    CompletionReason reason,
    int decodeFailures,
    int discardedReplies) {

  public ReplySet {
    request = Objects.requireNonNull(request, "request");
    replies = replies == null ? List.of() : List.copyOf(replies);
    windowStart = Objects.requireNonNull(windowStart, "windowStart");
    windowEnd = Objects.requireNonNull(windowEnd, "windowEnd");
    reason = Objects.requireNonNull(reason, "reason");
  }
}
