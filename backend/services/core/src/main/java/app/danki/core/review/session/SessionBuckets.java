package app.danki.core.review.session;

import java.util.List;

/**
 * Candidate cards grouped by bucket, each already in bucket order.
 */
public record SessionBuckets(
        List<SessionCard> learning,
        List<SessionCard> review,
        List<SessionCard> fresh
) {
    public SessionBuckets {
        learning = learning == null ? List.of() : List.copyOf(learning);
        review = review == null ? List.of() : List.copyOf(review);
        fresh = fresh == null ? List.of() : List.copyOf(fresh);
    }

    public boolean isEmpty() {
        return learning.isEmpty() && review.isEmpty() && fresh.isEmpty();
    }

    public int size() {
        return learning.size() + review.size() + fresh.size();
    }
}
