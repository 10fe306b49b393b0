package app.danki.core.review.session;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps at most one card per note in a session. Buckets are scanned
 * learning, review, new; the first card of a note wins and later siblings
 * are dropped. Nothing is persisted.
 */
@Component
public class SiblingSuppressionFilter {

    public SessionBuckets filter(SessionBuckets buckets) {
        Set<UUID> seenNotes = new HashSet<>();
        List<SessionCard> learning = keepFirstPerNote(buckets.learning(), seenNotes);
        List<SessionCard> review = keepFirstPerNote(buckets.review(), seenNotes);
        List<SessionCard> fresh = keepFirstPerNote(buckets.fresh(), seenNotes);
        return new SessionBuckets(learning, review, fresh);
    }

    private static List<SessionCard> keepFirstPerNote(List<SessionCard> cards, Set<UUID> seenNotes) {
        List<SessionCard> kept = new ArrayList<>(cards.size());
        for (SessionCard card : cards) {
            if (seenNotes.add(card.noteId())) {
                kept.add(card);
            }
        }
        return kept;
    }
}
