package app.danki.core.review.session;

import app.danki.core.review.api.InterleaveMode;
import app.danki.core.review.config.SchedulerProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Orders already limited candidate buckets into the presentation queue:
 * learning cards first, then new and review cards merged by the deck's
 * interleave mode.
 */
@Component
public class SessionQueueBuilder {

    private final SchedulerProps props;
    private final SiblingSuppressionFilter siblingFilter;

    public SessionQueueBuilder(SchedulerProps props, SiblingSuppressionFilter siblingFilter) {
        this.props = props;
        this.siblingFilter = siblingFilter;
    }

    public List<SessionCard> build(SessionBuckets buckets, InterleaveMode mode, Random random) {
        if (buckets == null || buckets.isEmpty()) {
            return List.of();
        }

        SessionBuckets filtered = siblingFilter.filter(buckets);

        List<SessionCard> queue = new ArrayList<>(filtered.size());
        queue.addAll(orderLearning(filtered.learning(), random));
        queue.addAll(interleave(filtered.fresh(), filtered.review(), mode));
        return List.copyOf(queue);
    }

    /**
     * Learning cards sharing an identical due timestamp are skewed by a random
     * offset so a batch added together is not shown in lockstep. The stored
     * due is left untouched.
     */
    List<SessionCard> orderLearning(List<SessionCard> learning, Random random) {
        if (learning.size() < 2) {
            return learning;
        }

        Map<Long, Integer> sameDue = new HashMap<>();
        for (SessionCard card : learning) {
            sameDue.merge(card.dueAt(), 1, Integer::sum);
        }

        int bound = props.learningJitterSeconds() + 1;
        Map<UUID, Long> apparentDue = new HashMap<>();
        for (SessionCard card : learning) {
            long due = card.dueAt();
            if (sameDue.get(due) > 1) {
                due += random.nextInt(bound);
            }
            apparentDue.put(card.cardId(), due);
        }

        List<SessionCard> ordered = new ArrayList<>(learning);
        ordered.sort(Comparator.comparingLong((SessionCard c) -> apparentDue.get(c.cardId()))
                .thenComparing(SessionCard::cardId));
        return ordered;
    }

    List<SessionCard> interleave(List<SessionCard> fresh, List<SessionCard> review, InterleaveMode mode) {
        InterleaveMode effective = mode == null ? InterleaveMode.DISTRIBUTE : mode;
        List<SessionCard> out = new ArrayList<>(fresh.size() + review.size());

        switch (effective) {
            case NEW_FIRST -> {
                out.addAll(fresh);
                out.addAll(review);
            }
            case REVIEWS_FIRST -> {
                out.addAll(review);
                out.addAll(fresh);
            }
            case DISTRIBUTE -> distribute(fresh, review, out);
        }
        return out;
    }

    private static void distribute(List<SessionCard> fresh, List<SessionCard> review, List<SessionCard> out) {
        if (fresh.isEmpty() || review.isEmpty()) {
            out.addAll(review);
            out.addAll(fresh);
            return;
        }

        // every modulus-th card is new
        int modulus = Math.max(2, (fresh.size() + review.size()) / fresh.size());

        int n = 0;
        int r = 0;
        int position = 1;
        while (n < fresh.size() || r < review.size()) {
            boolean newTurn = position % modulus == 0;
            if ((newTurn && n < fresh.size()) || r >= review.size()) {
                out.add(fresh.get(n++));
            } else {
                out.add(review.get(r++));
            }
            position++;
        }
    }
}
