package app.danki.core.review.session;

import app.danki.core.review.api.CardState;
import app.danki.core.review.api.InterleaveMode;
import app.danki.core.review.config.SchedulerProps;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionQueueBuilderTest {

    private final SessionQueueBuilder builder =
            new SessionQueueBuilder(SchedulerProps.defaults(), new SiblingSuppressionFilter());

    @Test
    void build_emptyBucketsGiveEmptySession() {
        assertThat(builder.build(new SessionBuckets(null, null, null), InterleaveMode.DISTRIBUTE, new Random(1)))
                .isEmpty();
    }

    @Test
    void build_learningCardsComeFirst() {
        SessionCard learning = card(CardState.LEARNING, 50);
        SessionCard review = card(CardState.REVIEW, 10);
        SessionCard fresh = card(CardState.NEW, 1);

        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(learning), List.of(review), List.of(fresh)),
                InterleaveMode.NEW_FIRST,
                new Random(1));

        assertThat(queue).containsExactly(learning, fresh, review);
    }

    @Test
    void build_distributeSpreadsNewCardsBetweenReviews() {
        List<SessionCard> reviews = IntStream.range(0, 4).mapToObj(i -> card(CardState.REVIEW, i)).toList();
        List<SessionCard> fresh = IntStream.range(0, 2).mapToObj(i -> card(CardState.NEW, i)).toList();

        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(), reviews, fresh),
                InterleaveMode.DISTRIBUTE,
                new Random(1));

        // modulus (2 + 4) / 2 = 3: every third card is new
        assertThat(queue).containsExactly(
                reviews.get(0), reviews.get(1), fresh.get(0),
                reviews.get(2), reviews.get(3), fresh.get(1));
    }

    @Test
    void build_distributeFallsBackWhenOneBucketIsEmpty() {
        List<SessionCard> fresh = IntStream.range(0, 3).mapToObj(i -> card(CardState.NEW, i)).toList();

        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(), List.of(), fresh),
                InterleaveMode.DISTRIBUTE,
                new Random(1));

        assertThat(queue).containsExactlyElementsOf(fresh);
    }

    @Test
    void build_reviewsFirst() {
        SessionCard review = card(CardState.REVIEW, 10);
        SessionCard fresh = card(CardState.NEW, 1);

        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(), List.of(review), List.of(fresh)),
                InterleaveMode.REVIEWS_FIRST,
                new Random(1));

        assertThat(queue).containsExactly(review, fresh);
    }

    @Test
    void build_keepsAtMostOneCardPerNote() {
        UUID note = UUID.randomUUID();
        List<SessionCard> fresh = new ArrayList<>();
        fresh.add(new SessionCard(UUID.randomUUID(), note, UUID.randomUUID(), "f", "b", CardState.NEW, "front->back", 1));
        fresh.add(new SessionCard(UUID.randomUUID(), note, UUID.randomUUID(), "f", "b", CardState.NEW, "back->front", 1));
        fresh.add(card(CardState.NEW, 2));

        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(), List.of(), fresh),
                InterleaveMode.DISTRIBUTE,
                new Random(1));

        Set<UUID> notes = new HashSet<>();
        assertThat(queue).allMatch(c -> notes.add(c.noteId()));
        assertThat(queue).hasSize(2);
    }

    @Test
    void build_jitterOnlyReordersLearningCardsWithSameDue() {
        List<SessionCard> sameDue = IntStream.range(0, 20).mapToObj(i -> card(CardState.LEARNING, 1_000)).toList();
        SessionCard earlier = card(CardState.LEARNING, 100);
        SessionCard later = card(CardState.LEARNING, 5_000);

        List<SessionCard> learning = new ArrayList<>();
        learning.add(later);
        learning.addAll(sameDue);
        learning.add(earlier);

        List<SessionCard> queue = builder.build(
                new SessionBuckets(learning, List.of(), List.of()),
                InterleaveMode.DISTRIBUTE,
                new Random(7));

        assertThat(queue).hasSize(22);
        assertThat(queue.get(0)).isEqualTo(earlier);
        assertThat(queue.get(21)).isEqualTo(later);
        assertThat(queue.subList(1, 21)).containsExactlyInAnyOrderElementsOf(sameDue);
        // stored due is untouched
        assertThat(queue).allMatch(c -> c.dueAt() == 100 || c.dueAt() == 1_000 || c.dueAt() == 5_000);
    }

    @Test
    void build_jitterStaysWithinFiveMinutes() {
        List<SessionCard> tied = IntStream.range(0, 8).mapToObj(i -> card(CardState.LEARNING, 10_000)).toList();
        SessionCard justBefore = card(CardState.LEARNING, 9_999);
        SessionCard justAfter = card(CardState.LEARNING, 10_301);

        List<SessionCard> learning = new ArrayList<>(tied);
        learning.add(justAfter);
        learning.add(justBefore);

        for (long seed = 0; seed < 500; seed++) {
            List<SessionCard> queue = builder.build(
                    new SessionBuckets(learning, List.of(), List.of()),
                    InterleaveMode.DISTRIBUTE,
                    new Random(seed));

            assertThat(queue.get(0)).as("seed %d", seed).isEqualTo(justBefore);
            assertThat(queue.get(queue.size() - 1)).as("seed %d", seed).isEqualTo(justAfter);
        }
    }

    @Test
    void build_sameSeedGivesSameOrder() {
        List<SessionCard> learning = IntStream.range(0, 10).mapToObj(i -> card(CardState.LEARNING, 1_000)).toList();
        SessionBuckets buckets = new SessionBuckets(learning, List.of(), List.of());

        assertThat(builder.build(buckets, InterleaveMode.DISTRIBUTE, new Random(99)))
                .containsExactlyElementsOf(builder.build(buckets, InterleaveMode.DISTRIBUTE, new Random(99)));
    }

    @Test
    void build_resultIsImmutable() {
        List<SessionCard> queue = builder.build(
                new SessionBuckets(List.of(), List.of(card(CardState.REVIEW, 1)), List.of()),
                InterleaveMode.DISTRIBUTE,
                new Random(1));

        assertThatThrownBy(() -> queue.add(card(CardState.NEW, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static SessionCard card(CardState state, long due) {
        return new SessionCard(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "front", "back", state, "front->back", due);
    }
}
