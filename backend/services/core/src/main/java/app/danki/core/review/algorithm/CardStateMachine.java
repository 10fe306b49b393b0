package app.danki.core.review.algorithm;

import app.danki.core.review.api.CardState;
import app.danki.core.review.config.SchedulerProps;
import app.danki.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lifecycle of a card: NEW, LEARNING, REVIEW, RELEARNING. Deterministic for a
 * given snapshot, rating, step list and clock value.
 */
@Component
public class CardStateMachine {

    static final long SECONDS_PER_MINUTE = 60L;
    static final long SECONDS_PER_DAY = 86_400L;

    private final SchedulerProps props;
    private final EaseIntervalCalculator calculator;

    public CardStateMachine(SchedulerProps props, EaseIntervalCalculator calculator) {
        this.props = props;
        this.calculator = calculator;
    }

    /**
     * @param stepsMinutes learning steps of the card's deck, in minutes
     * @param now          epoch seconds of the answer
     */
    public Transition apply(CardSnapshot card, Rating rating, List<Integer> stepsMinutes, long now) {
        if (stepsMinutes == null || stepsMinutes.isEmpty()) {
            throw new IllegalArgumentException("Learning steps must not be empty");
        }

        CardSnapshot next = switch (card.state()) {
            case NEW -> handleNew(card, rating, stepsMinutes, now);
            case LEARNING, RELEARNING -> handleLearning(card, rating, stepsMinutes, now);
            case REVIEW -> handleReview(card, rating, stepsMinutes, now);
            case SUSPENDED -> throw new IllegalStateException("Suspended cards cannot be reviewed");
        };

        boolean leech = next.lapses() > card.lapses() && next.lapses() >= props.leechThreshold();
        return new Transition(card, next, leech);
    }

    private CardSnapshot handleNew(CardSnapshot card, Rating rating, List<Integer> steps, long now) {
        if (rating != Rating.GOT_IT) {
            return stepTo(card, CardState.LEARNING, 0, now + stepSeconds(steps, 0), card.lapses(), now);
        }
        // GOT_IT passes the first step
        if (steps.size() == 1) {
            return graduate(card, now);
        }
        return stepTo(card, CardState.LEARNING, 1, now + stepSeconds(steps, 1), card.lapses(), now);
    }

    private CardSnapshot handleLearning(CardSnapshot card, Rating rating, List<Integer> steps, long now) {
        int step = Math.min(Math.max(0, card.stepIndex()), steps.size() - 1);
        int lastStep = steps.size() - 1;

        return switch (rating) {
            case GOT_IT -> step >= lastStep
                    ? graduate(card, now)
                    : stepTo(card, card.state(), step + 1, now + stepSeconds(steps, step + 1), card.lapses(), now);
            case ALMOST -> {
                long minutes = Math.max(steps.get(step), props.almostStepFloorMinutes());
                yield stepTo(card, card.state(), step, now + minutes * SECONDS_PER_MINUTE, card.lapses(), now);
            }
            case MISSED -> {
                int lapses = card.state() == CardState.RELEARNING ? card.lapses() + 1 : card.lapses();
                yield stepTo(card, card.state(), 0, now + stepSeconds(steps, 0), lapses, now);
            }
        };
    }

    private CardSnapshot handleReview(CardSnapshot card, Rating rating, List<Integer> steps, long now) {
        EaseIntervalCalculator.EaseInterval out = calculator.next(card.ease(), card.intervalDays(), rating);

        if (rating == Rating.MISSED) {
            return new CardSnapshot(
                    CardState.RELEARNING,
                    now + stepSeconds(steps, 0),
                    0.0,
                    out.ease(),
                    card.lapses() + 1,
                    0,
                    now,
                    card.graduated()
            );
        }

        return new CardSnapshot(
                CardState.REVIEW,
                now + daysToSeconds(out.intervalDays()),
                out.intervalDays(),
                out.ease(),
                card.lapses(),
                0,
                now,
                card.graduated()
        );
    }

    private CardSnapshot graduate(CardSnapshot card, long now) {
        int intervalDays = card.graduated()
                ? props.graduatingIntervalDays()
                : props.firstGraduationIntervalDays();
        double ease = card.ease() > 0
                ? Math.max(EaseIntervalCalculator.MINIMUM_EASE, card.ease())
                : props.initialEaseFactor();

        return new CardSnapshot(
                CardState.REVIEW,
                now + intervalDays * SECONDS_PER_DAY,
                intervalDays,
                ease,
                card.lapses(),
                0,
                now,
                true
        );
    }

    // learning and relearning cards carry no day interval
    private static CardSnapshot stepTo(CardSnapshot card, CardState state, int step, long due, int lapses, long now) {
        return new CardSnapshot(
                state,
                due,
                0.0,
                card.ease(),
                lapses,
                step,
                now,
                card.graduated()
        );
    }

    private static long stepSeconds(List<Integer> steps, int index) {
        return steps.get(index) * SECONDS_PER_MINUTE;
    }

    private static long daysToSeconds(double days) {
        return Math.round(days * SECONDS_PER_DAY);
    }
}
