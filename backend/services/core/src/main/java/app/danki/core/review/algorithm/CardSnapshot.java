package app.danki.core.review.algorithm;

import app.danki.core.review.api.CardState;

/**
 * Scheduling fields of one card, detached from persistence.
 *
 * @param dueAt        epoch seconds
 * @param lastReviewAt epoch seconds, {@code null} for cards never answered
 * @param graduated    whether the card has ever left learning
 */
public record CardSnapshot(
        CardState state,
        long dueAt,
        double intervalDays,
        double ease,
        int lapses,
        int stepIndex,
        Long lastReviewAt,
        boolean graduated
) {
    public static CardSnapshot fresh(long createdAt, double initialEase) {
        return new CardSnapshot(CardState.NEW, createdAt, 0.0, initialEase, 0, 0, null, false);
    }
}
