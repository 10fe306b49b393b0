package app.danki.core.review.ledger;

import app.danki.core.review.api.CardState;

import java.util.UUID;

public record ReviewEvent(
        Long id,
        UUID cardId,
        long reviewedAt,
        int rating,
        long answerMs,
        CardState priorState,
        double priorIntervalDays,
        double nextIntervalDays,
        CardState nextState,
        double priorEase,
        double nextEase
) {
}
