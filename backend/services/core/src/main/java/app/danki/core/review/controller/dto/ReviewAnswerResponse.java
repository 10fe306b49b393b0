package app.danki.core.review.controller.dto;

import app.danki.core.review.api.CardState;
import app.danki.core.review.domain.Rating;

import java.util.UUID;

public record ReviewAnswerResponse(
        UUID answeredCardId,
        Rating rating,
        CardState state,
        long dueAt,
        double intervalDays,
        double ease,
        int lapses,
        boolean leech
) {
}
