package app.danki.core.review.controller.dto;

import java.util.List;
import java.util.UUID;

public record BuildSessionRequest(
        List<UUID> deckIds,
        Long now,
        Integer maxNew,
        Integer maxReview
) {}
