package app.danki.core.review.session;

import app.danki.core.review.api.CardState;

import java.util.UUID;

/**
 * A card as presented in a session.
 *
 * @param dueAt epoch seconds; for new cards the creation time
 */
public record SessionCard(
        UUID cardId,
        UUID noteId,
        UUID deckId,
        String front,
        String back,
        CardState state,
        String template,
        long dueAt
) {
}
