package app.danki.core.review.api;

import java.util.UUID;

/**
 * Callback for cards whose lapse count reached the leech threshold.
 * Every bean implementing it is notified once the review has committed; a
 * failing handler is logged and does not affect the review.
 */
public interface LeechHandler {

    void onLeech(UUID cardId, UUID deckId, int lapses);
}
