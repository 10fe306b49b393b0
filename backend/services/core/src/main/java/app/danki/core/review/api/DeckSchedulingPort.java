package app.danki.core.review.api;

import java.util.List;
import java.util.UUID;

public interface DeckSchedulingPort {

    DeckSchedulingConfig getDeckConfig(UUID deckId);

    /**
     * Resolves the scheduling configuration of every deck, in the order given.
     * Fails when any of the ids does not name an existing deck.
     */
    List<DeckSchedulingConfig> getDeckConfigs(List<UUID> deckIds);
}
