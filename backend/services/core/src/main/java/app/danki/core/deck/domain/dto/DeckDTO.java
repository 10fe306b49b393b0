package app.danki.core.deck.domain.dto;

import app.danki.core.deck.domain.DeckPreferences;

import java.time.Instant;
import java.util.UUID;

public record DeckDTO(
        UUID deckId,
        String name,
        boolean builtin,
        DeckPreferences preferences,
        Instant createdAt
) {
}
