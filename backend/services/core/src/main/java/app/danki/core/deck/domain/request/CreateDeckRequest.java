package app.danki.core.deck.domain.request;

import app.danki.core.deck.domain.DeckPreferences;
import jakarta.validation.constraints.NotBlank;

public record CreateDeckRequest(
        @NotBlank String name,
        boolean builtin,
        DeckPreferences preferences
) {
}
