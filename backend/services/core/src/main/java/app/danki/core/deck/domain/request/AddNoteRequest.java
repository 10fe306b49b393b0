package app.danki.core.deck.domain.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

public record AddNoteRequest(
        @NotBlank String front,
        @NotBlank String back,
        JsonNode meta
) {
}
