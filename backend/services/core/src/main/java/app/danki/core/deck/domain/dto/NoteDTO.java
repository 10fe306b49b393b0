package app.danki.core.deck.domain.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record NoteDTO(
        UUID noteId,
        UUID deckId,
        String front,
        String back,
        JsonNode meta,
        Instant createdAt
) {
}
