package app.danki.core.deck.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class DuplicateNoteException extends ResponseStatusException {

    private final UUID deckId;

    public DuplicateNoteException(UUID deckId, String front) {
        super(HttpStatus.CONFLICT, "Note already exists in deck " + deckId + ": " + front);
        this.deckId = deckId;
    }

    public UUID getDeckId() {
        return deckId;
    }
}
