package app.danki.core.deck.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class UnknownDeckException extends ResponseStatusException {

    public UnknownDeckException(UUID deckId) {
        super(HttpStatus.NOT_FOUND, "Deck not found: " + deckId);
    }
}
