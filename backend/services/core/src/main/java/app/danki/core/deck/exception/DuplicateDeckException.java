package app.danki.core.deck.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class DuplicateDeckException extends ResponseStatusException {

    public DuplicateDeckException(String name) {
        super(HttpStatus.CONFLICT, "Deck already exists: " + name);
    }
}
