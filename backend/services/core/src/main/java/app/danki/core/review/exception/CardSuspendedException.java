package app.danki.core.review.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class CardSuspendedException extends ResponseStatusException {

    public CardSuspendedException(UUID cardId) {
        super(HttpStatus.CONFLICT, "Card is suspended: " + cardId);
    }
}
