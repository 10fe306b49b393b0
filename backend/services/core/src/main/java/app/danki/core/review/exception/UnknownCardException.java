package app.danki.core.review.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class UnknownCardException extends ResponseStatusException {

    private final UUID cardId;

    public UnknownCardException(UUID cardId) {
        super(HttpStatus.NOT_FOUND, "Card not found: " + cardId);
        this.cardId = cardId;
    }

    public UUID getCardId() {
        return cardId;
    }
}
