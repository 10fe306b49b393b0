package app.danki.core.deck.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidDeckConfigException extends ResponseStatusException {

    public InvalidDeckConfigException(String reason) {
        super(HttpStatus.BAD_REQUEST, "Invalid deck preferences: " + reason);
    }

    public InvalidDeckConfigException(String reason, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "Invalid deck preferences: " + reason, cause);
    }
}
