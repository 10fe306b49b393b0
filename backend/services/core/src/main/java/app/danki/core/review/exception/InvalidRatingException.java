package app.danki.core.review.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidRatingException extends ResponseStatusException {

    public InvalidRatingException(String rating) {
        super(HttpStatus.BAD_REQUEST, "Invalid rating: " + rating + " (expected 0, 1 or 2)");
    }
}
