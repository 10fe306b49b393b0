package app.danki.core.deck.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class UnknownNoteException extends ResponseStatusException {

    public UnknownNoteException(UUID noteId) {
        super(HttpStatus.NOT_FOUND, "Note not found: " + noteId);
    }
}
