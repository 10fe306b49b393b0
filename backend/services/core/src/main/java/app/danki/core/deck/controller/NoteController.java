package app.danki.core.deck.controller;

import app.danki.core.deck.domain.dto.NoteDTO;
import app.danki.core.deck.domain.request.AddNoteRequest;
import app.danki.core.deck.importer.BundledNoteImporter;
import app.danki.core.deck.importer.ImportSummary;
import app.danki.core.deck.service.NoteService;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.io.StringReader;
import java.util.UUID;

@RestController
public class NoteController {

    private final NoteService noteService;
    private final BundledNoteImporter bundledNoteImporter;

    public NoteController(NoteService noteService, BundledNoteImporter bundledNoteImporter) {
        this.noteService = noteService;
        this.bundledNoteImporter = bundledNoteImporter;
    }

    // GET /decks/{deckId}/notes?page=1&limit=50
    @GetMapping("/decks/{deckId}/notes")
    public Page<NoteDTO> getNotes(@PathVariable UUID deckId,
                                  @RequestParam(defaultValue = "1") int page,
                                  @RequestParam(defaultValue = "50") int limit) {
        return noteService.getNotes(deckId, page, limit);
    }

    // POST /decks/{deckId}/notes
    @PostMapping("/decks/{deckId}/notes")
    @ResponseStatus(HttpStatus.CREATED)
    public NoteDTO addNote(@PathVariable UUID deckId,
                           @Valid @RequestBody AddNoteRequest request) {
        return noteService.addNote(deckId, request);
    }

    // POST /decks/{deckId}/notes/bundle, one JSON object per line
    @PostMapping(value = "/decks/{deckId}/notes/bundle", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ImportSummary importBundle(@PathVariable UUID deckId,
                                      @RequestBody String body) {
        return bundledNoteImporter.importLines(deckId, new StringReader(body));
    }

    // DELETE /notes/{noteId}
    @DeleteMapping("/notes/{noteId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteNote(@PathVariable UUID noteId) {
        noteService.deleteNote(noteId);
    }
}
