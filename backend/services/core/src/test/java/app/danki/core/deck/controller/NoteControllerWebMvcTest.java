package app.danki.core.deck.controller;

import app.danki.core.deck.domain.dto.NoteDTO;
import app.danki.core.deck.domain.request.AddNoteRequest;
import app.danki.core.deck.exception.DuplicateNoteException;
import app.danki.core.deck.importer.BundledNoteImporter;
import app.danki.core.deck.importer.ImportSummary;
import app.danki.core.deck.service.NoteService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.Reader;
import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NoteController.class)
@ActiveProfiles("test")
class NoteControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    NoteService noteService;

    @MockitoBean
    BundledNoteImporter bundledNoteImporter;

    @Test
    void addNote_returnsNoteId() throws Exception {
        UUID deckId = UUID.randomUUID();
        UUID noteId = UUID.randomUUID();
        when(noteService.addNote(eq(deckId), any(AddNoteRequest.class)))
                .thenReturn(new NoteDTO(noteId, deckId, "der Hund", "the dog", null, Instant.now()));

        mockMvc.perform(post("/decks/{deckId}/notes", deckId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\": \"der Hund\", \"back\": \"the dog\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.noteId").value(noteId.toString()));
    }

    @Test
    void addNote_duplicateIsConflict() throws Exception {
        UUID deckId = UUID.randomUUID();
        when(noteService.addNote(eq(deckId), any(AddNoteRequest.class)))
                .thenThrow(new DuplicateNoteException(deckId, "ja"));

        mockMvc.perform(post("/decks/{deckId}/notes", deckId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\": \"ja\", \"back\": \"yes\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void addNote_missingBackIsBadRequest() throws Exception {
        mockMvc.perform(post("/decks/{deckId}/notes", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\": \"ja\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void importBundle_returnsSummary() throws Exception {
        UUID deckId = UUID.randomUUID();
        when(bundledNoteImporter.importLines(eq(deckId), any(Reader.class))).thenReturn(new ImportSummary(2, 1, 0));

        mockMvc.perform(post("/decks/{deckId}/notes/bundle", deckId)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("{\"front\": \"a\", \"back\": \"b\"}\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(2))
                .andExpect(jsonPath("$.duplicates").value(1));
    }
}
