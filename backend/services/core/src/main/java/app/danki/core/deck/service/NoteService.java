package app.danki.core.deck.service;

import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.dto.NoteDTO;
import app.danki.core.deck.domain.entity.CardEntity;
import app.danki.core.deck.domain.entity.DeckEntity;
import app.danki.core.deck.domain.entity.NoteEntity;
import app.danki.core.deck.domain.request.AddNoteRequest;
import app.danki.core.deck.domain.type.CardTemplate;
import app.danki.core.deck.exception.DuplicateNoteException;
import app.danki.core.deck.exception.UnknownDeckException;
import app.danki.core.deck.exception.UnknownNoteException;
import app.danki.core.deck.repository.CardRepository;
import app.danki.core.deck.repository.DeckRepository;
import app.danki.core.deck.repository.NoteRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class NoteService {

    private final DeckRepository deckRepository;
    private final NoteRepository noteRepository;
    private final CardRepository cardRepository;
    private final DeckPreferencesResolver preferencesResolver;

    public NoteService(DeckRepository deckRepository,
                       NoteRepository noteRepository,
                       CardRepository cardRepository,
                       DeckPreferencesResolver preferencesResolver) {
        this.deckRepository = deckRepository;
        this.noteRepository = noteRepository;
        this.cardRepository = cardRepository;
        this.preferencesResolver = preferencesResolver;
    }

    /**
     * Creates a note and its NEW card, plus the reverse card when the deck
     * is bidirectional. The cards are due from their creation time, which
     * orders them among the deck's new cards.
     */
    @Transactional
    public NoteDTO addNote(UUID deckId, AddNoteRequest request) {
        String front = request.front() == null ? "" : request.front().trim();
        String back = request.back() == null ? "" : request.back().trim();
        if (front.isEmpty() || back.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Note front and back are required");
        }

        DeckEntity deck = deckRepository.findById(deckId)
                .orElseThrow(() -> new UnknownDeckException(deckId));
        if (noteRepository.existsByDeckIdAndFrontAndBack(deckId, front, back)) {
            throw new DuplicateNoteException(deckId, front);
        }

        Instant createdAt = Instant.now();
        NoteEntity note;
        try {
            note = noteRepository.saveAndFlush(new NoteEntity(deckId, front, back, request.meta(), createdAt));
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateNoteException(deckId, front);
        }

        DeckPreferences preferences = preferencesResolver.fromJson(deck.getPrefs());
        List<CardEntity> cards = new ArrayList<>(2);
        cards.add(new CardEntity(note.getNoteId(), CardTemplate.FRONT_TO_BACK, createdAt.getEpochSecond()));
        if (preferences.isBidirectional()) {
            cards.add(new CardEntity(note.getNoteId(), CardTemplate.BACK_TO_FRONT, createdAt.getEpochSecond()));
        }
        cardRepository.saveAll(cards);

        return toNoteDTO(note);
    }

    @Transactional(readOnly = true)
    public Page<NoteDTO> getNotes(UUID deckId, int page, int limit) {
        if (!deckRepository.existsById(deckId)) {
            throw new UnknownDeckException(deckId);
        }
        if (page < 1 || limit < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "page and limit must be >= 1");
        }
        Pageable pageable = PageRequest.of(page - 1, limit);
        return noteRepository.findByDeckIdOrderByCreatedAtAsc(deckId, pageable)
                .map(this::toNoteDTO);
    }

    // Cards go with the note (on delete cascade)
    @Transactional
    public void deleteNote(UUID noteId) {
        NoteEntity note = noteRepository.findById(noteId)
                .orElseThrow(() -> new UnknownNoteException(noteId));
        noteRepository.delete(note);
    }

    private NoteDTO toNoteDTO(NoteEntity note) {
        return new NoteDTO(
                note.getNoteId(),
                note.getDeckId(),
                note.getFront(),
                note.getBack(),
                note.getMeta(),
                note.getCreatedAt()
        );
    }
}
