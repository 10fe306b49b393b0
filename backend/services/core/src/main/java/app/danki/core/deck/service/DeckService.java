package app.danki.core.deck.service;

import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.dto.DeckDTO;
import app.danki.core.deck.domain.entity.DeckEntity;
import app.danki.core.deck.domain.request.CreateDeckRequest;
import app.danki.core.deck.exception.DuplicateDeckException;
import app.danki.core.deck.exception.UnknownDeckException;
import app.danki.core.deck.repository.DeckRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class DeckService {

    private static final Logger log = LoggerFactory.getLogger(DeckService.class);

    private final DeckRepository deckRepository;
    private final DeckPreferencesResolver preferencesResolver;

    public DeckService(DeckRepository deckRepository, DeckPreferencesResolver preferencesResolver) {
        this.deckRepository = deckRepository;
        this.preferencesResolver = preferencesResolver;
    }

    // Built-in decks first, then by name
    @Transactional(readOnly = true)
    public List<DeckDTO> listDecks() {
        return deckRepository.findAllByOrderByBuiltinDescNameAsc()
                .stream()
                .map(this::toDeckDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public DeckDTO getDeck(UUID deckId) {
        return toDeckDTO(requireDeck(deckId));
    }

    @Transactional
    public DeckDTO createDeck(CreateDeckRequest request) {
        String name = request.name() == null ? "" : request.name().trim();
        if (name.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Deck name is required");
        }
        if (deckRepository.existsByNameIgnoreCase(name)) {
            throw new DuplicateDeckException(name);
        }

        DeckPreferences preferences = preferencesResolver.complete(request.preferences());
        DeckEntity deck = new DeckEntity(name, request.builtin(), preferencesResolver.toJson(preferences), Instant.now());

        DeckEntity saved;
        try {
            saved = deckRepository.saveAndFlush(deck);
        } catch (DataIntegrityViolationException ex) {
            // concurrent insert of the same name
            throw new DuplicateDeckException(name);
        }
        log.info("Created deck {} ({})", saved.getDeckId(), name);
        return toDeckDTO(saved);
    }

    /**
     * Fields present in {@code patch} replace the stored ones; the result is
     * validated as a whole before it is saved.
     */
    @Transactional
    public DeckDTO updatePreferences(UUID deckId, DeckPreferences patch) {
        DeckEntity deck = requireDeck(deckId);
        DeckPreferences current = preferencesResolver.fromJson(deck.getPrefs());
        DeckPreferences merged = preferencesResolver.merge(current, patch);
        deck.setPrefs(preferencesResolver.toJson(merged));
        return toDeckDTO(deckRepository.save(deck));
    }

    // Notes and cards go with the deck (on delete cascade); the review log stays
    @Transactional
    public void deleteDeck(UUID deckId) {
        DeckEntity deck = requireDeck(deckId);
        deckRepository.delete(deck);
        log.info("Deleted deck {} ({})", deckId, deck.getName());
    }

    private DeckEntity requireDeck(UUID deckId) {
        return deckRepository.findById(deckId)
                .orElseThrow(() -> new UnknownDeckException(deckId));
    }

    private DeckDTO toDeckDTO(DeckEntity deck) {
        return new DeckDTO(
                deck.getDeckId(),
                deck.getName(),
                deck.isBuiltin(),
                preferencesResolver.fromJson(deck.getPrefs()),
                deck.getCreatedAt()
        );
    }
}
