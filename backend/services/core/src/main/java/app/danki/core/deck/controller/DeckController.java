package app.danki.core.deck.controller;

import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.dto.DeckDTO;
import app.danki.core.deck.domain.request.CreateDeckRequest;
import app.danki.core.deck.service.DeckService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/decks")
public class DeckController {

    private final DeckService deckService;

    public DeckController(DeckService deckService) {
        this.deckService = deckService;
    }

    // GET /decks
    @GetMapping
    public List<DeckDTO> listDecks() {
        return deckService.listDecks();
    }

    // GET /decks/{deckId}
    @GetMapping("/{deckId}")
    public DeckDTO getDeck(@PathVariable UUID deckId) {
        return deckService.getDeck(deckId);
    }

    // POST /decks
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DeckDTO createDeck(@Valid @RequestBody CreateDeckRequest request) {
        return deckService.createDeck(request);
    }

    // PUT /decks/{deckId}/preferences
    @PutMapping("/{deckId}/preferences")
    public DeckDTO updatePreferences(@PathVariable UUID deckId,
                                     @RequestBody DeckPreferences preferences) {
        return deckService.updatePreferences(deckId, preferences);
    }

    // DELETE /decks/{deckId}
    @DeleteMapping("/{deckId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteDeck(@PathVariable UUID deckId) {
        deckService.deleteDeck(deckId);
    }
}
