package app.danki.core.deck.adapter;

import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.entity.DeckEntity;
import app.danki.core.deck.exception.UnknownDeckException;
import app.danki.core.deck.repository.DeckRepository;
import app.danki.core.deck.service.DeckPreferencesResolver;
import app.danki.core.review.api.DeckSchedulingConfig;
import app.danki.core.review.api.DeckSchedulingPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class DeckSchedulingAdapter implements DeckSchedulingPort {

    private final DeckRepository deckRepository;
    private final DeckPreferencesResolver preferencesResolver;

    public DeckSchedulingAdapter(DeckRepository deckRepository, DeckPreferencesResolver preferencesResolver) {
        this.deckRepository = deckRepository;
        this.preferencesResolver = preferencesResolver;
    }

    @Override
    public DeckSchedulingConfig getDeckConfig(UUID deckId) {
        DeckEntity deck = deckRepository.findById(deckId)
                .orElseThrow(() -> new UnknownDeckException(deckId));
        return toConfig(deck);
    }

    @Override
    public List<DeckSchedulingConfig> getDeckConfigs(List<UUID> deckIds) {
        Map<UUID, DeckEntity> decks = deckRepository.findAllById(deckIds).stream()
                .collect(Collectors.toMap(DeckEntity::getDeckId, Function.identity()));

        List<DeckSchedulingConfig> out = new ArrayList<>(deckIds.size());
        for (UUID deckId : deckIds) {
            DeckEntity deck = decks.get(deckId);
            if (deck == null) {
                throw new UnknownDeckException(deckId);
            }
            out.add(toConfig(deck));
        }
        return out;
    }

    private DeckSchedulingConfig toConfig(DeckEntity deck) {
        DeckPreferences prefs = preferencesResolver.fromJson(deck.getPrefs());
        return new DeckSchedulingConfig(
                deck.getDeckId(),
                prefs.newPerDay(),
                prefs.revPerDay(),
                prefs.stepsMin(),
                prefs.interleave()
        );
    }
}
