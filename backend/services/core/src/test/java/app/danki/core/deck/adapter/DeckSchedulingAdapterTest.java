package app.danki.core.deck.adapter;

import app.danki.core.deck.config.DeckDefaultsProps;
import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.entity.DeckEntity;
import app.danki.core.deck.exception.UnknownDeckException;
import app.danki.core.deck.repository.DeckRepository;
import app.danki.core.deck.service.DeckPreferencesResolver;
import app.danki.core.review.api.DeckSchedulingConfig;
import app.danki.core.review.api.InterleaveMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeckSchedulingAdapterTest {

    @Mock
    DeckRepository deckRepository;

    DeckPreferencesResolver resolver;
    DeckSchedulingAdapter adapter;

    @BeforeEach
    void setup() {
        resolver = new DeckPreferencesResolver(DeckDefaultsProps.defaults(), new ObjectMapper());
        adapter = new DeckSchedulingAdapter(deckRepository, resolver);
    }

    @Test
    void getDeckConfigs_keepsRequestedOrder() {
        DeckEntity a = deck(new DeckPreferences(5, 50, List.of(1), InterleaveMode.REVIEWS_FIRST, null));
        DeckEntity b = deck(null);
        when(deckRepository.findAllById(List.of(b.getDeckId(), a.getDeckId()))).thenReturn(List.of(a, b));

        List<DeckSchedulingConfig> configs = adapter.getDeckConfigs(List.of(b.getDeckId(), a.getDeckId()));

        assertThat(configs).extracting(DeckSchedulingConfig::deckId).containsExactly(b.getDeckId(), a.getDeckId());
        assertThat(configs.get(1).newPerDay()).isEqualTo(5);
        assertThat(configs.get(1).learningStepsMinutes()).containsExactly(1);
        assertThat(configs.get(1).interleave()).isEqualTo(InterleaveMode.REVIEWS_FIRST);
        assertThat(configs.get(0).learningStepsMinutes()).containsExactly(10, 1440);
    }

    @Test
    void getDeckConfigs_unknownDeck() {
        UUID missing = UUID.randomUUID();
        when(deckRepository.findAllById(List.of(missing))).thenReturn(List.of());

        assertThatThrownBy(() -> adapter.getDeckConfigs(List.of(missing)))
                .isInstanceOf(UnknownDeckException.class);
    }

    private DeckEntity deck(DeckPreferences prefs) {
        DeckEntity deck = new DeckEntity("deck-" + UUID.randomUUID(), false,
                resolver.toJson(resolver.complete(prefs)), Instant.now());
        deck.setDeckId(UUID.randomUUID());
        return deck;
    }
}
