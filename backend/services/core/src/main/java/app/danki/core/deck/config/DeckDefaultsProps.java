package app.danki.core.deck.config;

import app.danki.core.review.api.InterleaveMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Preferences applied to decks that do not set their own.
 */
@ConfigurationProperties(prefix = "danki.deck-defaults")
public record DeckDefaultsProps(
        Integer newPerDay,
        Integer revPerDay,
        List<Integer> stepsMin,
        InterleaveMode interleave,
        Boolean bidirectional
) {
    public DeckDefaultsProps {
        newPerDay = newPerDay == null ? 10 : newPerDay;
        revPerDay = revPerDay == null ? 100 : revPerDay;
        stepsMin = (stepsMin == null || stepsMin.isEmpty()) ? List.of(10, 1440) : List.copyOf(stepsMin);
        interleave = interleave == null ? InterleaveMode.DISTRIBUTE : interleave;
        bidirectional = bidirectional != null && bidirectional;
    }

    public static DeckDefaultsProps defaults() {
        return new DeckDefaultsProps(null, null, null, null, null);
    }
}
