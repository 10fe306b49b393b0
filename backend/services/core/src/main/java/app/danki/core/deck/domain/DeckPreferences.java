package app.danki.core.deck.domain;

import app.danki.core.review.api.InterleaveMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-deck study preferences, stored as the deck's {@code prefs} JSON.
 * Any field may be absent in a request; stored values are always complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeckPreferences(
        @JsonProperty("new_per_day") Integer newPerDay,
        @JsonProperty("rev_per_day") Integer revPerDay,
        @JsonProperty("steps_min") List<Integer> stepsMin,
        @JsonProperty("interleave") InterleaveMode interleave,
        @JsonProperty("bidirectional") Boolean bidirectional
) {
    public boolean isBidirectional() {
        return Boolean.TRUE.equals(bidirectional);
    }
}
