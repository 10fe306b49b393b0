package app.danki.core.review.api;

import java.util.List;
import java.util.UUID;

public record DeckSchedulingConfig(
        UUID deckId,
        int newPerDay,
        int reviewPerDay,
        List<Integer> learningStepsMinutes,
        InterleaveMode interleave
) {
    public DeckSchedulingConfig {
        learningStepsMinutes = learningStepsMinutes == null ? List.of() : List.copyOf(learningStepsMinutes);
        interleave = interleave == null ? InterleaveMode.DISTRIBUTE : interleave;
    }
}
