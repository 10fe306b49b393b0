package app.danki.core.review.algorithm;

/**
 * Result of applying one rating: the card before, the card after, and
 * whether this answer turned the card into a leech.
 */
public record Transition(CardSnapshot before, CardSnapshot after, boolean leech) {

    public boolean lapsed() {
        return after.lapses() > before.lapses();
    }
}
