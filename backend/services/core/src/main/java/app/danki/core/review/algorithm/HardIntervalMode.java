package app.danki.core.review.algorithm;

/**
 * Interval policy for an ALMOST answer on a review card.
 */
public enum HardIntervalMode {
    /** interval x ease, using the ease after the ALMOST penalty. */
    EASE_ADJUSTED,
    /** interval x a fixed multiplier. */
    FIXED_MULTIPLIER
}
