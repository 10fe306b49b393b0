package app.danki.core.review.api;

/**
 * How new cards are merged with review cards after the learning block.
 */
public enum InterleaveMode {
    /** Spread new cards evenly between reviews. */
    DISTRIBUTE,
    NEW_FIRST,
    REVIEWS_FIRST
}
