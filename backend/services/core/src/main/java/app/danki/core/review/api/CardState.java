package app.danki.core.review.api;

public enum CardState {
    NEW,
    LEARNING,
    REVIEW,
    RELEARNING,
    SUSPENDED;

    public boolean isLearning() {
        return this == LEARNING || this == RELEARNING;
    }
}
