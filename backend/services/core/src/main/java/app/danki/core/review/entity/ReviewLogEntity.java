package app.danki.core.review.entity;

import app.danki.core.review.api.CardState;
import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

/**
 * One graded answer. The card id carries no foreign key so the ledger
 * outlives deleted cards.
 */
@Entity
@Immutable
@Table(name = "review_log", schema = "danki")
public class ReviewLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "reviewed_at", nullable = false)
    private long reviewedAt;

    @Column(name = "rating", nullable = false)
    private short rating;

    @Column(name = "answer_ms", nullable = false)
    private long answerMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "prior_state", nullable = false)
    private CardState priorState;

    @Column(name = "prior_interval_days", nullable = false)
    private double priorIntervalDays;

    @Column(name = "next_interval_days", nullable = false)
    private double nextIntervalDays;

    @Enumerated(EnumType.STRING)
    @Column(name = "next_state", nullable = false)
    private CardState nextState;

    @Column(name = "prior_ease", nullable = false)
    private double priorEase;

    @Column(name = "next_ease", nullable = false)
    private double nextEase;

    public ReviewLogEntity() {
    }

    public ReviewLogEntity(UUID cardId,
                           long reviewedAt,
                           short rating,
                           long answerMs,
                           CardState priorState,
                           double priorIntervalDays,
                           double nextIntervalDays,
                           CardState nextState,
                           double priorEase,
                           double nextEase) {
        this.cardId = cardId;
        this.reviewedAt = reviewedAt;
        this.rating = rating;
        this.answerMs = answerMs;
        this.priorState = priorState;
        this.priorIntervalDays = priorIntervalDays;
        this.nextIntervalDays = nextIntervalDays;
        this.nextState = nextState;
        this.priorEase = priorEase;
        this.nextEase = nextEase;
    }

    public Long getId() {
        return id;
    }

    public UUID getCardId() {
        return cardId;
    }

    public long getReviewedAt() {
        return reviewedAt;
    }

    public short getRating() {
        return rating;
    }

    public long getAnswerMs() {
        return answerMs;
    }

    public CardState getPriorState() {
        return priorState;
    }

    public double getPriorIntervalDays() {
        return priorIntervalDays;
    }

    public double getNextIntervalDays() {
        return nextIntervalDays;
    }

    public CardState getNextState() {
        return nextState;
    }

    public double getPriorEase() {
        return priorEase;
    }

    public double getNextEase() {
        return nextEase;
    }
}
