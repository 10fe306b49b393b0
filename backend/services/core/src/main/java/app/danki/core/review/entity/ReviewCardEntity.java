package app.danki.core.review.entity;

import app.danki.core.review.algorithm.CardSnapshot;
import app.danki.core.review.api.CardState;
import jakarta.persistence.*;

import java.util.UUID;

/**
 * Scheduling view of a card row. Rows are created by the deck module; this
 * side only reads and updates the scheduling columns.
 */
@Entity
@Table(name = "cards", schema = "danki")
public class ReviewCardEntity {

    @Id
    @Column(name = "card_id", nullable = false, updatable = false)
    private UUID cardId;

    @Column(name = "note_id", nullable = false, updatable = false)
    private UUID noteId;

    @Column(name = "template", nullable = false, updatable = false)
    private String template;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false)
    private CardState state;

    @Column(name = "due_at", nullable = false)
    private long dueAt;

    @Column(name = "interval_days", nullable = false)
    private double intervalDays;

    @Column(name = "ease", nullable = false)
    private double ease;

    @Column(name = "lapses", nullable = false)
    private int lapses;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(name = "last_review_at")
    private Long lastReviewAt;

    @Column(name = "graduated", nullable = false)
    private boolean graduated;

    @Enumerated(EnumType.STRING)
    @Column(name = "suspended_from")
    private CardState suspendedFrom;

    @Column(name = "buried_until")
    private Long buriedUntil;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public ReviewCardEntity() {
    }

    public CardSnapshot toSnapshot() {
        return new CardSnapshot(state, dueAt, intervalDays, ease, lapses, stepIndex, lastReviewAt, graduated);
    }

    public void applySnapshot(CardSnapshot snapshot) {
        this.state = snapshot.state();
        this.dueAt = snapshot.dueAt();
        this.intervalDays = snapshot.intervalDays();
        this.ease = snapshot.ease();
        this.lapses = snapshot.lapses();
        this.stepIndex = snapshot.stepIndex();
        this.lastReviewAt = snapshot.lastReviewAt();
        this.graduated = snapshot.graduated();
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getNoteId() {
        return noteId;
    }

    public void setNoteId(UUID noteId) {
        this.noteId = noteId;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public CardState getState() {
        return state;
    }

    public void setState(CardState state) {
        this.state = state;
    }

    public long getDueAt() {
        return dueAt;
    }

    public void setDueAt(long dueAt) {
        this.dueAt = dueAt;
    }

    public double getIntervalDays() {
        return intervalDays;
    }

    public void setIntervalDays(double intervalDays) {
        this.intervalDays = intervalDays;
    }

    public double getEase() {
        return ease;
    }

    public void setEase(double ease) {
        this.ease = ease;
    }

    public int getLapses() {
        return lapses;
    }

    public void setLapses(int lapses) {
        this.lapses = lapses;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public void setStepIndex(int stepIndex) {
        this.stepIndex = stepIndex;
    }

    public Long getLastReviewAt() {
        return lastReviewAt;
    }

    public void setLastReviewAt(Long lastReviewAt) {
        this.lastReviewAt = lastReviewAt;
    }

    public boolean isGraduated() {
        return graduated;
    }

    public void setGraduated(boolean graduated) {
        this.graduated = graduated;
    }

    public CardState getSuspendedFrom() {
        return suspendedFrom;
    }

    public void setSuspendedFrom(CardState suspendedFrom) {
        this.suspendedFrom = suspendedFrom;
    }

    public Long getBuriedUntil() {
        return buriedUntil;
    }

    public void setBuriedUntil(Long buriedUntil) {
        this.buriedUntil = buriedUntil;
    }

    public long getRowVersion() {
        return rowVersion;
    }
}
