package app.danki.core.review.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "deck_daily_counters", schema = "danki")
@IdClass(DailyStudyCounterEntity.DailyStudyCounterId.class)
public class DailyStudyCounterEntity {

    @Id
    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Id
    @Column(name = "study_date", nullable = false)
    private LocalDate studyDate;

    @Column(name = "new_studied", nullable = false)
    private int newStudied;

    @Column(name = "review_studied", nullable = false)
    private int reviewStudied;

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public LocalDate getStudyDate() {
        return studyDate;
    }

    public void setStudyDate(LocalDate studyDate) {
        this.studyDate = studyDate;
    }

    public int getNewStudied() {
        return newStudied;
    }

    public void setNewStudied(int newStudied) {
        this.newStudied = newStudied;
    }

    public int getReviewStudied() {
        return reviewStudied;
    }

    public void setReviewStudied(int reviewStudied) {
        this.reviewStudied = reviewStudied;
    }

    public static class DailyStudyCounterId implements Serializable {
        private UUID deckId;
        private LocalDate studyDate;

        public DailyStudyCounterId() {
        }

        public DailyStudyCounterId(UUID deckId, LocalDate studyDate) {
            this.deckId = deckId;
            this.studyDate = studyDate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DailyStudyCounterId that)) return false;
            return Objects.equals(deckId, that.deckId) && Objects.equals(studyDate, that.studyDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(deckId, studyDate);
        }
    }
}
