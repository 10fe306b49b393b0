package app.danki.core.review.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "notes", schema = "danki")
public class ReviewNoteEntity {

    @Id
    @Column(name = "note_id", nullable = false)
    private UUID noteId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "front", nullable = false)
    private String front;

    @Column(name = "back", nullable = false)
    private String back;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ReviewNoteEntity() {
    }

    public UUID getNoteId() {
        return noteId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public String getFront() {
        return front;
    }

    public String getBack() {
        return back;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
