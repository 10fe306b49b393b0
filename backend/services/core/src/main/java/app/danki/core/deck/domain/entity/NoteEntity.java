package app.danki.core.deck.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notes", schema = "danki")
public class NoteEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "note_id", nullable = false)
    private UUID noteId;

    @Column(name = "deck_id", nullable = false, updatable = false)
    private UUID deckId;

    @Column(name = "front", nullable = false)
    private String front;

    @Column(name = "back", nullable = false)
    private String back;

    // tags and free-form annotations
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meta", columnDefinition = "jsonb")
    private JsonNode meta;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public NoteEntity() {
    }

    public NoteEntity(UUID deckId, String front, String back, JsonNode meta, Instant createdAt) {
        this.deckId = deckId;
        this.front = front;
        this.back = back;
        this.meta = meta;
        this.createdAt = createdAt;
    }

    public UUID getNoteId() {
        return noteId;
    }

    public void setNoteId(UUID noteId) {
        this.noteId = noteId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public String getFront() {
        return front;
    }

    public void setFront(String front) {
        this.front = front;
    }

    public String getBack() {
        return back;
    }

    public void setBack(String back) {
        this.back = back;
    }

    public JsonNode getMeta() {
        return meta;
    }

    public void setMeta(JsonNode meta) {
        this.meta = meta;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
