package app.danki.core.deck.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "decks", schema = "danki")
public class DeckEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "is_builtin", nullable = false)
    private boolean builtin;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prefs", columnDefinition = "jsonb", nullable = false)
    private JsonNode prefs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public DeckEntity() {
    }

    public DeckEntity(String name, boolean builtin, JsonNode prefs, Instant createdAt) {
        this.name = name;
        this.builtin = builtin;
        this.prefs = prefs;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    public void setBuiltin(boolean builtin) {
        this.builtin = builtin;
    }

    public JsonNode getPrefs() {
        return prefs;
    }

    public void setPrefs(JsonNode prefs) {
        this.prefs = prefs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
