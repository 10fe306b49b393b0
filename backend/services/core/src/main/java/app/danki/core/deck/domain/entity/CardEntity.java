package app.danki.core.deck.domain.entity;

import app.danki.core.deck.domain.type.CardTemplate;
import app.danki.core.deck.domain.type.CardTemplateConverter;
import app.danki.core.review.api.CardState;
import jakarta.persistence.*;

import java.util.UUID;

/**
 * Card row as created for a note. Scheduling columns not mapped here take
 * their database defaults (interval 0, ease 2.5, no lapses).
 */
@Entity
@Table(name = "cards", schema = "danki")
public class CardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "note_id", nullable = false, updatable = false)
    private UUID noteId;

    @Convert(converter = CardTemplateConverter.class)
    @Column(name = "template", nullable = false, updatable = false)
    private CardTemplate template;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, updatable = false)
    private CardState state;

    // creation time for new cards
    @Column(name = "due_at", nullable = false, updatable = false)
    private long dueAt;

    public CardEntity() {
    }

    public CardEntity(UUID noteId, CardTemplate template, long createdAt) {
        this.noteId = noteId;
        this.template = template;
        this.state = CardState.NEW;
        this.dueAt = createdAt;
    }

    public UUID getCardId() {
        return cardId;
    }

    public UUID getNoteId() {
        return noteId;
    }

    public CardTemplate getTemplate() {
        return template;
    }

    public CardState getState() {
        return state;
    }

    public long getDueAt() {
        return dueAt;
    }
}
