package app.danki.core.deck.repository;

import app.danki.core.deck.domain.entity.CardEntity;
import app.danki.core.deck.domain.entity.DeckEntity;
import app.danki.core.deck.domain.entity.NoteEntity;
import app.danki.core.deck.domain.type.CardTemplate;
import app.danki.core.support.PostgresIntegrationTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class NoteRepositoryDataJpaTest extends PostgresIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Autowired
    DeckRepository deckRepository;

    @Autowired
    NoteRepository noteRepository;

    @Autowired
    CardRepository cardRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    DeckEntity deck;

    @BeforeEach
    void setup() {
        deck = deckRepository.saveAndFlush(new DeckEntity("notes-" + UUID.randomUUID(), false,
                MAPPER.createObjectNode(), Instant.now()));
    }

    @Test
    void notesArePagedInCreationOrder() {
        Instant base = Instant.parse("2024-03-01T10:00:00Z");
        noteRepository.saveAndFlush(new NoteEntity(deck.getDeckId(), "b", "2", null, base.plusSeconds(5)));
        noteRepository.saveAndFlush(new NoteEntity(deck.getDeckId(), "a", "1",
                MAPPER.createObjectNode().put("source", "bundle"), base));

        var page = noteRepository.findByDeckIdOrderByCreatedAtAsc(deck.getDeckId(), PageRequest.of(0, 10));

        assertThat(page.getContent()).extracting(NoteEntity::getFront).containsExactly("a", "b");
        assertThat(page.getContent().get(0).getMeta().path("source").asText()).isEqualTo("bundle");
        assertThat(noteRepository.countByDeckId(deck.getDeckId())).isEqualTo(2);
        assertThat(noteRepository.existsByDeckIdAndFrontAndBack(deck.getDeckId(), "a", "1")).isTrue();
        assertThat(noteRepository.existsByDeckIdAndFrontAndBack(deck.getDeckId(), "a", "2")).isFalse();
    }

    @Test
    void deletingDeckCascadesToNotesAndCards() {
        NoteEntity note = noteRepository.saveAndFlush(new NoteEntity(deck.getDeckId(), "x", "y", null, Instant.now()));
        cardRepository.saveAndFlush(new CardEntity(note.getNoteId(), CardTemplate.FRONT_TO_BACK, 100L));
        cardRepository.saveAndFlush(new CardEntity(note.getNoteId(), CardTemplate.BACK_TO_FRONT, 100L));
        assertThat(cardRepository.findByNoteId(note.getNoteId())).hasSize(2);

        jdbcTemplate.update("delete from danki.decks where deck_id = ?", deck.getDeckId());

        Integer notes = jdbcTemplate.queryForObject(
                "select count(*) from danki.notes where deck_id = ?", Integer.class, deck.getDeckId());
        Integer cards = jdbcTemplate.queryForObject(
                "select count(*) from danki.cards where note_id = ?", Integer.class, note.getNoteId());
        assertThat(notes).isZero();
        assertThat(cards).isZero();
    }

    @Test
    void sameFrontAndBackInOneDeckIsRejected() {
        noteRepository.saveAndFlush(new NoteEntity(deck.getDeckId(), "hund", "dog", null, Instant.now()));

        assertThatThrownBy(() -> noteRepository.saveAndFlush(
                new NoteEntity(deck.getDeckId(), "hund", "dog", null, Instant.now())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
