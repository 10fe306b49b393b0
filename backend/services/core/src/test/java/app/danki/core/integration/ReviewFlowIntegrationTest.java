package app.danki.core.integration;

import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.domain.dto.DeckDTO;
import app.danki.core.deck.domain.dto.NoteDTO;
import app.danki.core.deck.domain.request.AddNoteRequest;
import app.danki.core.deck.domain.request.CreateDeckRequest;
import app.danki.core.deck.service.DeckService;
import app.danki.core.deck.service.NoteService;
import app.danki.core.review.api.CardState;
import app.danki.core.review.controller.dto.ReviewAnswerResponse;
import app.danki.core.review.domain.Rating;
import app.danki.core.review.ledger.ReviewEvent;
import app.danki.core.review.ledger.ReviewLedgerWriter;
import app.danki.core.review.service.ReviewService;
import app.danki.core.review.service.SessionService;
import app.danki.core.review.service.StudyDayClock;
import app.danki.core.review.session.SessionCard;
import app.danki.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ReviewFlowIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    DeckService deckService;

    @Autowired
    NoteService noteService;

    @Autowired
    SessionService sessionService;

    @Autowired
    ReviewService reviewService;

    @Autowired
    ReviewLedgerWriter ledgerWriter;

    @Autowired
    StudyDayClock clock;

    @Test
    void newCardGraduatesAndDailyNewLimitHolds() {
        DeckDTO deck = deckService.createDeck(new CreateDeckRequest("flow-" + UUID.randomUUID(), false,
                new DeckPreferences(1, 100, List.of(10, 1440), null, null)));
        NoteDTO first = noteService.addNote(deck.deckId(), new AddNoteRequest("hund", "dog", null));
        noteService.addNote(deck.deckId(), new AddNoteRequest("katze", "cat", null));

        // one minute into the next study day, so every later instant stays on a known day
        long t0 = clock.nextRollover(Instant.now().getEpochSecond()) + 60;

        List<SessionCard> session = sessionService.buildSession(List.of(deck.deckId()), t0, null, null);
        assertThat(session).hasSize(1);
        SessionCard card = session.get(0);
        assertThat(card.noteId()).isEqualTo(first.noteId());
        assertThat(card.state()).isEqualTo(CardState.NEW);

        ReviewAnswerResponse learning = reviewService.review(card.cardId(), Rating.GOT_IT, 1_500, t0);
        assertThat(learning.state()).isEqualTo(CardState.LEARNING);
        assertThat(learning.dueAt()).isEqualTo(t0 + 1440 * 60);

        // same day: the learning card is not due and the new allowance is spent
        assertThat(sessionService.buildSession(List.of(deck.deckId()), t0 + 60, null, null)).isEmpty();

        long t1 = learning.dueAt();
        ReviewAnswerResponse graduated = reviewService.review(card.cardId(), Rating.GOT_IT, 900, t1);
        assertThat(graduated.state()).isEqualTo(CardState.REVIEW);
        assertThat(graduated.intervalDays()).isEqualTo(6.0);
        assertThat(graduated.dueAt()).isEqualTo(t1 + 6 * 86_400L);

        List<ReviewEvent> history = ledgerWriter.history(card.cardId());
        assertThat(history).hasSize(2);
        assertThat(history).extracting(ReviewEvent::priorState).containsExactly(CardState.NEW, CardState.LEARNING);
        assertThat(history).extracting(ReviewEvent::nextState).containsExactly(CardState.LEARNING, CardState.REVIEW);
        assertThat(history.get(0).answerMs()).isEqualTo(1_500);

        // next study day: the second note's card becomes available
        List<SessionCard> nextDay = sessionService.buildSession(List.of(deck.deckId()), t1, null, null);
        assertThat(nextDay).hasSize(1);
        assertThat(nextDay.get(0).cardId()).isNotEqualTo(card.cardId());
    }

    @Test
    void suspendedCardsLeaveTheSessionAndComeBack() {
        DeckDTO deck = deckService.createDeck(new CreateDeckRequest("suspend-" + UUID.randomUUID(), false, null));
        noteService.addNote(deck.deckId(), new AddNoteRequest("eins", "one", null));
        long now = Instant.now().getEpochSecond() + 5;

        SessionCard card = sessionService.buildSession(List.of(deck.deckId()), now, null, null).get(0);

        reviewService.suspend(card.cardId());
        assertThat(sessionService.buildSession(List.of(deck.deckId()), now, null, null)).isEmpty();

        reviewService.unsuspend(card.cardId());
        assertThat(sessionService.buildSession(List.of(deck.deckId()), now, null, null))
                .extracting(SessionCard::cardId)
                .containsExactly(card.cardId());
    }
}
