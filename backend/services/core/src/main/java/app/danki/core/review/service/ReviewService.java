package app.danki.core.review.service;

import app.danki.core.review.algorithm.CardSnapshot;
import app.danki.core.review.algorithm.CardStateMachine;
import app.danki.core.review.algorithm.Transition;
import app.danki.core.review.api.CardState;
import app.danki.core.review.api.DeckSchedulingConfig;
import app.danki.core.review.api.DeckSchedulingPort;
import app.danki.core.review.api.LeechHandler;
import app.danki.core.review.controller.dto.ReviewAnswerResponse;
import app.danki.core.review.domain.Rating;
import app.danki.core.review.entity.ReviewCardEntity;
import app.danki.core.review.exception.CardSuspendedException;
import app.danki.core.review.exception.InvalidRequestException;
import app.danki.core.review.exception.UnknownCardException;
import app.danki.core.review.ledger.ReviewLedgerWriter;
import app.danki.core.review.repository.ReviewCardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewCardRepository cardRepo;
    private final DeckSchedulingPort deckSchedulingPort;
    private final CardStateMachine stateMachine;
    private final ReviewLedgerWriter ledgerWriter;
    private final StudyCounterService counterService;
    private final StudyDayClock studyDayClock;
    private final List<LeechHandler> leechHandlers;

    public ReviewService(ReviewCardRepository cardRepo,
                         DeckSchedulingPort deckSchedulingPort,
                         CardStateMachine stateMachine,
                         ReviewLedgerWriter ledgerWriter,
                         StudyCounterService counterService,
                         StudyDayClock studyDayClock,
                         List<LeechHandler> leechHandlers) {
        this.cardRepo = cardRepo;
        this.deckSchedulingPort = deckSchedulingPort;
        this.stateMachine = stateMachine;
        this.ledgerWriter = ledgerWriter;
        this.counterService = counterService;
        this.studyDayClock = studyDayClock;
        this.leechHandlers = leechHandlers == null ? List.of() : List.copyOf(leechHandlers);
    }

    @Transactional
    public ReviewAnswerResponse review(UUID cardId, int ratingCode, long answerDurationMs, Long now) {
        return review(cardId, Rating.fromCode(ratingCode), answerDurationMs, now);
    }

    /**
     * Applies a graded answer: the event is written to the ledger, the card's
     * scheduling fields and the day's study counters are updated. Everything
     * happens in one transaction.
     */
    @Transactional
    public ReviewAnswerResponse review(UUID cardId, Rating rating, long answerDurationMs, Long now) {
        if (rating == null) {
            throw new InvalidRequestException("Rating is required");
        }
        if (answerDurationMs < 0) {
            throw new InvalidRequestException("Answer duration must not be negative: " + answerDurationMs);
        }
        long at = resolveNow(now);

        ReviewCardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new UnknownCardException(cardId));
        if (card.getState() == CardState.SUSPENDED) {
            throw new CardSuspendedException(cardId);
        }

        UUID deckId = cardRepo.findDeckIdByCardId(cardId)
                .orElseThrow(() -> new IllegalStateException("Card has no owning deck: " + cardId));
        DeckSchedulingConfig config = deckSchedulingPort.getDeckConfig(deckId);

        CardSnapshot prior = card.toSnapshot();
        Transition transition = stateMachine.apply(prior, rating, config.learningStepsMinutes(), at);
        CardSnapshot next = transition.after();

        ledgerWriter.record(cardId, rating, answerDurationMs, prior, next, at);

        card.applySnapshot(next);
        cardRepo.save(card);

        counterService.recordAnswer(deckId, studyDayClock.studyDate(at), prior.state());

        log.debug("Card {} answered {}: {} -> {}, due={}, interval={}d, ease={}",
                cardId, rating, prior.state(), next.state(), next.dueAt(), next.intervalDays(), next.ease());

        if (transition.leech()) {
            notifyLeech(cardId, deckId, next.lapses());
        }

        return new ReviewAnswerResponse(
                cardId,
                rating,
                next.state(),
                next.dueAt(),
                next.intervalDays(),
                next.ease(),
                next.lapses(),
                transition.leech()
        );
    }

    private void notifyLeech(UUID cardId, UUID deckId, int lapses) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatchLeech(cardId, deckId, lapses);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                dispatchLeech(cardId, deckId, lapses);
            }
        });
    }

    private void dispatchLeech(UUID cardId, UUID deckId, int lapses) {
        for (LeechHandler handler : leechHandlers) {
            try {
                handler.onLeech(cardId, deckId, lapses);
            } catch (RuntimeException ex) {
                log.warn("Leech handler {} failed for card {}", handler.getClass().getName(), cardId, ex);
            }
        }
    }

    /**
     * Removes a card from scheduling. Its state is remembered; no other field
     * changes. Suspending a suspended card does nothing.
     */
    @Transactional
    public void suspend(UUID cardId) {
        ReviewCardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new UnknownCardException(cardId));
        if (card.getState() == CardState.SUSPENDED) {
            return;
        }
        card.setSuspendedFrom(card.getState());
        card.setState(CardState.SUSPENDED);
        cardRepo.save(card);
        log.info("Suspended card {}", cardId);
    }

    @Transactional
    public void unsuspend(UUID cardId) {
        ReviewCardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new UnknownCardException(cardId));
        if (card.getState() != CardState.SUSPENDED) {
            return;
        }
        CardState restored = card.getSuspendedFrom();
        if (restored == null) {
            log.warn("Suspended card {} has no prior state, restoring as NEW", cardId);
            restored = CardState.NEW;
        }
        card.setState(restored);
        card.setSuspendedFrom(null);
        cardRepo.save(card);
        log.info("Unsuspended card {} to {}", cardId, restored);
    }

    /**
     * Hides a card from sessions until the next study-day rollover.
     */
    @Transactional
    public long bury(UUID cardId, Long now) {
        ReviewCardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new UnknownCardException(cardId));
        long until = studyDayClock.nextRollover(resolveNow(now));
        card.setBuriedUntil(until);
        cardRepo.save(card);
        return until;
    }

    @Transactional
    public void unbury(UUID cardId) {
        ReviewCardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new UnknownCardException(cardId));
        card.setBuriedUntil(null);
        cardRepo.save(card);
    }

    private static long resolveNow(Long now) {
        return now != null ? now : Instant.now().getEpochSecond();
    }
}
