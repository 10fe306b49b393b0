package app.danki.core.review.ledger;

import app.danki.core.review.algorithm.CardSnapshot;
import app.danki.core.review.domain.Rating;
import app.danki.core.review.entity.ReviewLogEntity;
import app.danki.core.review.repository.ReviewLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of graded answers. Rows are never updated or deleted here.
 */
@Component
public class ReviewLedgerWriter {

    private static final Logger log = LoggerFactory.getLogger(ReviewLedgerWriter.class);

    private final ReviewLogRepository logRepository;

    public ReviewLedgerWriter(ReviewLogRepository logRepository) {
        this.logRepository = logRepository;
    }

    /**
     * Persists one event. Flushes immediately so a write failure surfaces
     * here and rolls back the caller's transaction.
     */
    @Transactional
    public ReviewEvent record(UUID cardId,
                              Rating rating,
                              long answerDurationMs,
                              CardSnapshot prior,
                              CardSnapshot posterior,
                              long timestamp) {
        ReviewLogEntity entity = new ReviewLogEntity(
                cardId,
                timestamp,
                (short) rating.code(),
                answerDurationMs,
                prior.state(),
                prior.intervalDays(),
                posterior.intervalDays(),
                posterior.state(),
                prior.ease(),
                posterior.ease()
        );
        ReviewLogEntity saved = logRepository.saveAndFlush(entity);
        log.debug("Recorded review card={} rating={} {} -> {}", cardId, rating, prior.state(), posterior.state());
        return toEvent(saved);
    }

    @Transactional(readOnly = true)
    public List<ReviewEvent> history(UUID cardId) {
        return logRepository.findByCardIdOrderByReviewedAtAscIdAsc(cardId).stream()
                .map(ReviewLedgerWriter::toEvent)
                .toList();
    }

    private static ReviewEvent toEvent(ReviewLogEntity e) {
        return new ReviewEvent(
                e.getId(),
                e.getCardId(),
                e.getReviewedAt(),
                e.getRating(),
                e.getAnswerMs(),
                e.getPriorState(),
                e.getPriorIntervalDays(),
                e.getNextIntervalDays(),
                e.getNextState(),
                e.getPriorEase(),
                e.getNextEase()
        );
    }
}
