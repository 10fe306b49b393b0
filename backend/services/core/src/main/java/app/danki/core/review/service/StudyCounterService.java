package app.danki.core.review.service;

import app.danki.core.review.api.CardState;
import app.danki.core.review.entity.DailyStudyCounterEntity;
import app.danki.core.review.repository.DailyStudyCounterRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per deck and study day: how many new and review cards were answered.
 */
@Service
public class StudyCounterService {

    private final DailyStudyCounterRepository counterRepository;

    public StudyCounterService(DailyStudyCounterRepository counterRepository) {
        this.counterRepository = counterRepository;
    }

    @Transactional(readOnly = true)
    public Map<UUID, StudyCounts> countsFor(Collection<UUID> deckIds, LocalDate studyDate) {
        Map<UUID, StudyCounts> result = new HashMap<>();
        if (deckIds == null || deckIds.isEmpty()) {
            return result;
        }
        for (DailyStudyCounterEntity row : counterRepository.findByDeckIdInAndStudyDate(deckIds, studyDate)) {
            result.put(row.getDeckId(), new StudyCounts(row.getNewStudied(), row.getReviewStudied()));
        }
        return result;
    }

    /**
     * A card answered while NEW counts against the new allowance, anything
     * else against the review allowance.
     */
    @Transactional
    public void recordAnswer(UUID deckId, LocalDate studyDate, CardState priorState) {
        boolean fresh = priorState == CardState.NEW;
        counterRepository.increment(deckId, studyDate, fresh ? 1 : 0, fresh ? 0 : 1);
    }

    public record StudyCounts(int newStudied, int reviewStudied) {
        public static final StudyCounts ZERO = new StudyCounts(0, 0);
    }
}
