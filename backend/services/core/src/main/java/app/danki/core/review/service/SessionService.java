package app.danki.core.review.service;

import app.danki.core.review.api.CardState;
import app.danki.core.review.api.DeckSchedulingConfig;
import app.danki.core.review.api.DeckSchedulingPort;
import app.danki.core.review.api.InterleaveMode;
import app.danki.core.review.controller.dto.SessionCountsResponse;
import app.danki.core.review.exception.InvalidRequestException;
import app.danki.core.review.repository.ReviewCardRepository;
import app.danki.core.review.service.StudyCounterService.StudyCounts;
import app.danki.core.review.session.SessionBuckets;
import app.danki.core.review.session.SessionCard;
import app.danki.core.review.session.SessionQueueBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Selects the cards of a study session. Daily allowances are computed once
 * per call from the deck preferences and today's counters; the ordering is
 * delegated to {@link SessionQueueBuilder}.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final Set<CardState> LEARNING_STATES = EnumSet.of(CardState.LEARNING, CardState.RELEARNING);
    private static final Set<CardState> REVIEW_STATES = EnumSet.of(CardState.REVIEW);

    private static final Comparator<SessionCard> BY_DUE = Comparator.comparingLong(SessionCard::dueAt);

    private final ReviewCardRepository cardRepo;
    private final DeckSchedulingPort deckSchedulingPort;
    private final StudyCounterService counterService;
    private final StudyDayClock studyDayClock;
    private final SessionQueueBuilder queueBuilder;

    public SessionService(ReviewCardRepository cardRepo,
                          DeckSchedulingPort deckSchedulingPort,
                          StudyCounterService counterService,
                          StudyDayClock studyDayClock,
                          SessionQueueBuilder queueBuilder) {
        this.cardRepo = cardRepo;
        this.deckSchedulingPort = deckSchedulingPort;
        this.counterService = counterService;
        this.studyDayClock = studyDayClock;
        this.queueBuilder = queueBuilder;
    }

    public List<SessionCard> buildSession(List<UUID> deckIds, Long now, Integer maxNew, Integer maxReview) {
        return buildSession(deckIds, now, maxNew, maxReview, null);
    }

    /**
     * @param maxNew    optional cap on new cards across all decks
     * @param maxReview optional cap on review cards across all decks
     * @param random    jitter source; seeded from {@code now} when null
     */
    @Transactional(readOnly = true)
    public List<SessionCard> buildSession(List<UUID> deckIds, Long now, Integer maxNew, Integer maxReview, Random random) {
        requireNonNegative("maxNew", maxNew);
        requireNonNegative("maxReview", maxReview);
        if (deckIds == null || deckIds.isEmpty()) {
            return List.of();
        }

        long at = resolveNow(now);
        List<DeckSchedulingConfig> configs = deckSchedulingPort.getDeckConfigs(distinct(deckIds));
        SessionBuckets buckets = select(configs, at, maxNew, maxReview);

        InterleaveMode mode = configs.get(0).interleave();
        Random jitter = random != null ? random : new Random(at);
        List<SessionCard> queue = queueBuilder.build(buckets, mode, jitter);

        log.debug("Built session for decks {}: {} cards ({} learning, {} review, {} new)",
                configs.stream().map(DeckSchedulingConfig::deckId).toList(), queue.size(),
                buckets.learning().size(), buckets.review().size(), buckets.fresh().size());
        return queue;
    }

    /**
     * Cards a session built now would show, per state. Runs the same
     * selection as {@link #buildSession}, so limits and one-card-per-note
     * apply to the counts too.
     */
    @Transactional(readOnly = true)
    public SessionCountsResponse counts(List<UUID> deckIds, Long now) {
        if (deckIds == null || deckIds.isEmpty()) {
            return SessionCountsResponse.of(0, 0, 0);
        }

        long at = resolveNow(now);
        List<DeckSchedulingConfig> configs = deckSchedulingPort.getDeckConfigs(distinct(deckIds));
        SessionBuckets buckets = select(configs, at, null, null);
        return SessionCountsResponse.of(buckets.fresh().size(), buckets.learning().size(), buckets.review().size());
    }

    /**
     * Fills the three buckets under the daily allowances. A note already
     * represented (learning first, then review, then new) is skipped while
     * filling, so its siblings never take up a slot of the allowance.
     */
    private SessionBuckets select(List<DeckSchedulingConfig> configs, long at, Integer maxNew, Integer maxReview) {
        List<Allowance> allowances = allowances(configs, at);
        List<UUID> ids = configs.stream().map(DeckSchedulingConfig::deckId).toList();

        Set<UUID> seenNotes = new HashSet<>();
        List<SessionCard> learning = takeFirstPerNote(
                cardRepo.findDueCandidates(ids, LEARNING_STATES, at, Pageable.unpaged()), Integer.MAX_VALUE, seenNotes);

        int newBudget = maxNew == null ? Integer.MAX_VALUE : maxNew;
        int reviewBudget = maxReview == null ? Integer.MAX_VALUE : maxReview;
        List<SessionCard> review = new ArrayList<>();
        List<SessionCard> fresh = new ArrayList<>();

        for (Allowance allowance : allowances) {
            int reviewLimit = Math.min(allowance.review(), reviewBudget);
            if (reviewLimit > 0) {
                List<SessionCard> due = fill(page -> cardRepo.findDueCandidates(
                        List.of(allowance.deckId()), REVIEW_STATES, at, page), reviewLimit, seenNotes);
                review.addAll(due);
                reviewBudget -= due.size();
            }
        }
        for (Allowance allowance : allowances) {
            int newLimit = Math.min(allowance.fresh(), newBudget);
            if (newLimit > 0) {
                List<SessionCard> added = fill(page -> cardRepo.findNewCandidates(
                        allowance.deckId(), at, page), newLimit, seenNotes);
                fresh.addAll(added);
                newBudget -= added.size();
            }
        }

        review.sort(BY_DUE);
        fresh.sort(BY_DUE);
        return new SessionBuckets(learning, review, fresh);
    }

    /**
     * Pages through candidates until {@code limit} cards of unseen notes are
     * taken or the candidates run out.
     */
    private static List<SessionCard> fill(Function<Pageable, List<SessionCard>> query, int limit, Set<UUID> seenNotes) {
        List<SessionCard> taken = new ArrayList<>();
        int pageNumber = 0;
        while (taken.size() < limit) {
            List<SessionCard> page = query.apply(PageRequest.of(pageNumber++, limit));
            taken.addAll(takeFirstPerNote(page, limit - taken.size(), seenNotes));
            if (page.size() < limit) {
                break;
            }
        }
        return taken;
    }

    private static List<SessionCard> takeFirstPerNote(List<SessionCard> candidates, int limit, Set<UUID> seenNotes) {
        List<SessionCard> taken = new ArrayList<>();
        for (SessionCard card : candidates) {
            if (taken.size() >= limit) {
                break;
            }
            if (seenNotes.add(card.noteId())) {
                taken.add(card);
            }
        }
        return taken;
    }

    private List<Allowance> allowances(List<DeckSchedulingConfig> configs, long at) {
        LocalDate studyDate = studyDayClock.studyDate(at);
        Map<UUID, StudyCounts> studied = counterService.countsFor(
                configs.stream().map(DeckSchedulingConfig::deckId).toList(), studyDate);

        List<Allowance> out = new ArrayList<>(configs.size());
        for (DeckSchedulingConfig config : configs) {
            StudyCounts counts = studied.getOrDefault(config.deckId(), StudyCounts.ZERO);
            out.add(new Allowance(
                    config.deckId(),
                    Math.max(0, config.newPerDay() - counts.newStudied()),
                    Math.max(0, config.reviewPerDay() - counts.reviewStudied())
            ));
        }
        return out;
    }

    private static List<UUID> distinct(List<UUID> deckIds) {
        return deckIds.stream().distinct().toList();
    }

    private static void requireNonNegative(String name, Integer value) {
        if (value != null && value < 0) {
            throw new InvalidRequestException(name + " must not be negative: " + value);
        }
    }

    private static long resolveNow(Long now) {
        return now != null ? now : Instant.now().getEpochSecond();
    }

    private record Allowance(UUID deckId, int fresh, int review) {
    }
}
