package app.danki.core.review.repository;

import app.danki.core.review.entity.DailyStudyCounterEntity;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface DailyStudyCounterRepository extends Repository<DailyStudyCounterEntity, DailyStudyCounterEntity.DailyStudyCounterId> {

    List<DailyStudyCounterEntity> findByDeckIdInAndStudyDate(Collection<UUID> deckIds, LocalDate studyDate);

    @Modifying
    @Query(value = """
            insert into danki.deck_daily_counters (
                deck_id,
                study_date,
                new_studied,
                review_studied
            ) values (
                :deckId,
                :studyDate,
                :newDelta,
                :reviewDelta
            )
            on conflict (deck_id, study_date)
            do update set
                new_studied = danki.deck_daily_counters.new_studied + excluded.new_studied,
                review_studied = danki.deck_daily_counters.review_studied + excluded.review_studied
            """, nativeQuery = true)
    int increment(@Param("deckId") UUID deckId,
                  @Param("studyDate") LocalDate studyDate,
                  @Param("newDelta") int newDelta,
                  @Param("reviewDelta") int reviewDelta);
}
