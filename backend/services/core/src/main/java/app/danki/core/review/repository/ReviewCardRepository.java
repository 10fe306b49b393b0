package app.danki.core.review.repository;

import app.danki.core.review.api.CardState;
import app.danki.core.review.entity.ReviewCardEntity;
import app.danki.core.review.session.SessionCard;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReviewCardRepository extends JpaRepository<ReviewCardEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ReviewCardEntity c where c.cardId = :cardId")
    Optional<ReviewCardEntity> findByIdForUpdate(@Param("cardId") UUID cardId);

    @Query("""
            select n.deckId
            from ReviewCardEntity c
            join ReviewNoteEntity n on n.noteId = c.noteId
            where c.cardId = :cardId
            """)
    Optional<UUID> findDeckIdByCardId(@Param("cardId") UUID cardId);

    @Query("""
            select new app.danki.core.review.session.SessionCard(
                c.cardId, c.noteId, n.deckId, n.front, n.back, c.state, c.template, c.dueAt
            )
            from ReviewCardEntity c
            join ReviewNoteEntity n on n.noteId = c.noteId
            where n.deckId in :deckIds
              and c.state in :states
              and c.dueAt <= :now
              and (c.buriedUntil is null or c.buriedUntil <= :now)
            order by c.dueAt asc, c.cardId asc
            """)
    List<SessionCard> findDueCandidates(@Param("deckIds") Collection<UUID> deckIds,
                                        @Param("states") Collection<CardState> states,
                                        @Param("now") long now,
                                        Pageable pageable);

    @Query("""
            select new app.danki.core.review.session.SessionCard(
                c.cardId, c.noteId, n.deckId, n.front, n.back, c.state, c.template, c.dueAt
            )
            from ReviewCardEntity c
            join ReviewNoteEntity n on n.noteId = c.noteId
            where n.deckId = :deckId
              and c.state = app.danki.core.review.api.CardState.NEW
              and (c.buriedUntil is null or c.buriedUntil <= :now)
            order by c.dueAt asc, n.createdAt asc, c.template asc
            """)
    List<SessionCard> findNewCandidates(@Param("deckId") UUID deckId,
                                        @Param("now") long now,
                                        Pageable pageable);
}
