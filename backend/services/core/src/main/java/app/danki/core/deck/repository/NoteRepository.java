package app.danki.core.deck.repository;

import app.danki.core.deck.domain.entity.NoteEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface NoteRepository extends JpaRepository<NoteEntity, UUID> {

    boolean existsByDeckIdAndFrontAndBack(UUID deckId, String front, String back);

    Page<NoteEntity> findByDeckIdOrderByCreatedAtAsc(UUID deckId, Pageable pageable);

    long countByDeckId(UUID deckId);
}
