package app.danki.core.deck.repository;

import app.danki.core.deck.domain.entity.DeckEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeckRepository extends JpaRepository<DeckEntity, UUID> {

    boolean existsByNameIgnoreCase(String name);

    List<DeckEntity> findAllByOrderByBuiltinDescNameAsc();
}
