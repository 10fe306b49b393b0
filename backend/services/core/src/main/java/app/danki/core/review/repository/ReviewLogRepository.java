package app.danki.core.review.repository;

import app.danki.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, Long> {

    List<ReviewLogEntity> findByCardIdOrderByReviewedAtAscIdAsc(UUID cardId);

    long countByCardId(UUID cardId);
}
