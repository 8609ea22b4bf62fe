package uk.gegc.adaptive.features.learner.domain.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LearnerRatingRepository extends JpaRepository<LearnerRating, UUID> {

    Optional<LearnerRating> findByLearnerId(UUID learnerId);

    boolean existsByLearnerId(UUID learnerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT r FROM LearnerRating r WHERE r.learnerId = :learnerId")
    Optional<LearnerRating> findByLearnerIdForUpdate(@Param("learnerId") UUID learnerId);

    /**
     * Learners with at least one settled answer, highest rating first.
     */
    @Query("""
            SELECT r FROM LearnerRating r
            WHERE r.gamesPlayed > 0
            ORDER BY r.rating DESC, r.learnerId ASC
            """)
    List<LearnerRating> findLeaderboard(Pageable pageable);

    @Query("SELECT COUNT(r) FROM LearnerRating r WHERE r.gamesPlayed > 0 AND r.rating > :rating")
    long countRankedAbove(@Param("rating") int rating);

    @Query("SELECT COUNT(r) FROM LearnerRating r WHERE r.gamesPlayed > 0")
    long countRanked();
}
