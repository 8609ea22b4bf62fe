package uk.gegc.adaptive.features.session.domain.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.session.domain.model.QuizSession;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuizSessionRepository extends JpaRepository<QuizSession, UUID> {

    Optional<QuizSession> findByIdAndLearnerId(UUID id, UUID learnerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT s FROM QuizSession s WHERE s.id = :id AND s.learnerId = :learnerId")
    Optional<QuizSession> findByIdAndLearnerIdForUpdate(@Param("id") UUID id, @Param("learnerId") UUID learnerId);

    /**
     * Ids of the learner's most recent sessions, newest first.
     */
    @Query("""
            SELECT s.id FROM QuizSession s
            WHERE s.learnerId = :learnerId
            ORDER BY s.startedAt DESC, s.id DESC
            """)
    List<UUID> findRecentSessionIds(@Param("learnerId") UUID learnerId, Pageable pageable);
}
