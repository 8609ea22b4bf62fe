package uk.gegc.adaptive.features.session.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.session.domain.model.QuestionAttempt;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionAttemptRepository extends JpaRepository<QuestionAttempt, UUID> {

    /**
     * Correctness flags of the learner's latest attempts in a category, newest first.
     */
    @Query("""
            SELECT a.correct FROM QuestionAttempt a
            WHERE a.learnerId = :learnerId AND a.categoryId = :categoryId
            ORDER BY a.answeredAt DESC, a.position DESC
            """)
    List<Boolean> findRecentOutcomes(@Param("learnerId") UUID learnerId,
                                     @Param("categoryId") UUID categoryId,
                                     Pageable pageable);

    List<QuestionAttempt> findAllBySessionIdOrderByPositionAsc(UUID sessionId);

    /**
     * Latest answers of the learner, newest first; carries the rating after each answer.
     */
    List<QuestionAttempt> findAllByLearnerIdOrderByAnsweredAtDescPositionDesc(UUID learnerId, Pageable pageable);

    @Query("""
            SELECT COUNT(a) AS totalAnswered,
                   SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END) AS totalCorrect,
                   AVG(a.timeSpentSeconds) AS averageTimeSeconds,
                   MIN(a.answeredAt) AS firstAnsweredAt,
                   MAX(a.answeredAt) AS lastAnsweredAt
            FROM QuestionAttempt a
            WHERE a.learnerId = :learnerId
            """)
    AttemptTotalsProjection summarizeByLearnerId(@Param("learnerId") UUID learnerId);

    @Query("""
            SELECT a.categoryId AS categoryId,
                   COUNT(a) AS attempts,
                   SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END) AS correct,
                   AVG(a.timeSpentSeconds) AS averageTimeSeconds
            FROM QuestionAttempt a
            WHERE a.learnerId = :learnerId
            GROUP BY a.categoryId
            """)
    List<CategoryAttemptStatsProjection> summarizeByCategory(@Param("learnerId") UUID learnerId);
}
