package uk.gegc.adaptive.features.history.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.history.domain.model.QuestionHistoryEntry;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * History rows are matched to a category through the question's category tags, not through the
 * category it was first selected for.
 */
@Repository
public interface QuestionHistoryRepository extends JpaRepository<QuestionHistoryEntry, UUID> {

    List<QuestionHistoryEntry> findAllByLearnerIdAndQuestionIdIn(UUID learnerId, Collection<UUID> questionIds);

    @Query("""
            SELECT h FROM QuestionHistoryEntry h
            WHERE h.learnerId = :learnerId
              AND h.questionId IN (
                  SELECT q.id FROM Question q JOIN q.categories c WHERE c.id = :categoryId
              )
              AND h.queuePriority > 0
              AND h.retired = false
            """)
    List<QuestionHistoryEntry> findQueued(@Param("learnerId") UUID learnerId,
                                          @Param("categoryId") UUID categoryId);

    @Query("""
            SELECT h.questionId FROM QuestionHistoryEntry h
            WHERE h.learnerId = :learnerId
              AND h.questionId IN (
                  SELECT q.id FROM Question q JOIN q.categories c WHERE c.id = :categoryId
              )
              AND h.retired = true
            """)
    List<UUID> findRetiredQuestionIds(@Param("learnerId") UUID learnerId,
                                      @Param("categoryId") UUID categoryId);

    @Query("""
            SELECT h.questionId FROM QuestionHistoryEntry h
            WHERE h.learnerId = :learnerId
              AND h.questionId IN (
                  SELECT q.id FROM Question q JOIN q.categories c WHERE c.id = :categoryId
              )
              AND h.lastSessionId IN :sessionIds
            """)
    List<UUID> findQuestionIdsSeenInSessions(@Param("learnerId") UUID learnerId,
                                             @Param("categoryId") UUID categoryId,
                                             @Param("sessionIds") Collection<UUID> sessionIds);

    /**
     * Retired questions of the learner that are tagged to the category, wherever they were retired.
     */
    @Query("""
            SELECT COUNT(h) FROM QuestionHistoryEntry h
            WHERE h.learnerId = :learnerId
              AND h.retired = true
              AND h.questionId IN (
                  SELECT q.id FROM Question q JOIN q.categories c WHERE c.id = :categoryId
              )
            """)
    long countRetiredInCategory(@Param("learnerId") UUID learnerId,
                                @Param("categoryId") UUID categoryId);
}
