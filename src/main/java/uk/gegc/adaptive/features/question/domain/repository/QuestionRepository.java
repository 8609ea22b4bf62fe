package uk.gegc.adaptive.features.question.domain.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.question.domain.model.Question;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID>, JpaSpecificationExecutor<Question> {

    /**
     * Locks the given questions for a rating update. Rows are locked in ascending id order so that
     * concurrent settlements touching overlapping questions cannot deadlock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT q FROM Question q WHERE q.id IN :ids ORDER BY q.id ASC")
    List<Question> findAllByIdInForUpdate(@Param("ids") Collection<UUID> ids);

    @Query("""
            SELECT COUNT(q) FROM Question q
            JOIN q.categories c
            WHERE c.id = :categoryId AND q.active = true
            """)
    long countActiveByCategoryId(@Param("categoryId") UUID categoryId);
}
