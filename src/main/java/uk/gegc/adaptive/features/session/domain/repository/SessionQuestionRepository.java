package uk.gegc.adaptive.features.session.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;

import java.util.List;
import java.util.UUID;

@Repository
public interface SessionQuestionRepository extends JpaRepository<SessionQuestion, UUID> {

    @Query("""
            SELECT sq FROM SessionQuestion sq
            JOIN FETCH sq.question
            JOIN FETCH sq.category
            WHERE sq.session.id = :sessionId
            ORDER BY sq.position ASC
            """)
    List<SessionQuestion> findAllBySessionIdOrdered(@Param("sessionId") UUID sessionId);

    /**
     * Assignments without their questions, which settlement loads separately under a row lock.
     */
    @Query("""
            SELECT sq FROM SessionQuestion sq
            JOIN FETCH sq.category
            WHERE sq.session.id = :sessionId
            ORDER BY sq.position ASC
            """)
    List<SessionQuestion> findAllForSettlement(@Param("sessionId") UUID sessionId);
}
