package uk.gegc.adaptive.features.priority.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.priority.domain.model.CategoryPracticePriority;

import java.util.List;
import java.util.UUID;

@Repository
public interface CategoryPracticePriorityRepository extends JpaRepository<CategoryPracticePriority, UUID> {

    List<CategoryPracticePriority> findAllByLearnerId(UUID learnerId);

    @Query("""
            SELECT p FROM CategoryPracticePriority p
            JOIN FETCH p.category c
            WHERE p.learnerId = :learnerId
            ORDER BY p.priorityWeight DESC, c.id ASC
            """)
    List<CategoryPracticePriority> findTopByLearnerId(@Param("learnerId") UUID learnerId, Pageable pageable);
}
