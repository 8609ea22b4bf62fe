package uk.gegc.adaptive.features.categoryrating.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptive.features.categoryrating.domain.model.CategoryMicroRating;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CategoryMicroRatingRepository extends JpaRepository<CategoryMicroRating, UUID> {

    @Query("""
            SELECT m FROM CategoryMicroRating m
            JOIN FETCH m.category
            WHERE m.learnerId = :learnerId
            """)
    List<CategoryMicroRating> findAllByLearnerIdWithCategory(@Param("learnerId") UUID learnerId);

    Optional<CategoryMicroRating> findByLearnerIdAndCategory_Id(UUID learnerId, UUID categoryId);

    /**
     * Learners who answered in the category, highest micro-rating first.
     */
    @Query("""
            SELECT m FROM CategoryMicroRating m
            WHERE m.category.id = :categoryId AND m.attempts > 0
            ORDER BY m.rating DESC, m.learnerId ASC
            """)
    List<CategoryMicroRating> findCategoryLeaderboard(@Param("categoryId") UUID categoryId, Pageable pageable);

    @Query("""
            SELECT COUNT(m) FROM CategoryMicroRating m
            WHERE m.category.id = :categoryId AND m.attempts > 0 AND m.rating > :rating
            """)
    long countRankedAboveInCategory(@Param("categoryId") UUID categoryId, @Param("rating") int rating);

    @Query("SELECT COUNT(m) FROM CategoryMicroRating m WHERE m.category.id = :categoryId AND m.attempts > 0")
    long countRankedInCategory(@Param("categoryId") UUID categoryId);
}
