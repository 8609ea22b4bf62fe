package uk.gegc.adaptive.features.categoryrating.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.adaptive.features.category.domain.model.Category;

import java.time.Instant;
import java.util.UUID;

/**
 * Skill estimate of one learner in one category. Created lazily on the first settled attempt
 * in the category.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "category_micro_ratings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_category_micro_ratings_learner_category",
                columnNames = {"learner_id", "category_id"}
        )
)
public class CategoryMicroRating {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "micro_rating_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", referencedColumnName = "category_id", nullable = false, updatable = false)
    private Category category;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "correct_attempts", nullable = false)
    private int correctAttempts;

    @Column(name = "success_rate", nullable = false)
    private double successRate;

    @Column(name = "recent_accuracy", nullable = false)
    private double recentAccuracy;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend", nullable = false, length = 20)
    private PerformanceTrend trend = PerformanceTrend.STABLE;

    @Column(name = "questions_mastered", nullable = false)
    private int questionsMastered;

    @Column(name = "priority_score", nullable = false)
    private double priorityScore;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    public static CategoryMicroRating baseline(UUID learnerId, Category category, int baselineRating) {
        CategoryMicroRating microRating = new CategoryMicroRating();
        microRating.setLearnerId(learnerId);
        microRating.setCategory(category);
        microRating.setRating(baselineRating);
        return microRating;
    }
}
