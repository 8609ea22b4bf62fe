package uk.gegc.adaptive.features.priority.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.adaptive.features.category.domain.model.Category;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached practice weight of a category for a learner. Fully derivable from micro-ratings and
 * question history, so it may be dropped and recomputed at any time.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "category_practice_priorities",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_category_practice_priorities_learner_category",
                columnNames = {"learner_id", "category_id"}
        )
)
public class CategoryPracticePriority {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "priority_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", referencedColumnName = "category_id", nullable = false, updatable = false)
    private Category category;

    @Column(name = "priority_weight", nullable = false)
    private double priorityWeight;

    @Column(name = "questions_needed", nullable = false)
    private int questionsNeeded;

    @Column(name = "rating_deficit", nullable = false)
    private int ratingDeficit;

    @Column(name = "accuracy_deficit", nullable = false)
    private double accuracyDeficit;

    @Column(name = "next_practice_recommended_at")
    private Instant nextPracticeRecommendedAt;

    @Column(name = "last_calculated_at", nullable = false)
    private Instant lastCalculatedAt;
}
