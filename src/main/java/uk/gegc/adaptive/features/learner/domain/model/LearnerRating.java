package uk.gegc.adaptive.features.learner.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Overall skill estimate of one learner. The K-factor is derived from {@code gamesPlayed}
 * and never stored.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "learner_ratings",
        uniqueConstraints = @UniqueConstraint(name = "uk_learner_ratings_learner", columnNames = "learner_id")
)
public class LearnerRating {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "learner_rating_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "games_played", nullable = false)
    private int gamesPlayed;

    @Column(name = "wins", nullable = false)
    private int wins;

    @Column(name = "losses", nullable = false)
    private int losses;

    // positive: consecutive correct answers, negative: consecutive misses
    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "best_rating", nullable = false)
    private int bestRating;

    @Column(name = "confidence_level", nullable = false)
    private double confidenceLevel;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public static LearnerRating baseline(UUID learnerId, int baselineRating, Instant now) {
        LearnerRating rating = new LearnerRating();
        rating.setLearnerId(learnerId);
        rating.setRating(baselineRating);
        rating.setBestRating(baselineRating);
        rating.setCreatedAt(now);
        rating.setUpdatedAt(now);
        return rating;
    }
}
