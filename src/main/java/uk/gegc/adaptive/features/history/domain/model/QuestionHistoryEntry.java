package uk.gegc.adaptive.features.history.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.adaptive.features.category.domain.model.Category;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-learner record of one question: how often it was seen and answered, whether it is retired
 * (answered correctly, no longer offered) and its review-queue priority (0 = not queued, 3 = most urgent).
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "question_history",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_question_history_learner_question",
                columnNames = {"learner_id", "question_id"}
        )
)
public class QuestionHistoryEntry {

    public static final int MAX_QUEUE_PRIORITY = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "history_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Column(name = "question_id", nullable = false, updatable = false)
    private UUID questionId;

    // category of the first selection; category-scoped queries match on the question's tags instead
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", referencedColumnName = "category_id", nullable = false)
    private Category category;

    @Column(name = "times_seen", nullable = false)
    private int timesSeen;

    @Column(name = "times_correct", nullable = false)
    private int timesCorrect;

    @Column(name = "times_incorrect", nullable = false)
    private int timesIncorrect;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "last_session_id")
    private UUID lastSessionId;

    @Column(name = "is_retired", nullable = false)
    private boolean retired;

    @Column(name = "retired_at")
    private Instant retiredAt;

    @Column(name = "queue_priority", nullable = false)
    private int queuePriority;

    public void recordCorrect(Instant answeredAt) {
        timesCorrect++;
        retired = true;
        retiredAt = answeredAt;
        queuePriority = 0;
    }

    public void recordIncorrect() {
        timesIncorrect++;
        retired = false;
        retiredAt = null;
        queuePriority = Math.min(MAX_QUEUE_PRIORITY, queuePriority + 1);
    }
}
