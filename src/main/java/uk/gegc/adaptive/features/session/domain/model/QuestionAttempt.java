package uk.gegc.adaptive.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One settled answer. Written once by settlement and never updated.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "question_attempts")
public class QuestionAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "attempt_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Column(name = "question_id", nullable = false, updatable = false)
    private UUID questionId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "submitted_answer", length = 1000)
    private String submittedAnswer;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "is_skipped", nullable = false)
    private boolean skipped;

    @Column(name = "time_spent_seconds", nullable = false)
    private int timeSpentSeconds;

    @Column(name = "question_rating_at_selection", nullable = false)
    private int questionRatingAtSelection;

    @Column(name = "learner_rating_before", nullable = false)
    private int learnerRatingBefore;

    @Column(name = "learner_rating_after", nullable = false)
    private int learnerRatingAfter;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "answered_at", nullable = false)
    private Instant answeredAt;
}
