package uk.gegc.adaptive.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "quiz_sessions")
public class QuizSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", nullable = false, length = 20)
    private SessionType sessionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "paused_at")
    private Instant pausedAt;

    @Column(name = "resumed_at")
    private Instant resumedAt;

    @Column(name = "total_pause_seconds", nullable = false)
    private long totalPauseSeconds;

    @Column(name = "requested_question_count", nullable = false)
    private int requestedQuestionCount;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Column(name = "correct_answers", nullable = false)
    private int correctAnswers;

    @Column(name = "incorrect_answers", nullable = false)
    private int incorrectAnswers;

    @Column(name = "skipped_answers", nullable = false)
    private int skippedAnswers;

    @Column(name = "accuracy_percentage", precision = 5, scale = 2)
    private BigDecimal accuracyPercentage;

    @Column(name = "average_time_per_question", precision = 10, scale = 2)
    private BigDecimal averageTimePerQuestion;

    @Column(name = "total_time_spent_seconds", nullable = false)
    private long totalTimeSpentSeconds;

    @Column(name = "rating_change", nullable = false)
    private int ratingChange;

    @Version
    @Column(name = "version")
    private Long version;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<SessionQuestion> questions = new ArrayList<>();

    /**
     * Closes an open pause at {@code now}, adding its length to the accumulated pause time.
     */
    public void closePause(Instant now) {
        if (status == SessionStatus.PAUSED && pausedAt != null) {
            totalPauseSeconds += Math.max(0, Duration.between(pausedAt, now).getSeconds());
            resumedAt = now;
        }
    }

    public void addQuestion(SessionQuestion question) {
        question.setSession(this);
        questions.add(question);
    }
}
