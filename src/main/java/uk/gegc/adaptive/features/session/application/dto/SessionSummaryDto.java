package uk.gegc.adaptive.features.session.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "SessionSummaryDto", description = "Stored statistics of a quiz session and its settled answers")
public record SessionSummaryDto(
        @Schema(description = "Session ID")
        UUID sessionId,
        @Schema(description = "Session type", example = "PRACTICE")
        SessionType sessionType,
        @Schema(description = "Current status", example = "COMPLETED")
        SessionStatus status,
        @Schema(description = "Start time (UTC)")
        Instant startedAt,
        @Schema(description = "End time (UTC)")
        Instant endedAt,
        @Schema(description = "Accumulated pause duration in seconds", example = "0")
        long totalPauseSeconds,
        @Schema(description = "Questions requested at generation", example = "10")
        int requestedQuestionCount,
        @Schema(description = "Questions assigned", example = "10")
        int totalQuestions,
        @Schema(example = "7")
        int correctAnswers,
        @Schema(example = "2")
        int incorrectAnswers,
        @Schema(example = "1")
        int skippedAnswers,
        @Schema(description = "Null until the session is settled", example = "70.00")
        BigDecimal accuracyPercentage,
        @Schema(description = "Seconds; null until the session is settled", example = "22.50")
        BigDecimal averageTimePerQuestion,
        @Schema(description = "Sum of per-question times in seconds", example = "225")
        long totalTimeSpentSeconds,
        @Schema(description = "Overall rating change from settlement", example = "-12")
        int ratingChange,
        @Schema(description = "Settled answers in presentation order; empty until the session is settled")
        List<AttemptResult> attempts
) {

    public record AttemptResult(
            @Schema(example = "0") int position,
            UUID questionId,
            @Schema(example = "What does ACID stand for?") String questionText,
            String correctAnswer,
            UUID categoryId,
            String submittedAnswer,
            boolean correct,
            boolean skipped,
            @Schema(example = "20") int timeSpentSeconds,
            @Schema(description = "Question rating at selection time", example = "1480") int questionRating,
            @Schema(example = "1500") int learnerRatingBefore,
            @Schema(example = "1512") int learnerRatingAfter
    ) {
    }
}
