package uk.gegc.adaptive.features.settlement.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "SettlementResultDto", description = "Outcome of settling a completed quiz session")
public record SettlementResultDto(
        @Schema(description = "Session ID")
        UUID sessionId,
        @Schema(description = "Session status after settlement", example = "COMPLETED")
        SessionStatus status,
        @Schema(description = "Session type", example = "PRACTICE")
        SessionType sessionType,
        @Schema(description = "Answered questions", example = "10")
        int totalQuestions,
        @Schema(description = "Correct answers", example = "7")
        int correctAnswers,
        @Schema(description = "Wrong, non-blank answers", example = "2")
        int incorrectAnswers,
        @Schema(description = "Blank answers", example = "1")
        int skippedAnswers,
        @Schema(description = "Correct answers as a percentage, 2 decimal places", example = "70.00")
        BigDecimal accuracyPercentage,
        @Schema(description = "Average seconds per question, 2 decimal places", example = "22.50")
        BigDecimal averageTimePerQuestion,
        @Schema(description = "Sum of per-question times in seconds", example = "225")
        long totalTimeSpentSeconds,
        @Schema(description = "Learner rating before the session", example = "1500")
        int ratingBefore,
        @Schema(description = "Learner rating after the session", example = "1538")
        int ratingAfter,
        @Schema(description = "Rating change", example = "38")
        int ratingChange,
        @Schema(description = "Time the session was settled (UTC)")
        Instant completedAt,
        @Schema(description = "Per-category effect")
        List<CategorySettlementDto> categories
) {
}
