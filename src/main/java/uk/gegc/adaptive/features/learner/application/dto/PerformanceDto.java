package uk.gegc.adaptive.features.learner.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "PerformanceDto", description = "Answer statistics and rating progression of the current learner")
public record PerformanceDto(
        @Schema(description = "Totals over all settled answers")
        Totals overall,
        @Schema(description = "Totals per category, by category name")
        List<CategoryPerformance> byCategory,
        @Schema(description = "Rating after each of the latest answers, oldest first")
        List<RatingPoint> ratingProgression
) {

    public record Totals(
            @Schema(example = "120") long totalAnswered,
            @Schema(example = "80") long totalCorrect,
            @Schema(description = "Accuracy percentage, 2 decimals", example = "66.67") BigDecimal accuracyPercentage,
            @Schema(description = "Seconds, 2 decimals", example = "21.40") BigDecimal averageTimeSeconds,
            Instant firstAnsweredAt,
            Instant lastAnsweredAt
    ) {
    }

    public record CategoryPerformance(
            UUID categoryId,
            @Schema(example = "Databases") String categoryName,
            @Schema(example = "25") long attempts,
            @Schema(example = "16") long correct,
            @Schema(example = "64.00") BigDecimal accuracyPercentage,
            @Schema(example = "19.80") BigDecimal averageTimeSeconds
    ) {
    }

    public record RatingPoint(
            UUID sessionId,
            UUID questionId,
            boolean correct,
            @Schema(example = "1540") int ratingAfter,
            Instant answeredAt
    ) {
    }
}
