package uk.gegc.adaptive.features.learner.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.categoryrating.domain.model.PerformanceTrend;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CategoryRatingDto", description = "Micro-rating and statistics of the current learner in one category")
public record CategoryRatingDto(
        @Schema(description = "Category ID")
        UUID categoryId,
        @Schema(description = "Category name", example = "Databases")
        String categoryName,
        @Schema(description = "Category rating", example = "1420")
        int rating,
        @Schema(description = "Settled answers in the category", example = "25")
        int attempts,
        @Schema(description = "Correct settled answers in the category", example = "16")
        int correctAttempts,
        @Schema(description = "Success rate in [0, 1]", example = "0.64")
        double successRate,
        @Schema(description = "Accuracy over the latest answers in [0, 1]", example = "0.7")
        double recentAccuracy,
        @Schema(description = "Direction of recent performance", example = "IMPROVING")
        PerformanceTrend trend,
        @Schema(description = "Questions of the category the learner has retired", example = "12")
        int questionsMastered,
        @Schema(description = "Last settled answer in the category (UTC)")
        Instant lastAttemptAt
) {
}
