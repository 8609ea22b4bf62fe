package uk.gegc.adaptive.features.priority.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CategoryPriorityDto", description = "Practice priority of a category for the current learner")
public record CategoryPriorityDto(
        @Schema(description = "Category ID")
        UUID categoryId,
        @Schema(description = "Category name", example = "Databases")
        String categoryName,
        @Schema(description = "Selection weight; higher means practice sooner", example = "3.75")
        double priorityWeight,
        @Schema(description = "Active questions in the category not yet retired by the learner", example = "12")
        int questionsNeeded,
        @Schema(description = "Target rating minus current category rating", example = "250")
        int ratingDeficit,
        @Schema(description = "Target accuracy minus current success rate", example = "0.2")
        double accuracyDeficit,
        @Schema(description = "Current category rating", example = "1250")
        int currentRating,
        @Schema(description = "Current success rate in [0, 1]", example = "0.6")
        double successRate,
        @Schema(description = "Recommended time of the next practice (UTC)")
        Instant nextPracticeRecommendedAt
) {
}
