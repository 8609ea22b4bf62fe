package uk.gegc.adaptive.features.learner.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "LearnerRatingDto", description = "Overall rating of the current learner")
public record LearnerRatingDto(
        @Schema(description = "Learner ID")
        UUID learnerId,
        @Schema(description = "Overall rating", example = "1540")
        int rating,
        @Schema(description = "Settled answers counted by the rating", example = "120")
        int gamesPlayed,
        @Schema(description = "Correct settled answers", example = "80")
        int wins,
        @Schema(description = "Wrong or skipped settled answers", example = "40")
        int losses,
        @Schema(description = "Positive for consecutive correct answers, negative for consecutive misses", example = "-2")
        int currentStreak,
        @Schema(description = "Highest rating reached", example = "1575")
        int bestRating,
        @Schema(description = "K-factor the next answer will be rated with", example = "60")
        int kFactor,
        @Schema(description = "Confidence in the rating, in [0, 0.95]", example = "0.82")
        double confidenceLevel,
        @Schema(description = "Last settlement time (UTC); null for a learner without settled answers")
        Instant updatedAt
) {
}
