package uk.gegc.adaptive.features.learner.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "LeaderboardEntryDto", description = "Leaderboard position")
public record LeaderboardEntryDto(
        @Schema(description = "One-based position", example = "1")
        int rank,
        @Schema(description = "Learner ID")
        UUID learnerId,
        @Schema(description = "Overall or category rating", example = "1710")
        int rating,
        @Schema(description = "Settled answers behind the rating", example = "340")
        int answered
) {
}
