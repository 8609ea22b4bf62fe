package uk.gegc.adaptive.features.learner.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "RankDto", description = "Position of the current learner among ranked learners")
public record RankDto(
        @Schema(description = "Category ID; null for the overall ranking")
        UUID categoryId,
        @Schema(description = "One plus the number of ranked learners rated strictly higher", example = "4")
        int rank,
        @Schema(description = "The learner's rating", example = "1540")
        int rating,
        @Schema(description = "Learners with at least one settled answer", example = "120")
        long totalRanked,
        @Schema(description = "Share of ranked learners at or below this position, in percent", example = "98")
        int percentile
) {
}
