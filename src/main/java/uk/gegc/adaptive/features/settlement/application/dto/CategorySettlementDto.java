package uk.gegc.adaptive.features.settlement.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.categoryrating.domain.model.PerformanceTrend;

import java.util.UUID;

@Schema(name = "CategorySettlementDto", description = "Effect of a settled session on one category")
public record CategorySettlementDto(
        @Schema(description = "Category ID")
        UUID categoryId,
        @Schema(description = "Category name", example = "Databases")
        String categoryName,
        @Schema(description = "Answers in this session", example = "4")
        int answered,
        @Schema(description = "Correct answers in this session", example = "3")
        int correct,
        @Schema(description = "Category rating before the session", example = "1500")
        int ratingBefore,
        @Schema(description = "Category rating after the session", example = "1532")
        int ratingAfter,
        @Schema(description = "Lifetime success rate in [0, 1]", example = "0.75")
        double successRate,
        @Schema(description = "Accuracy over the latest attempts in [0, 1]", example = "0.8")
        double recentAccuracy,
        @Schema(description = "Recent accuracy compared with the lifetime success rate", example = "STABLE")
        PerformanceTrend trend
) {
}
