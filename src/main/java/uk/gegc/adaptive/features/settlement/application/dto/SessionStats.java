package uk.gegc.adaptive.features.settlement.application.dto;

import java.math.BigDecimal;

public record SessionStats(
        int total,
        int correct,
        int incorrect,
        int skipped,
        BigDecimal accuracyPercentage,
        BigDecimal averageTimePerQuestion,
        long totalTimeSpentSeconds
) {
}
