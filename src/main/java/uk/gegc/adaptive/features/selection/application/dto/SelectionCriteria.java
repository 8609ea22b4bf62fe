package uk.gegc.adaptive.features.selection.application.dto;

import java.util.UUID;

public record SelectionCriteria(
        UUID learnerId,
        UUID categoryId,
        int desiredCount,
        int targetRating,
        int ratingWindow
) {
}
