package uk.gegc.adaptive.features.selection.application.dto;

import uk.gegc.adaptive.features.question.domain.model.Question;

/**
 * A selection candidate with the keys it was ranked by.
 */
public record RankedQuestion(
        Question question,
        int queuePriority,
        int ratingDistance
) {
}
