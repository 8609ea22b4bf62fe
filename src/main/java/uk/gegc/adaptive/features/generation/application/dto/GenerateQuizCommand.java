package uk.gegc.adaptive.features.generation.application.dto;

import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.util.List;
import java.util.UUID;

/**
 * @param categoryIds explicit target categories; {@code null} or empty means "use the learner's top priorities"
 */
public record GenerateQuizCommand(
        UUID learnerId,
        int questionCount,
        SessionType sessionType,
        List<UUID> categoryIds
) {
}
