package uk.gegc.adaptive.features.generation.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.util.List;
import java.util.UUID;

@Schema(name = "GeneratedQuizDto", description = "A freshly generated adaptive quiz session")
public record GeneratedQuizDto(
        @Schema(description = "Session ID")
        UUID sessionId,
        @Schema(description = "Session type", example = "PRACTICE")
        SessionType sessionType,
        @Schema(description = "Session status", example = "ACTIVE")
        SessionStatus status,
        @Schema(description = "Learner rating the questions were targeted at", example = "1500")
        int targetRating,
        @Schema(description = "Questions requested", example = "20")
        int requestedQuestions,
        @Schema(description = "Questions in presentation order")
        List<SessionQuestionDto> questions,
        @Schema(description = "Per-category requested versus selected counts")
        List<CategoryBreakdownDto> breakdown
) {
}
