package uk.gegc.adaptive.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.util.List;
import java.util.UUID;

@Schema(name = "GenerateAdaptiveQuizRequest", description = "Parameters of an adaptive quiz")
public record GenerateAdaptiveQuizRequest(
        @Schema(description = "Number of questions to draw", example = "20", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Question count is required")
        @Min(value = 1, message = "Question count must be at least 1")
        @Max(value = 100, message = "Question count must not exceed 100")
        Integer questionCount,

        @Schema(description = "Session type; defaults to PRACTICE", example = "PRACTICE")
        SessionType sessionType,

        @Schema(description = "Categories to draw from, weighted equally; omit to use the learner's top priorities")
        @Size(max = 20, message = "At most 20 categories may be requested")
        List<@NotNull UUID> categoryIds
) {
}
