package uk.gegc.adaptive.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "AttemptRequest", description = "Answer given to one session question")
public record AttemptRequest(
        @Schema(description = "Question ID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Question id is required")
        UUID questionId,

        @Schema(description = "Submitted answer; blank means skipped", example = "Atomicity")
        @Size(max = 1000, message = "Submitted answer must not exceed 1000 characters")
        String submittedAnswer,

        @Schema(description = "Whether the answer was correct", example = "true", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Correctness is required")
        Boolean correct,

        @Schema(description = "Seconds spent on the question", example = "25", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Time spent is required")
        @Min(value = 0, message = "Time spent must not be negative")
        Integer timeSpentSeconds
) {
}
