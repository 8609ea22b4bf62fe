package uk.gegc.adaptive.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "CompleteSessionRequest", description = "Answers of a finished session, in answering order")
public record CompleteSessionRequest(
        @Schema(description = "Attempts in the order they were answered", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one attempt is required")
        List<@Valid AttemptRequest> attempts
) {
}
