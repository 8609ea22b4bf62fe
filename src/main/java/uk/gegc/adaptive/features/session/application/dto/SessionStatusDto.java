package uk.gegc.adaptive.features.session.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SessionStatusDto", description = "Lifecycle state of a quiz session")
public record SessionStatusDto(
        @Schema(description = "Session ID")
        UUID sessionId,
        @Schema(description = "Current status", example = "PAUSED")
        SessionStatus status,
        @Schema(description = "Start time (UTC)")
        Instant startedAt,
        @Schema(description = "Last pause time (UTC)")
        Instant pausedAt,
        @Schema(description = "Last resume time (UTC)")
        Instant resumedAt,
        @Schema(description = "End time (UTC)")
        Instant endedAt,
        @Schema(description = "Accumulated pause duration in seconds", example = "120")
        long totalPauseSeconds
) {
}
