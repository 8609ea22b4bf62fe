package uk.gegc.adaptive.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.adaptive.features.session.api.dto.CompleteSessionRequest;
import uk.gegc.adaptive.features.session.application.SessionLifecycleService;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.application.dto.SessionStatusDto;
import uk.gegc.adaptive.features.session.application.dto.SessionSummaryDto;
import uk.gegc.adaptive.features.settlement.application.SessionSettlementService;
import uk.gegc.adaptive.features.settlement.application.dto.AttemptSubmission;
import uk.gegc.adaptive.features.settlement.application.dto.SettlementCommand;
import uk.gegc.adaptive.features.settlement.application.dto.SettlementResultDto;
import uk.gegc.adaptive.shared.api.ApiHeaders;

import java.util.List;
import java.util.UUID;

@Tag(name = "Quiz Sessions", description = "Session questions, lifecycle transitions and settlement")
@RestController
@RequestMapping("/api/v1/quiz-sessions")
@RequiredArgsConstructor
@Validated
public class QuizSessionController {

    private final SessionLifecycleService lifecycleService;
    private final SessionSettlementService settlementService;

    @GetMapping("/{sessionId}/questions")
    @Operation(summary = "Get session questions", description = "Returns the session's questions in presentation order with ratings frozen at selection.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ordered session questions",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = SessionQuestionDto.class)))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<SessionQuestionDto>> getQuestions(
            @Parameter(description = "Learner identity", required = true)
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @Parameter(description = "Session ID", required = true)
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.getSessionQuestions(sessionId, learnerId));
    }

    @GetMapping("/{sessionId}/status")
    @Operation(summary = "Get session status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session status",
                    content = @Content(schema = @Schema(implementation = SessionStatusDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SessionStatusDto> getStatus(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.getSessionStatus(sessionId, learnerId));
    }

    @GetMapping("/{sessionId}/summary")
    @Operation(summary = "Get session summary", description = "Stored statistics and settled answers of the session; answers are empty until it is settled.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session summary",
                    content = @Content(schema = @Schema(implementation = SessionSummaryDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SessionSummaryDto> getSummary(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.getSessionSummary(sessionId, learnerId));
    }

    @PostMapping("/{sessionId}/completion")
    @Operation(
            summary = "Complete and settle a session",
            description = "Atomically records the answers and updates learner, question and category ratings. "
                    + "A 409 with retryable=true means nothing was written and the request may be repeated."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session settled",
                    content = @Content(schema = @Schema(implementation = SettlementResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed or settlement conflict",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SettlementResultDto> complete(
            @Parameter(description = "Learner identity", required = true)
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @Parameter(description = "Session ID", required = true)
            @PathVariable UUID sessionId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Session answers",
                    required = true,
                    content = @Content(schema = @Schema(implementation = CompleteSessionRequest.class))
            )
            @RequestBody @Valid CompleteSessionRequest request
    ) {
        List<AttemptSubmission> attempts = request.attempts().stream()
                .map(a -> new AttemptSubmission(a.questionId(), a.submittedAnswer(), a.correct(), a.timeSpentSeconds()))
                .toList();
        return ResponseEntity.ok(settlementService.completeSession(new SettlementCommand(sessionId, learnerId, attempts)));
    }

    @PostMapping("/{sessionId}/pause")
    @Operation(summary = "Pause a session", description = "ACTIVE to PAUSED.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session paused",
                    content = @Content(schema = @Schema(implementation = SessionStatusDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session is not active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SessionStatusDto> pause(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.pauseSession(sessionId, learnerId));
    }

    @PostMapping("/{sessionId}/resume")
    @Operation(summary = "Resume a session", description = "PAUSED to ACTIVE; the pause length is added to the session's total pause time.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session resumed",
                    content = @Content(schema = @Schema(implementation = SessionStatusDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session is not paused",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SessionStatusDto> resume(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.resumeSession(sessionId, learnerId));
    }

    @PostMapping("/{sessionId}/abandon")
    @Operation(summary = "Abandon a session", description = "ACTIVE or PAUSED to ABANDONED. Abandoned sessions are never settled.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session abandoned",
                    content = @Content(schema = @Schema(implementation = SessionStatusDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SessionStatusDto> abandon(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID sessionId
    ) {
        return ResponseEntity.ok(lifecycleService.abandonSession(sessionId, learnerId));
    }
}
