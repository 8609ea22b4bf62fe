package uk.gegc.adaptive.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.adaptive.features.generation.api.dto.GenerateAdaptiveQuizRequest;
import uk.gegc.adaptive.features.generation.application.QuizGenerationService;
import uk.gegc.adaptive.features.generation.application.dto.GenerateQuizCommand;
import uk.gegc.adaptive.features.generation.application.dto.GeneratedQuizDto;
import uk.gegc.adaptive.shared.api.ApiHeaders;

import java.util.UUID;

@Tag(name = "Adaptive Quizzes", description = "Generate quizzes targeted at the learner's weakest categories")
@RestController
@RequestMapping("/api/v1/adaptive-quizzes")
@RequiredArgsConstructor
@Validated
public class AdaptiveQuizController {

    private final QuizGenerationService quizGenerationService;

    @PostMapping
    @Operation(
            summary = "Generate an adaptive quiz",
            description = "Recomputes the learner's category priorities, distributes the requested question count "
                    + "across the top categories (or the requested ones) and opens an ACTIVE session."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Quiz generated",
                    content = @Content(schema = @Schema(implementation = GeneratedQuizDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error or unknown category",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "No categories or no eligible questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GeneratedQuizDto> generate(
            @Parameter(description = "Learner identity", required = true)
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Quiz parameters",
                    required = true,
                    content = @Content(schema = @Schema(implementation = GenerateAdaptiveQuizRequest.class))
            )
            @RequestBody @Valid GenerateAdaptiveQuizRequest request
    ) {
        GeneratedQuizDto quiz = quizGenerationService.generateQuiz(new GenerateQuizCommand(
                learnerId,
                request.questionCount(),
                request.sessionType(),
                request.categoryIds()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(quiz);
    }
}
