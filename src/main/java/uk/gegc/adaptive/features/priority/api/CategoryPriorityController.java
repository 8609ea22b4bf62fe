package uk.gegc.adaptive.features.priority.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.adaptive.features.priority.application.CategoryPriorityService;
import uk.gegc.adaptive.features.priority.application.dto.CategoryPriorityDto;
import uk.gegc.adaptive.shared.api.ApiHeaders;

import java.util.List;
import java.util.UUID;

@Tag(name = "Practice Priorities", description = "Which categories the learner should practise next")
@RestController
@RequestMapping("/api/v1/priorities")
@RequiredArgsConstructor
@Validated
public class CategoryPriorityController {

    private final CategoryPriorityService priorityService;

    @GetMapping
    @Operation(summary = "Get top practice priorities", description = "Highest selection weights first; ties ordered by category id.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Top priorities",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = CategoryPriorityDto.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<CategoryPriorityDto>> getTopPriorities(
            @Parameter(description = "Learner identity", required = true)
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @Parameter(description = "Maximum number of categories", example = "3")
            @RequestParam(defaultValue = "3") @Min(1) @Max(50) int limit
    ) {
        return ResponseEntity.ok(priorityService.topPriorities(learnerId, limit));
    }
}
