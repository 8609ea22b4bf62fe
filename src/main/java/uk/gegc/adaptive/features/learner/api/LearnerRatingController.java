package uk.gegc.adaptive.features.learner.api;

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
import uk.gegc.adaptive.features.learner.application.LearnerRatingQueryService;
import uk.gegc.adaptive.features.learner.application.dto.*;
import uk.gegc.adaptive.shared.api.ApiHeaders;

import java.util.List;
import java.util.UUID;

@Tag(name = "Ratings", description = "Overall and per-category ratings, performance, leaderboards and ranks")
@RestController
@RequestMapping("/api/v1/ratings")
@RequiredArgsConstructor
@Validated
public class LearnerRatingController {

    private final LearnerRatingQueryService ratingQueryService;

    @GetMapping("/overall")
    @Operation(summary = "Get overall rating", description = "A learner without settled answers is reported at the baseline rating.")
    @ApiResponse(responseCode = "200", description = "Overall rating",
            content = @Content(schema = @Schema(implementation = LearnerRatingDto.class)))
    public ResponseEntity<LearnerRatingDto> getOverall(
            @Parameter(description = "Learner identity", required = true)
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId
    ) {
        return ResponseEntity.ok(ratingQueryService.getOverallRating(learnerId));
    }

    @GetMapping("/micro")
    @Operation(summary = "Get category ratings", description = "Every category the learner has answered in, by name.")
    @ApiResponse(responseCode = "200", description = "Category ratings",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = CategoryRatingDto.class))))
    public ResponseEntity<List<CategoryRatingDto>> getCategoryRatings(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId
    ) {
        return ResponseEntity.ok(ratingQueryService.getCategoryRatings(learnerId));
    }

    @GetMapping("/micro/{categoryId}")
    @Operation(summary = "Get one category rating")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Category rating",
                    content = @Content(schema = @Schema(implementation = CategoryRatingDto.class))),
            @ApiResponse(responseCode = "404", description = "Category not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CategoryRatingDto> getCategoryRating(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @Parameter(description = "Category ID", required = true)
            @PathVariable UUID categoryId
    ) {
        return ResponseEntity.ok(ratingQueryService.getCategoryRating(learnerId, categoryId));
    }

    @GetMapping("/performance")
    @Operation(summary = "Get performance analytics", description = "Answer totals, per-category totals and the rating after each of the latest answers.")
    @ApiResponse(responseCode = "200", description = "Performance analytics",
            content = @Content(schema = @Schema(implementation = PerformanceDto.class)))
    public ResponseEntity<PerformanceDto> getPerformance(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId
    ) {
        return ResponseEntity.ok(ratingQueryService.getPerformance(learnerId));
    }

    @GetMapping("/leaderboard/overall")
    @Operation(summary = "Get overall leaderboard", description = "Learners with at least one settled answer, highest rating first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Leaderboard",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = LeaderboardEntryDto.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<LeaderboardEntryDto>> getOverallLeaderboard(
            @Parameter(description = "Maximum number of entries", example = "10")
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit
    ) {
        return ResponseEntity.ok(ratingQueryService.getOverallLeaderboard(limit));
    }

    @GetMapping("/leaderboard/category/{categoryId}")
    @Operation(summary = "Get category leaderboard", description = "Learners who answered in the category, highest micro-rating first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Leaderboard",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = LeaderboardEntryDto.class)))),
            @ApiResponse(responseCode = "404", description = "Category not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<LeaderboardEntryDto>> getCategoryLeaderboard(
            @PathVariable UUID categoryId,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit
    ) {
        return ResponseEntity.ok(ratingQueryService.getCategoryLeaderboard(categoryId, limit));
    }

    @GetMapping("/rank/overall")
    @Operation(summary = "Get overall rank")
    @ApiResponse(responseCode = "200", description = "Rank",
            content = @Content(schema = @Schema(implementation = RankDto.class)))
    public ResponseEntity<RankDto> getOverallRank(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId
    ) {
        return ResponseEntity.ok(ratingQueryService.getOverallRank(learnerId));
    }

    @GetMapping("/rank/category/{categoryId}")
    @Operation(summary = "Get category rank")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rank",
                    content = @Content(schema = @Schema(implementation = RankDto.class))),
            @ApiResponse(responseCode = "404", description = "Category not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<RankDto> getCategoryRank(
            @RequestHeader(ApiHeaders.LEARNER_ID) UUID learnerId,
            @PathVariable UUID categoryId
    ) {
        return ResponseEntity.ok(ratingQueryService.getCategoryRank(learnerId, categoryId));
    }
}
