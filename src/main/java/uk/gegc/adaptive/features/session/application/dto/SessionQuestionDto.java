package uk.gegc.adaptive.features.session.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "SessionQuestionDto", description = "A question assigned to a quiz session, with its rating frozen at selection time")
public record SessionQuestionDto(
        @Schema(description = "Zero-based presentation position", example = "0")
        int position,

        @Schema(description = "Question UUID")
        UUID questionId,

        @Schema(description = "Question text", example = "What does ACID stand for?")
        String questionText,

        @Schema(description = "Answer options")
        List<String> options,

        @Schema(description = "Correct answer")
        String correctAnswer,

        @Schema(description = "Explanation shown after answering")
        String explanation,

        @Schema(description = "Category the question was selected for")
        UUID categoryId,

        @Schema(description = "Category name", example = "Databases")
        String categoryName,

        @Schema(description = "Question rating at selection time", example = "1480")
        int questionRating
) {
}
