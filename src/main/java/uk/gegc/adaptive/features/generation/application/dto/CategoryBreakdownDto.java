package uk.gegc.adaptive.features.generation.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "CategoryBreakdownDto", description = "Questions requested versus selected for one category")
public record CategoryBreakdownDto(
        @Schema(description = "Category ID")
        UUID categoryId,
        @Schema(description = "Category name", example = "Databases")
        String categoryName,
        @Schema(description = "Weight used for the distribution", example = "3.0")
        double weight,
        @Schema(description = "Questions allotted to the category", example = "12")
        int requested,
        @Schema(description = "Questions actually selected", example = "12")
        int selected
) {
}
