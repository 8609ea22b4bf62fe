package uk.gegc.adaptive.features.generation.application.dto;

import java.util.UUID;

public record WeightedCategory(UUID categoryId, String categoryName, double weight) {
}
