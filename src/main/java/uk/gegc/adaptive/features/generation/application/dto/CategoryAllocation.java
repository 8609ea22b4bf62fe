package uk.gegc.adaptive.features.generation.application.dto;

import java.util.UUID;

public record CategoryAllocation(UUID categoryId, String categoryName, double weight, int requested) {
}
