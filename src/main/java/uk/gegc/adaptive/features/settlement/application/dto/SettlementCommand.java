package uk.gegc.adaptive.features.settlement.application.dto;

import java.util.List;
import java.util.UUID;

public record SettlementCommand(UUID sessionId, UUID learnerId, List<AttemptSubmission> attempts) {
}
