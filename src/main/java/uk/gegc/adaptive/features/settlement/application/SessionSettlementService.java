package uk.gegc.adaptive.features.settlement.application;

import uk.gegc.adaptive.features.settlement.application.dto.SettlementCommand;
import uk.gegc.adaptive.features.settlement.application.dto.SettlementResultDto;

public interface SessionSettlementService {

    /**
     * Settles a finished session in one atomic unit: session stats, question history, learner,
     * question and category ratings, then the learner's practice priorities. Nothing is visible
     * unless everything commits.
     */
    SettlementResultDto completeSession(SettlementCommand command);
}
