package uk.gegc.adaptive.features.settlement.application.dto;

import java.util.UUID;

/**
 * One answered question of a session. A blank {@code submittedAnswer} marks the question as skipped.
 */
public record AttemptSubmission(
        UUID questionId,
        String submittedAnswer,
        boolean correct,
        int timeSpentSeconds
) {

    public boolean skipped() {
        return !correct && (submittedAnswer == null || submittedAnswer.isBlank());
    }
}
