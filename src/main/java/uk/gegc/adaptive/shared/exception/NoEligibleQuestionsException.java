package uk.gegc.adaptive.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class NoEligibleQuestionsException extends RuntimeException {

    private final UUID learnerId;

    public NoEligibleQuestionsException(UUID learnerId) {
        super("No eligible questions found in any target category for learner " + learnerId);
        this.learnerId = learnerId;
    }

    public UUID getLearnerId() {
        return learnerId;
    }
}
