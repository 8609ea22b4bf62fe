package uk.gegc.adaptive.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when quiz generation cannot resolve a single target category for the learner,
 * either because no categories were requested and the learner has no practice priorities yet,
 * or because the priority cache is empty.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class NoCategoriesAvailableException extends RuntimeException {

    private final UUID learnerId;

    public NoCategoriesAvailableException(UUID learnerId) {
        super("No categories available for quiz generation for learner " + learnerId);
        this.learnerId = learnerId;
    }

    public UUID getLearnerId() {
        return learnerId;
    }
}
