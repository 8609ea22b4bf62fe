package uk.gegc.adaptive.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when the settlement transaction cannot commit (lock contention, constraint violation).
 * Nothing of the settlement is visible; the caller may retry the whole settlement.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SettlementFailedException extends RuntimeException {

    private final UUID sessionId;

    public SettlementFailedException(UUID sessionId, Throwable cause) {
        super("Settlement of session " + sessionId + " could not be committed and was rolled back", cause);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
