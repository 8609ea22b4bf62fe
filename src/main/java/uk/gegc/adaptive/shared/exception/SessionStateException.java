package uk.gegc.adaptive.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;

import java.util.UUID;

/**
 * Thrown when a quiz session is asked to make a transition its current status does not allow,
 * e.g. settling a session that was already completed.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SessionStateException extends RuntimeException {

    private final UUID sessionId;
    private final SessionStatus currentStatus;

    public SessionStateException(UUID sessionId, SessionStatus currentStatus, String action) {
        super(String.format("Cannot %s session %s in status %s", action, sessionId, currentStatus));
        this.sessionId = sessionId;
        this.currentStatus = currentStatus;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public SessionStatus getCurrentStatus() {
        return currentStatus;
    }
}
