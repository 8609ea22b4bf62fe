package uk.gegc.adaptive.features.session.application;

import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.application.dto.SessionStatusDto;
import uk.gegc.adaptive.features.session.application.dto.SessionSummaryDto;

import java.util.List;
import java.util.UUID;

public interface SessionLifecycleService {

    List<SessionQuestionDto> getSessionQuestions(UUID sessionId, UUID learnerId);

    SessionStatusDto getSessionStatus(UUID sessionId, UUID learnerId);

    /**
     * Stored statistics of the session with its settled answers. Sessions that were never settled
     * come back with zero counts and no answers.
     */
    SessionSummaryDto getSessionSummary(UUID sessionId, UUID learnerId);

    SessionStatusDto pauseSession(UUID sessionId, UUID learnerId);

    SessionStatusDto resumeSession(UUID sessionId, UUID learnerId);

    SessionStatusDto abandonSession(UUID sessionId, UUID learnerId);
}
