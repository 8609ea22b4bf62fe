package uk.gegc.adaptive.features.settlement.application.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import org.springframework.transaction.TransactionStatus;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.session.domain.model.QuizSession;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;
import uk.gegc.adaptive.features.settlement.application.dto.AttemptSubmission;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of one settlement, handed explicitly to every step so that all of them work on the same
 * transaction and the same locked rows.
 */
@Getter
@RequiredArgsConstructor
class SettlementContext {

    private final TransactionStatus transaction;
    private final UUID learnerId;
    private final List<AttemptSubmission> attempts;
    private final Instant settledAt;

    @Setter
    private LearnerRating learnerRating;

    @Setter
    private QuizSession session;

    // keyed by question id
    @Setter
    private Map<UUID, SessionQuestion> assignments;

    @Setter
    private Map<UUID, Question> lockedQuestions;

    SessionQuestion assignmentOf(AttemptSubmission attempt) {
        return assignments.get(attempt.questionId());
    }
}
