package uk.gegc.adaptive.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.adaptive.features.question.infra.mapping.QuestionMapper;
import uk.gegc.adaptive.features.session.application.SessionLifecycleService;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.application.dto.SessionStatusDto;
import uk.gegc.adaptive.features.session.application.dto.SessionSummaryDto;
import uk.gegc.adaptive.features.session.domain.model.QuestionAttempt;
import uk.gegc.adaptive.features.session.domain.model.QuizSession;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.repository.QuestionAttemptRepository;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.features.session.domain.repository.SessionQuestionRepository;
import uk.gegc.adaptive.shared.exception.ResourceNotFoundException;
import uk.gegc.adaptive.shared.exception.SessionStateException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class SessionLifecycleServiceImpl implements SessionLifecycleService {

    private final QuizSessionRepository sessionRepository;
    private final SessionQuestionRepository sessionQuestionRepository;
    private final QuestionAttemptRepository attemptRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<SessionQuestionDto> getSessionQuestions(UUID sessionId, UUID learnerId) {
        loadOwned(sessionId, learnerId);
        return sessionQuestionRepository.findAllBySessionIdOrdered(sessionId).stream()
                .map(QuestionMapper::toSessionQuestionDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public SessionStatusDto getSessionStatus(UUID sessionId, UUID learnerId) {
        return toDto(loadOwned(sessionId, learnerId));
    }

    @Override
    @Transactional(readOnly = true)
    public SessionSummaryDto getSessionSummary(UUID sessionId, UUID learnerId) {
        QuizSession session = loadOwned(sessionId, learnerId);
        List<QuestionAttempt> attempts = attemptRepository.findAllBySessionIdOrderByPositionAsc(sessionId);
        Map<UUID, SessionQuestion> assignments = attempts.isEmpty()
                ? Map.of()
                : sessionQuestionRepository.findAllBySessionIdOrdered(sessionId).stream()
                .collect(Collectors.toMap(sq -> sq.getQuestion().getId(), Function.identity()));

        List<SessionSummaryDto.AttemptResult> results = attempts.stream()
                .map(attempt -> {
                    SessionQuestion assignment = assignments.get(attempt.getQuestionId());
                    return new SessionSummaryDto.AttemptResult(
                            attempt.getPosition(),
                            attempt.getQuestionId(),
                            assignment != null ? assignment.getQuestion().getQuestionText() : null,
                            assignment != null ? assignment.getQuestion().getCorrectAnswer() : null,
                            attempt.getCategoryId(),
                            attempt.getSubmittedAnswer(),
                            attempt.isCorrect(),
                            attempt.isSkipped(),
                            attempt.getTimeSpentSeconds(),
                            attempt.getQuestionRatingAtSelection(),
                            attempt.getLearnerRatingBefore(),
                            attempt.getLearnerRatingAfter());
                })
                .toList();

        return new SessionSummaryDto(
                session.getId(),
                session.getSessionType(),
                session.getStatus(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getTotalPauseSeconds(),
                session.getRequestedQuestionCount(),
                session.getTotalQuestions(),
                session.getCorrectAnswers(),
                session.getIncorrectAnswers(),
                session.getSkippedAnswers(),
                session.getAccuracyPercentage(),
                session.getAverageTimePerQuestion(),
                session.getTotalTimeSpentSeconds(),
                session.getRatingChange(),
                results
        );
    }

    @Override
    public SessionStatusDto pauseSession(UUID sessionId, UUID learnerId) {
        QuizSession session = loadOwned(sessionId, learnerId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw rejected(session, "pause");
        }
        session.setPausedAt(Instant.now(clock));
        session.setStatus(SessionStatus.PAUSED);
        log.info("Paused session {} for learner {}", sessionId, learnerId);
        return toDto(sessionRepository.save(session));
    }

    @Override
    public SessionStatusDto resumeSession(UUID sessionId, UUID learnerId) {
        QuizSession session = loadOwned(sessionId, learnerId);
        if (session.getStatus() != SessionStatus.PAUSED) {
            throw rejected(session, "resume");
        }
        session.closePause(Instant.now(clock));
        session.setStatus(SessionStatus.ACTIVE);
        log.info("Resumed session {} for learner {} (total pause {}s)", sessionId, learnerId, session.getTotalPauseSeconds());
        return toDto(sessionRepository.save(session));
    }

    @Override
    public SessionStatusDto abandonSession(UUID sessionId, UUID learnerId) {
        QuizSession session = loadOwned(sessionId, learnerId);
        if (session.getStatus().isTerminal()) {
            throw rejected(session, "abandon");
        }
        Instant now = Instant.now(clock);
        session.closePause(now);
        session.setStatus(SessionStatus.ABANDONED);
        session.setEndedAt(now);
        log.info("Abandoned session {} for learner {}", sessionId, learnerId);
        return toDto(sessionRepository.save(session));
    }

    private QuizSession loadOwned(UUID sessionId, UUID learnerId) {
        return sessionRepository.findByIdAndLearnerId(sessionId, learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Quiz session " + sessionId + " not found"));
    }

    private SessionStateException rejected(QuizSession session, String action) {
        log.warn("Rejected {} of session {} in status {}", action, session.getId(), session.getStatus());
        return new SessionStateException(session.getId(), session.getStatus(), action);
    }

    private SessionStatusDto toDto(QuizSession session) {
        return new SessionStatusDto(
                session.getId(),
                session.getStatus(),
                session.getStartedAt(),
                session.getPausedAt(),
                session.getResumedAt(),
                session.getEndedAt(),
                session.getTotalPauseSeconds()
        );
    }
}
