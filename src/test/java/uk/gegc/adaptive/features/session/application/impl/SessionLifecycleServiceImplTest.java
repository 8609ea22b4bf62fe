package uk.gegc.adaptive.features.session.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import uk.gegc.adaptive.BaseUnitTest;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.application.dto.SessionStatusDto;
import uk.gegc.adaptive.features.session.application.dto.SessionSummaryDto;
import uk.gegc.adaptive.features.session.domain.model.QuestionAttempt;
import uk.gegc.adaptive.features.session.domain.model.QuizSession;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;
import uk.gegc.adaptive.features.session.domain.repository.QuestionAttemptRepository;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.features.session.domain.repository.SessionQuestionRepository;
import uk.gegc.adaptive.shared.exception.ResourceNotFoundException;
import uk.gegc.adaptive.shared.exception.SessionStateException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("SessionLifecycleServiceImpl unit tests")
class SessionLifecycleServiceImplTest extends BaseUnitTest {

    private static final UUID LEARNER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");
    private static final UUID SESSION_ID = UUID.fromString("30000000-0000-0000-0000-000000000003");
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock private QuizSessionRepository sessionRepository;
    @Mock private SessionQuestionRepository sessionQuestionRepository;
    @Mock private QuestionAttemptRepository attemptRepository;

    private SessionLifecycleServiceImpl service;
    private QuizSession session;

    @BeforeEach
    void setUp() {
        service = new SessionLifecycleServiceImpl(sessionRepository, sessionQuestionRepository, attemptRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        session = new QuizSession();
        session.setId(SESSION_ID);
        session.setLearnerId(LEARNER_ID);
        session.setSessionType(SessionType.PRACTICE);
        session.setStatus(SessionStatus.ACTIVE);
        session.setStartedAt(NOW.minusSeconds(3600));
    }

    @Test
    @DisplayName("pauseSession: ACTIVE becomes PAUSED at the current instant")
    void pauseSession_active_pauses() {
        stubOwnedSession();

        SessionStatusDto result = service.pauseSession(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.PAUSED, result.status());
        assertEquals(NOW, result.pausedAt());
        verify(sessionRepository).save(session);
    }

    @Test
    @DisplayName("resumeSession: PAUSED becomes ACTIVE and the pause is accumulated")
    void resumeSession_paused_accumulatesPause() {
        session.setStatus(SessionStatus.PAUSED);
        session.setPausedAt(NOW.minusSeconds(300));
        session.setTotalPauseSeconds(60);
        stubOwnedSession();

        SessionStatusDto result = service.resumeSession(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.ACTIVE, result.status());
        assertEquals(360, result.totalPauseSeconds());
        assertEquals(NOW, result.resumedAt());
    }

    @Test
    @DisplayName("resumeSession: an ACTIVE session cannot be resumed")
    void resumeSession_active_throws() {
        stubOwnedSession();

        SessionStateException ex = assertThrows(SessionStateException.class,
                () -> service.resumeSession(SESSION_ID, LEARNER_ID));

        assertEquals(SessionStatus.ACTIVE, ex.getCurrentStatus());
        verify(sessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("abandonSession: a paused session is closed out and ended")
    void abandonSession_paused_endsSession() {
        session.setStatus(SessionStatus.PAUSED);
        session.setPausedAt(NOW.minusSeconds(120));
        stubOwnedSession();

        SessionStatusDto result = service.abandonSession(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.ABANDONED, result.status());
        assertEquals(NOW, result.endedAt());
        assertEquals(120, result.totalPauseSeconds());
    }

    @ParameterizedTest(name = "{0} sessions cannot be paused or abandoned")
    @EnumSource(value = SessionStatus.class, names = {"COMPLETED", "ABANDONED"})
    @DisplayName("terminal sessions reject every transition")
    void terminalSession_rejectsTransitions(SessionStatus status) {
        session.setStatus(status);
        when(sessionRepository.findByIdAndLearnerId(SESSION_ID, LEARNER_ID)).thenReturn(Optional.of(session));

        assertThrows(SessionStateException.class, () -> service.pauseSession(SESSION_ID, LEARNER_ID));
        assertThrows(SessionStateException.class, () -> service.abandonSession(SESSION_ID, LEARNER_ID));
        verify(sessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("a session owned by another learner is reported as not found")
    void foreignSession_notFound() {
        UUID stranger = UUID.randomUUID();
        when(sessionRepository.findByIdAndLearnerId(SESSION_ID, stranger)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.pauseSession(SESSION_ID, stranger));
        assertThrows(ResourceNotFoundException.class, () -> service.getSessionQuestions(SESSION_ID, stranger));
        verifyNoInteractions(sessionQuestionRepository);
    }

    @Test
    @DisplayName("getSessionQuestions: returns assignments in position order with their frozen rating")
    void getSessionQuestions_mapsAssignments() {
        Category category = new Category(UUID.randomUUID(), "Security", null);
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setQuestionText("Which port does HTTPS use by default?");
        question.setOptions("[\"80\",\"443\"]");
        question.setCorrectAnswer("443");
        question.setRating(1620);
        SessionQuestion assignment = new SessionQuestion();
        assignment.setPosition(0);
        assignment.setQuestion(question);
        assignment.setCategory(category);
        assignment.setQuestionRatingAtSelection(1580);
        stubOwnedSession();
        when(sessionQuestionRepository.findAllBySessionIdOrdered(SESSION_ID)).thenReturn(List.of(assignment));

        List<SessionQuestionDto> result = service.getSessionQuestions(SESSION_ID, LEARNER_ID);

        assertEquals(1, result.size());
        SessionQuestionDto dto = result.get(0);
        assertEquals(question.getId(), dto.questionId());
        assertEquals(List.of("80", "443"), dto.options());
        assertEquals("Security", dto.categoryName());
        assertEquals(1580, dto.questionRating());
    }

    @Test
    @DisplayName("getSessionStatus: reports the stored lifecycle state")
    void getSessionStatus_returnsState() {
        session.setStatus(SessionStatus.PAUSED);
        session.setPausedAt(NOW.minusSeconds(30));
        stubOwnedSession();

        SessionStatusDto result = service.getSessionStatus(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.PAUSED, result.status());
        assertEquals(NOW.minusSeconds(30), result.pausedAt());
        verify(sessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("getSessionSummary: settled answers come back in order with question text and ratings")
    void getSessionSummary_settledSession_mapsAttempts() {
        Category category = new Category(UUID.randomUUID(), "Networking", null);
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setQuestionText("Which layer does TCP belong to?");
        question.setCorrectAnswer("Transport");
        SessionQuestion assignment = new SessionQuestion();
        assignment.setQuestion(question);
        assignment.setCategory(category);

        QuestionAttempt attempt = new QuestionAttempt();
        attempt.setSessionId(SESSION_ID);
        attempt.setQuestionId(question.getId());
        attempt.setCategoryId(category.getId());
        attempt.setSubmittedAnswer("Network");
        attempt.setTimeSpentSeconds(18);
        attempt.setQuestionRatingAtSelection(1490);
        attempt.setLearnerRatingBefore(1500);
        attempt.setLearnerRatingAfter(1478);

        session.setStatus(SessionStatus.COMPLETED);
        session.setEndedAt(NOW);
        session.setTotalQuestions(1);
        session.setIncorrectAnswers(1);
        session.setAccuracyPercentage(new BigDecimal("0.00"));
        session.setAverageTimePerQuestion(new BigDecimal("18.00"));
        session.setTotalTimeSpentSeconds(18);
        session.setRatingChange(-22);
        stubOwnedSession();
        when(attemptRepository.findAllBySessionIdOrderByPositionAsc(SESSION_ID)).thenReturn(List.of(attempt));
        when(sessionQuestionRepository.findAllBySessionIdOrdered(SESSION_ID)).thenReturn(List.of(assignment));

        SessionSummaryDto summary = service.getSessionSummary(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.COMPLETED, summary.status());
        assertEquals(-22, summary.ratingChange());
        assertEquals(new BigDecimal("18.00"), summary.averageTimePerQuestion());
        assertEquals(1, summary.attempts().size());
        SessionSummaryDto.AttemptResult result = summary.attempts().get(0);
        assertEquals("Which layer does TCP belong to?", result.questionText());
        assertEquals("Transport", result.correctAnswer());
        assertEquals("Network", result.submittedAnswer());
        assertFalse(result.correct());
        assertEquals(1490, result.questionRating());
        assertEquals(1478, result.learnerRatingAfter());
    }

    @Test
    @DisplayName("getSessionSummary: an unsettled session has no answers")
    void getSessionSummary_activeSession_hasNoAttempts() {
        stubOwnedSession();
        when(attemptRepository.findAllBySessionIdOrderByPositionAsc(SESSION_ID)).thenReturn(List.of());

        SessionSummaryDto summary = service.getSessionSummary(SESSION_ID, LEARNER_ID);

        assertEquals(SessionStatus.ACTIVE, summary.status());
        assertTrue(summary.attempts().isEmpty());
        assertNull(summary.accuracyPercentage());
        verifyNoInteractions(sessionQuestionRepository);
    }

    private void stubOwnedSession() {
        when(sessionRepository.findByIdAndLearnerId(SESSION_ID, LEARNER_ID)).thenReturn(Optional.of(session));
        lenient().when(sessionRepository.save(any(QuizSession.class))).thenAnswer(inv -> inv.getArgument(0));
    }
}
