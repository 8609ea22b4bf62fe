package uk.gegc.adaptive.features.selection.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.adaptive.BaseUnitTest;
import uk.gegc.adaptive.features.history.domain.model.QuestionHistoryEntry;
import uk.gegc.adaptive.features.history.domain.repository.QuestionHistoryRepository;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.question.domain.repository.QuestionRepository;
import uk.gegc.adaptive.features.selection.application.dto.RankedQuestion;
import uk.gegc.adaptive.features.selection.application.dto.SelectionCriteria;
import uk.gegc.adaptive.features.selection.config.SelectionProperties;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.shared.exception.ValidationException;

import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("RatingWindowQuestionSelector unit tests")
class RatingWindowQuestionSelectorTest extends BaseUnitTest {

    private static final UUID LEARNER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");
    private static final UUID CATEGORY_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");

    @Mock private QuestionRepository questionRepository;
    @Mock private QuestionHistoryRepository historyRepository;
    @Mock private QuizSessionRepository sessionRepository;

    private RatingWindowQuestionSelector selector;

    @BeforeEach
    void setUp() {
        selector = new RatingWindowQuestionSelector(
                questionRepository, historyRepository, sessionRepository, new SelectionProperties(), new Random(42));
    }

    @Test
    @DisplayName("select: queued questions rank first by priority, then by distance to the target rating")
    @SuppressWarnings("unchecked")
    void select_ordersByQueuePriorityThenDistance() {
        Question near = question(1510);
        Question far = question(1650);
        Question queuedLow = question(1900);
        Question queuedHigh = question(1000);
        when(historyRepository.findQueued(LEARNER_ID, CATEGORY_ID))
                .thenReturn(List.of(queued(queuedLow, 1), queued(queuedHigh, 3)));
        when(historyRepository.findRetiredQuestionIds(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(sessionRepository.findRecentSessionIds(eq(LEARNER_ID), any(Pageable.class))).thenReturn(List.of());
        when(questionRepository.findAll(any(Specification.class)))
                .thenReturn(List.of(far, queuedLow, near, queuedHigh));

        List<RankedQuestion> result = selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 10, 1500, 200));

        assertThat(result).extracting(RankedQuestion::question).containsExactly(queuedHigh, queuedLow, near, far);
        assertThat(result).extracting(RankedQuestion::queuePriority).containsExactly(3, 1, 0, 0);
        assertEquals(10, result.get(2).ratingDistance());
    }

    @Test
    @DisplayName("select: truncates to the desired count")
    @SuppressWarnings("unchecked")
    void select_truncatesToDesiredCount() {
        when(historyRepository.findQueued(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(historyRepository.findRetiredQuestionIds(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(sessionRepository.findRecentSessionIds(eq(LEARNER_ID), any(Pageable.class))).thenReturn(List.of());
        Question closest = question(1500);
        when(questionRepository.findAll(any(Specification.class)))
                .thenReturn(List.of(question(1600), question(1450), closest, question(1390)));

        List<RankedQuestion> result = selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 2, 1500, 200));

        assertEquals(2, result.size());
        assertEquals(closest, result.get(0).question());
        assertEquals(50, result.get(1).ratingDistance());
    }

    @Test
    @DisplayName("select: an empty pool yields an empty result rather than an error")
    @SuppressWarnings("unchecked")
    void select_emptyPool_returnsEmpty() {
        when(historyRepository.findQueued(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(historyRepository.findRetiredQuestionIds(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(sessionRepository.findRecentSessionIds(eq(LEARNER_ID), any(Pageable.class))).thenReturn(List.of());
        when(questionRepository.findAll(any(Specification.class))).thenReturn(List.of());

        assertThat(selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 5, 1500, 200))).isEmpty();
    }

    @Test
    @DisplayName("select: without recent sessions the seen-in-sessions lookup is skipped")
    @SuppressWarnings("unchecked")
    void select_noRecentSessions_skipsRecentLookup() {
        when(historyRepository.findQueued(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(historyRepository.findRetiredQuestionIds(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(sessionRepository.findRecentSessionIds(eq(LEARNER_ID), any(Pageable.class))).thenReturn(List.of());
        when(questionRepository.findAll(any(Specification.class))).thenReturn(List.of(question(1500)));

        selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 5, 1500, 200));

        verify(historyRepository, never()).findQuestionIdsSeenInSessions(any(), any(), anyCollection());
    }

    @Test
    @DisplayName("select: recent sessions are looked up when present")
    @SuppressWarnings("unchecked")
    void select_recentSessions_areQueried() {
        UUID recentSession = UUID.randomUUID();
        when(historyRepository.findQueued(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of());
        when(historyRepository.findRetiredQuestionIds(LEARNER_ID, CATEGORY_ID)).thenReturn(List.of(UUID.randomUUID()));
        when(sessionRepository.findRecentSessionIds(eq(LEARNER_ID), any(Pageable.class))).thenReturn(List.of(recentSession));
        when(historyRepository.findQuestionIdsSeenInSessions(LEARNER_ID, CATEGORY_ID, List.of(recentSession)))
                .thenReturn(List.of(UUID.randomUUID()));
        when(questionRepository.findAll(any(Specification.class))).thenReturn(List.of());

        selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 5, 1500, 200));

        verify(historyRepository).findQuestionIdsSeenInSessions(LEARNER_ID, CATEGORY_ID, List.of(recentSession));
    }

    @Test
    @DisplayName("select: negative count or window is rejected")
    void select_invalidCriteria_throws() {
        assertThrows(ValidationException.class,
                () -> selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, -1, 1500, 200)));
        assertThrows(ValidationException.class,
                () -> selector.select(new SelectionCriteria(LEARNER_ID, CATEGORY_ID, 5, 1500, -1)));
        verifyNoInteractions(questionRepository);
    }

    private Question question(int rating) {
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setRating(rating);
        question.setActive(true);
        return question;
    }

    private QuestionHistoryEntry queued(Question question, int priority) {
        QuestionHistoryEntry entry = new QuestionHistoryEntry();
        entry.setLearnerId(LEARNER_ID);
        entry.setQuestionId(question.getId());
        entry.setQueuePriority(priority);
        return entry;
    }
}
