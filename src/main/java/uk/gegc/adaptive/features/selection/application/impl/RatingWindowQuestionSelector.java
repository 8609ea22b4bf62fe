package uk.gegc.adaptive.features.selection.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.adaptive.features.history.domain.model.QuestionHistoryEntry;
import uk.gegc.adaptive.features.history.domain.repository.QuestionHistoryRepository;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.question.domain.repository.QuestionRepository;
import uk.gegc.adaptive.features.question.domain.repository.QuestionSpecifications;
import uk.gegc.adaptive.features.selection.application.QuestionSelector;
import uk.gegc.adaptive.features.selection.application.dto.RankedQuestion;
import uk.gegc.adaptive.features.selection.application.dto.SelectionCriteria;
import uk.gegc.adaptive.features.selection.config.SelectionProperties;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.shared.exception.ValidationException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Selects questions near the learner's rating. Queued review questions bypass the rating window
 * and rank first; retired and recently seen questions are left out unless queued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RatingWindowQuestionSelector implements QuestionSelector {

    private static final Comparator<RankedQuestion> RANKING = Comparator
            .comparingInt(RankedQuestion::queuePriority).reversed()
            .thenComparingInt(RankedQuestion::ratingDistance);

    private final QuestionRepository questionRepository;
    private final QuestionHistoryRepository historyRepository;
    private final QuizSessionRepository sessionRepository;
    private final SelectionProperties properties;
    private final Random selectionRandom;

    @Override
    @Transactional(readOnly = true)
    public List<RankedQuestion> select(SelectionCriteria criteria) {
        validate(criteria);
        UUID learnerId = criteria.learnerId();
        UUID categoryId = criteria.categoryId();

        Map<UUID, Integer> queued = historyRepository.findQueued(learnerId, categoryId).stream()
                .collect(Collectors.toMap(QuestionHistoryEntry::getQuestionId, QuestionHistoryEntry::getQueuePriority));

        Set<UUID> excluded = new HashSet<>(historyRepository.findRetiredQuestionIds(learnerId, categoryId));
        if (properties.getRecentSessionExclusion() > 0) {
            List<UUID> recentSessions = sessionRepository.findRecentSessionIds(
                    learnerId, PageRequest.of(0, properties.getRecentSessionExclusion()));
            if (!recentSessions.isEmpty()) {
                excluded.addAll(historyRepository.findQuestionIdsSeenInSessions(learnerId, categoryId, recentSessions));
            }
        }
        excluded.removeAll(queued.keySet());

        int min = criteria.targetRating() - criteria.ratingWindow();
        int max = criteria.targetRating() + criteria.ratingWindow();
        List<Question> pool = questionRepository.findAll(
                QuestionSpecifications.selectionPool(categoryId, min, max, queued.keySet(), excluded));

        List<RankedQuestion> ranked = new ArrayList<>(pool.size());
        for (Question question : pool) {
            ranked.add(new RankedQuestion(
                    question,
                    queued.getOrDefault(question.getId(), 0),
                    Math.abs(question.getRating() - criteria.targetRating())
            ));
        }

        // shuffle first so the stable sort breaks remaining ties randomly
        Collections.shuffle(ranked, selectionRandom);
        ranked.sort(RANKING);

        List<RankedQuestion> selected = ranked.size() > criteria.desiredCount()
                ? new ArrayList<>(ranked.subList(0, criteria.desiredCount()))
                : ranked;

        log.debug("Selected {}/{} questions for learner {} in category {} (pool={}, queued={}, excluded={})",
                selected.size(), criteria.desiredCount(), learnerId, categoryId,
                pool.size(), queued.size(), excluded.size());
        return selected;
    }

    private void validate(SelectionCriteria criteria) {
        if (criteria.learnerId() == null || criteria.categoryId() == null) {
            throw new ValidationException("Learner and category are required for selection");
        }
        if (criteria.desiredCount() < 0) {
            throw new ValidationException("Desired question count must not be negative");
        }
        if (criteria.ratingWindow() < 0) {
            throw new ValidationException("Rating window must not be negative");
        }
    }
}
