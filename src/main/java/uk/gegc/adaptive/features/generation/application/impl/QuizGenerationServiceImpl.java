package uk.gegc.adaptive.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.category.domain.repository.CategoryRepository;
import uk.gegc.adaptive.features.generation.application.QuestionDistributor;
import uk.gegc.adaptive.features.generation.application.QuizGenerationService;
import uk.gegc.adaptive.features.generation.application.dto.*;
import uk.gegc.adaptive.features.history.domain.model.QuestionHistoryEntry;
import uk.gegc.adaptive.features.history.domain.repository.QuestionHistoryRepository;
import uk.gegc.adaptive.features.learner.application.LearnerRatingProvisioner;
import uk.gegc.adaptive.features.priority.application.CategoryPriorityService;
import uk.gegc.adaptive.features.priority.application.dto.CategoryPriorityDto;
import uk.gegc.adaptive.features.priority.config.PriorityProperties;
import uk.gegc.adaptive.features.question.infra.mapping.QuestionMapper;
import uk.gegc.adaptive.features.selection.application.QuestionSelector;
import uk.gegc.adaptive.features.selection.application.dto.RankedQuestion;
import uk.gegc.adaptive.features.selection.application.dto.SelectionCriteria;
import uk.gegc.adaptive.features.selection.config.SelectionProperties;
import uk.gegc.adaptive.features.session.domain.model.QuizSession;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.shared.exception.NoCategoriesAvailableException;
import uk.gegc.adaptive.shared.exception.NoEligibleQuestionsException;
import uk.gegc.adaptive.shared.exception.ValidationException;
import uk.gegc.adaptive.shared.metrics.EngineMetricsService;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class QuizGenerationServiceImpl implements QuizGenerationService {

    private static final double EXPLICIT_CATEGORY_WEIGHT = 1.0;

    private final CategoryPriorityService priorityService;
    private final LearnerRatingProvisioner learnerRatingProvisioner;
    private final CategoryRepository categoryRepository;
    private final QuestionDistributor distributor;
    private final QuestionSelector questionSelector;
    private final QuizSessionRepository sessionRepository;
    private final QuestionHistoryRepository historyRepository;
    private final PriorityProperties priorityProperties;
    private final SelectionProperties selectionProperties;
    private final EngineMetricsService metricsService;
    private final Random selectionRandom;
    private final Clock clock;

    @Override
    public GeneratedQuizDto generateQuiz(GenerateQuizCommand command) {
        if (command.learnerId() == null) {
            throw new ValidationException("Learner id is required");
        }
        if (command.questionCount() <= 0) {
            throw new ValidationException("Question count must be positive");
        }
        UUID learnerId = command.learnerId();
        SessionType sessionType = command.sessionType() != null ? command.sessionType() : SessionType.PRACTICE;

        priorityService.recalculateAll(learnerId);
        int learnerRating = learnerRatingProvisioner.currentRating(learnerId);

        List<WeightedCategory> targets = resolveTargets(learnerId, command.categoryIds());
        List<CategoryAllocation> allocations = distributor.distribute(targets, command.questionCount());
        Map<UUID, Category> categories = categoryRepository.findAllById(
                        allocations.stream().map(CategoryAllocation::categoryId).toList())
                .stream()
                .collect(Collectors.toMap(Category::getId, Function.identity()));

        int window = selectionProperties.toleranceFor(sessionType);
        List<Selected> merged = new ArrayList<>();
        Set<UUID> taken = new HashSet<>();
        List<CategoryBreakdownDto> breakdown = new ArrayList<>(allocations.size());

        for (CategoryAllocation allocation : allocations) {
            List<RankedQuestion> ranked = questionSelector.select(new SelectionCriteria(
                    learnerId, allocation.categoryId(), allocation.requested(), learnerRating, window));
            int selectedHere = 0;
            for (RankedQuestion candidate : ranked) {
                // a question tagged to several categories is used once
                if (taken.add(candidate.question().getId())) {
                    merged.add(new Selected(candidate, categories.get(allocation.categoryId())));
                    selectedHere++;
                }
            }
            breakdown.add(new CategoryBreakdownDto(
                    allocation.categoryId(), allocation.categoryName(), allocation.weight(),
                    allocation.requested(), selectedHere));
        }

        if (merged.isEmpty()) {
            metricsService.incrementUnderfilledQuiz(sessionType.name());
            throw new NoEligibleQuestionsException(learnerId);
        }

        Collections.shuffle(merged, selectionRandom);

        Instant now = Instant.now(clock);
        QuizSession session = new QuizSession();
        session.setLearnerId(learnerId);
        session.setSessionType(sessionType);
        session.setStatus(SessionStatus.ACTIVE);
        session.setStartedAt(now);
        session.setRequestedQuestionCount(command.questionCount());
        session.setTotalQuestions(merged.size());
        for (int position = 0; position < merged.size(); position++) {
            Selected selected = merged.get(position);
            SessionQuestion assignment = new SessionQuestion();
            assignment.setPosition(position);
            assignment.setQuestion(selected.ranked().question());
            assignment.setCategory(selected.category());
            assignment.setQuestionRatingAtSelection(selected.ranked().question().getRating());
            session.addQuestion(assignment);
        }
        QuizSession saved = sessionRepository.save(session);

        recordSeen(learnerId, saved, merged, now);

        if (merged.size() < command.questionCount()) {
            metricsService.incrementUnderfilledQuiz(sessionType.name());
            log.warn("Quiz for learner {} under-filled: requested={}, selected={}",
                    learnerId, command.questionCount(), merged.size());
        }
        metricsService.incrementQuizGenerated(sessionType.name(), command.questionCount(), merged.size());
        log.info("Generated {} session {} for learner {}: questions={}, categories={}, targetRating={}",
                sessionType, saved.getId(), learnerId, merged.size(), allocations.size(), learnerRating);

        return new GeneratedQuizDto(
                saved.getId(),
                saved.getSessionType(),
                saved.getStatus(),
                learnerRating,
                command.questionCount(),
                saved.getQuestions().stream().map(QuestionMapper::toSessionQuestionDto).toList(),
                breakdown
        );
    }

    private List<WeightedCategory> resolveTargets(UUID learnerId, List<UUID> requestedIds) {
        if (requestedIds != null && !requestedIds.isEmpty()) {
            List<UUID> distinctIds = new ArrayList<>(new LinkedHashSet<>(requestedIds));
            Map<UUID, Category> found = categoryRepository.findAllById(distinctIds).stream()
                    .collect(Collectors.toMap(Category::getId, Function.identity()));
            List<UUID> missing = distinctIds.stream().filter(id -> !found.containsKey(id)).toList();
            if (!missing.isEmpty()) {
                throw new ValidationException("Unknown category ids: " + missing);
            }
            return distinctIds.stream()
                    .map(id -> new WeightedCategory(id, found.get(id).getName(), EXPLICIT_CATEGORY_WEIGHT))
                    .toList();
        }

        List<CategoryPriorityDto> priorities =
                priorityService.topPriorities(learnerId, priorityProperties.getDefaultCategoryCount());
        if (priorities.isEmpty()) {
            throw new NoCategoriesAvailableException(learnerId);
        }
        return priorities.stream()
                .map(p -> new WeightedCategory(p.categoryId(), p.categoryName(), p.priorityWeight()))
                .toList();
    }

    private void recordSeen(UUID learnerId, QuizSession session, List<Selected> merged, Instant now) {
        Map<UUID, QuestionHistoryEntry> existing = historyRepository.findAllByLearnerIdAndQuestionIdIn(
                        learnerId, merged.stream().map(s -> s.ranked().question().getId()).toList())
                .stream()
                .collect(Collectors.toMap(QuestionHistoryEntry::getQuestionId, Function.identity()));

        List<QuestionHistoryEntry> toSave = new ArrayList<>(merged.size());
        for (Selected selected : merged) {
            UUID questionId = selected.ranked().question().getId();
            QuestionHistoryEntry entry = existing.get(questionId);
            if (entry == null) {
                entry = new QuestionHistoryEntry();
                entry.setLearnerId(learnerId);
                entry.setQuestionId(questionId);
                entry.setCategory(selected.category());
                entry.setFirstSeenAt(now);
            }
            entry.setTimesSeen(entry.getTimesSeen() + 1);
            entry.setLastSeenAt(now);
            entry.setLastSessionId(session.getId());
            toSave.add(entry);
        }
        historyRepository.saveAll(toSave);
    }

    private record Selected(RankedQuestion ranked, Category category) {
    }
}
