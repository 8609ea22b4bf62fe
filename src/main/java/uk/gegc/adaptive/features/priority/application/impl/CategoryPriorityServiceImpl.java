package uk.gegc.adaptive.features.priority.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.adaptive.features.categoryrating.domain.model.CategoryMicroRating;
import uk.gegc.adaptive.features.categoryrating.domain.repository.CategoryMicroRatingRepository;
import uk.gegc.adaptive.features.history.domain.repository.QuestionHistoryRepository;
import uk.gegc.adaptive.features.priority.application.CategoryPriorityService;
import uk.gegc.adaptive.features.priority.application.PriorityWeightCalculator;
import uk.gegc.adaptive.features.priority.application.dto.CategoryPriorityDto;
import uk.gegc.adaptive.features.priority.domain.model.CategoryPracticePriority;
import uk.gegc.adaptive.features.priority.domain.repository.CategoryPracticePriorityRepository;
import uk.gegc.adaptive.features.question.domain.repository.QuestionRepository;
import uk.gegc.adaptive.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class CategoryPriorityServiceImpl implements CategoryPriorityService {

    private final CategoryMicroRatingRepository microRatingRepository;
    private final CategoryPracticePriorityRepository priorityRepository;
    private final QuestionRepository questionRepository;
    private final QuestionHistoryRepository historyRepository;
    private final PriorityWeightCalculator weightCalculator;
    private final Clock clock;

    @Override
    public int recalculateAll(UUID learnerId) {
        Instant now = Instant.now(clock);
        List<CategoryMicroRating> microRatings = microRatingRepository.findAllByLearnerIdWithCategory(learnerId);
        Map<UUID, CategoryPracticePriority> existing = priorityRepository.findAllByLearnerId(learnerId).stream()
                .collect(Collectors.toMap(p -> p.getCategory().getId(), Function.identity()));

        int changed = 0;
        for (CategoryMicroRating microRating : microRatings) {
            UUID categoryId = microRating.getCategory().getId();
            double weight = weightCalculator.weight(microRating.getRating(), microRating.getSuccessRate());
            long available = questionRepository.countActiveByCategoryId(categoryId);
            long retired = historyRepository.countRetiredInCategory(learnerId, categoryId);
            int questionsNeeded = (int) Math.max(0, available - retired);
            int ratingDeficit = weightCalculator.ratingDeficit(microRating.getRating());
            double accuracyDeficit = weightCalculator.accuracyDeficit(microRating.getSuccessRate());
            Instant nextPractice = weightCalculator.nextPracticeAt(microRating.getLastAttemptAt(), weight);

            CategoryPracticePriority priority = existing.get(categoryId);
            if (priority == null) {
                priority = new CategoryPracticePriority();
                priority.setLearnerId(learnerId);
                priority.setCategory(microRating.getCategory());
            } else if (isUnchanged(priority, weight, questionsNeeded, ratingDeficit, accuracyDeficit, nextPractice)) {
                continue;
            }

            priority.setPriorityWeight(weight);
            priority.setQuestionsNeeded(questionsNeeded);
            priority.setRatingDeficit(ratingDeficit);
            priority.setAccuracyDeficit(accuracyDeficit);
            priority.setNextPracticeRecommendedAt(nextPractice);
            priority.setLastCalculatedAt(now);
            priorityRepository.save(priority);
            changed++;
        }

        log.debug("Recalculated priorities for learner {}: categories={}, changed={}",
                learnerId, microRatings.size(), changed);
        return changed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CategoryPriorityDto> topPriorities(UUID learnerId, int limit) {
        if (limit <= 0) {
            throw new ValidationException("Priority limit must be positive");
        }
        List<CategoryPracticePriority> priorities =
                priorityRepository.findTopByLearnerId(learnerId, PageRequest.of(0, limit));
        Map<UUID, CategoryMicroRating> microRatings = microRatingRepository.findAllByLearnerIdWithCategory(learnerId)
                .stream()
                .collect(Collectors.toMap(m -> m.getCategory().getId(), Function.identity()));

        List<CategoryPriorityDto> result = new ArrayList<>(priorities.size());
        for (CategoryPracticePriority priority : priorities) {
            UUID categoryId = priority.getCategory().getId();
            CategoryMicroRating microRating = microRatings.get(categoryId);
            result.add(new CategoryPriorityDto(
                    categoryId,
                    priority.getCategory().getName(),
                    priority.getPriorityWeight(),
                    priority.getQuestionsNeeded(),
                    priority.getRatingDeficit(),
                    priority.getAccuracyDeficit(),
                    microRating != null ? microRating.getRating() : 0,
                    microRating != null ? microRating.getSuccessRate() : 0.0,
                    priority.getNextPracticeRecommendedAt()
            ));
        }
        return result;
    }

    private boolean isUnchanged(CategoryPracticePriority priority,
                                double weight,
                                int questionsNeeded,
                                int ratingDeficit,
                                double accuracyDeficit,
                                Instant nextPractice) {
        return Double.compare(priority.getPriorityWeight(), weight) == 0
                && priority.getQuestionsNeeded() == questionsNeeded
                && priority.getRatingDeficit() == ratingDeficit
                && Double.compare(priority.getAccuracyDeficit(), accuracyDeficit) == 0
                && Objects.equals(priority.getNextPracticeRecommendedAt(), nextPractice);
    }
}
