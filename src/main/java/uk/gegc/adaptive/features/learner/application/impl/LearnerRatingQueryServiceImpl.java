package uk.gegc.adaptive.features.learner.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.category.domain.repository.CategoryRepository;
import uk.gegc.adaptive.features.categoryrating.domain.model.CategoryMicroRating;
import uk.gegc.adaptive.features.categoryrating.domain.model.PerformanceTrend;
import uk.gegc.adaptive.features.categoryrating.domain.repository.CategoryMicroRatingRepository;
import uk.gegc.adaptive.features.learner.application.LearnerRatingQueryService;
import uk.gegc.adaptive.features.learner.application.dto.*;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;
import uk.gegc.adaptive.features.learner.domain.repository.LearnerRatingRepository;
import uk.gegc.adaptive.features.rating.application.RatingCalculator;
import uk.gegc.adaptive.features.rating.config.RatingProperties;
import uk.gegc.adaptive.features.session.domain.model.QuestionAttempt;
import uk.gegc.adaptive.features.session.domain.repository.AttemptTotalsProjection;
import uk.gegc.adaptive.features.session.domain.repository.CategoryAttemptStatsProjection;
import uk.gegc.adaptive.features.session.domain.repository.QuestionAttemptRepository;
import uk.gegc.adaptive.shared.exception.ResourceNotFoundException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class LearnerRatingQueryServiceImpl implements LearnerRatingQueryService {

    static final int PROGRESSION_LENGTH = 20;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LearnerRatingRepository learnerRatingRepository;
    private final CategoryMicroRatingRepository microRatingRepository;
    private final CategoryRepository categoryRepository;
    private final QuestionAttemptRepository attemptRepository;
    private final RatingCalculator ratingCalculator;
    private final RatingProperties ratingProperties;

    @Override
    public LearnerRatingDto getOverallRating(UUID learnerId) {
        return learnerRatingRepository.findByLearnerId(learnerId)
                .map(rating -> new LearnerRatingDto(
                        learnerId,
                        rating.getRating(),
                        rating.getGamesPlayed(),
                        rating.getWins(),
                        rating.getLosses(),
                        rating.getCurrentStreak(),
                        rating.getBestRating(),
                        ratingCalculator.playerKFactor(rating.getGamesPlayed()),
                        rating.getConfidenceLevel(),
                        rating.getUpdatedAt()))
                .orElseGet(() -> new LearnerRatingDto(
                        learnerId,
                        ratingProperties.getBaselineRating(),
                        0, 0, 0, 0,
                        ratingProperties.getBaselineRating(),
                        ratingCalculator.playerKFactor(0),
                        0.0,
                        null));
    }

    @Override
    public List<CategoryRatingDto> getCategoryRatings(UUID learnerId) {
        return microRatingRepository.findAllByLearnerIdWithCategory(learnerId).stream()
                .map(LearnerRatingQueryServiceImpl::toCategoryRating)
                .sorted(Comparator.comparing(CategoryRatingDto::categoryName, String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    @Override
    public CategoryRatingDto getCategoryRating(UUID learnerId, UUID categoryId) {
        Category category = loadCategory(categoryId);
        return microRatingRepository.findByLearnerIdAndCategory_Id(learnerId, categoryId)
                .map(LearnerRatingQueryServiceImpl::toCategoryRating)
                .orElseGet(() -> new CategoryRatingDto(
                        category.getId(), category.getName(), ratingProperties.getBaselineRating(),
                        0, 0, 0.0, 0.0, PerformanceTrend.STABLE, 0, null));
    }

    @Override
    public PerformanceDto getPerformance(UUID learnerId) {
        AttemptTotalsProjection totals = attemptRepository.summarizeByLearnerId(learnerId);
        long answered = totals != null ? totals.getTotalAnswered() : 0;
        long correct = totals != null && totals.getTotalCorrect() != null ? totals.getTotalCorrect() : 0;
        double averageTime = totals != null && totals.getAverageTimeSeconds() != null ? totals.getAverageTimeSeconds() : 0.0;
        PerformanceDto.Totals overall = new PerformanceDto.Totals(
                answered,
                correct,
                percentage(correct, answered),
                scale(averageTime),
                totals != null ? totals.getFirstAnsweredAt() : null,
                totals != null ? totals.getLastAnsweredAt() : null
        );

        List<CategoryAttemptStatsProjection> perCategory = attemptRepository.summarizeByCategory(learnerId);
        Map<UUID, String> names = categoryRepository.findAllById(
                        perCategory.stream().map(CategoryAttemptStatsProjection::getCategoryId).toList())
                .stream()
                .collect(Collectors.toMap(Category::getId, Category::getName));
        List<PerformanceDto.CategoryPerformance> byCategory = perCategory.stream()
                .map(stats -> new PerformanceDto.CategoryPerformance(
                        stats.getCategoryId(),
                        names.get(stats.getCategoryId()),
                        stats.getAttempts(),
                        stats.getCorrect(),
                        percentage(stats.getCorrect(), stats.getAttempts()),
                        scale(stats.getAverageTimeSeconds())))
                .sorted(Comparator.comparing(PerformanceDto.CategoryPerformance::categoryName,
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .toList();

        List<QuestionAttempt> latest = new ArrayList<>(attemptRepository.findAllByLearnerIdOrderByAnsweredAtDescPositionDesc(
                learnerId, PageRequest.of(0, PROGRESSION_LENGTH)));
        Collections.reverse(latest);
        List<PerformanceDto.RatingPoint> progression = latest.stream()
                .map(a -> new PerformanceDto.RatingPoint(
                        a.getSessionId(), a.getQuestionId(), a.isCorrect(), a.getLearnerRatingAfter(), a.getAnsweredAt()))
                .toList();

        return new PerformanceDto(overall, byCategory, progression);
    }

    @Override
    public List<LeaderboardEntryDto> getOverallLeaderboard(int limit) {
        List<LearnerRating> rows = learnerRatingRepository.findLeaderboard(PageRequest.of(0, limit));
        List<LeaderboardEntryDto> leaderboard = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            LearnerRating row = rows.get(i);
            leaderboard.add(new LeaderboardEntryDto(i + 1, row.getLearnerId(), row.getRating(), row.getGamesPlayed()));
        }
        return leaderboard;
    }

    @Override
    public List<LeaderboardEntryDto> getCategoryLeaderboard(UUID categoryId, int limit) {
        loadCategory(categoryId);
        List<CategoryMicroRating> rows = microRatingRepository.findCategoryLeaderboard(categoryId, PageRequest.of(0, limit));
        List<LeaderboardEntryDto> leaderboard = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            CategoryMicroRating row = rows.get(i);
            leaderboard.add(new LeaderboardEntryDto(i + 1, row.getLearnerId(), row.getRating(), row.getAttempts()));
        }
        return leaderboard;
    }

    @Override
    public RankDto getOverallRank(UUID learnerId) {
        int rating = learnerRatingRepository.findByLearnerId(learnerId)
                .map(LearnerRating::getRating)
                .orElse(ratingProperties.getBaselineRating());
        long above = learnerRatingRepository.countRankedAbove(rating);
        long total = learnerRatingRepository.countRanked();
        return rank(null, rating, above, total);
    }

    @Override
    public RankDto getCategoryRank(UUID learnerId, UUID categoryId) {
        loadCategory(categoryId);
        int rating = microRatingRepository.findByLearnerIdAndCategory_Id(learnerId, categoryId)
                .map(CategoryMicroRating::getRating)
                .orElse(ratingProperties.getBaselineRating());
        long above = microRatingRepository.countRankedAboveInCategory(categoryId, rating);
        long total = microRatingRepository.countRankedInCategory(categoryId);
        return rank(categoryId, rating, above, total);
    }

    private Category loadCategory(UUID categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category " + categoryId + " not found"));
    }

    // percentile is 100 while nobody is ranked
    static RankDto rank(UUID categoryId, int rating, long above, long total) {
        int rank = (int) above + 1;
        int percentile = total > 0
                ? (int) Math.round((1 - (double) (rank - 1) / total) * 100)
                : 100;
        return new RankDto(categoryId, rank, rating, total, Math.max(0, percentile));
    }

    private static CategoryRatingDto toCategoryRating(CategoryMicroRating microRating) {
        return new CategoryRatingDto(
                microRating.getCategory().getId(),
                microRating.getCategory().getName(),
                microRating.getRating(),
                microRating.getAttempts(),
                microRating.getCorrectAttempts(),
                microRating.getSuccessRate(),
                microRating.getRecentAccuracy(),
                microRating.getTrend(),
                microRating.getQuestionsMastered(),
                microRating.getLastAttemptAt()
        );
    }

    private static BigDecimal percentage(long part, long whole) {
        return whole == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal scale(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
