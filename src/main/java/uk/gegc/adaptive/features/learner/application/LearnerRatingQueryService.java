package uk.gegc.adaptive.features.learner.application;

import uk.gegc.adaptive.features.learner.application.dto.*;

import java.util.List;
import java.util.UUID;

/**
 * Read side of learner ratings. Nothing here creates rows: a learner without settled answers is
 * reported at the baseline rating.
 */
public interface LearnerRatingQueryService {

    LearnerRatingDto getOverallRating(UUID learnerId);

    /**
     * Every category the learner has a micro-rating in, by category name.
     */
    List<CategoryRatingDto> getCategoryRatings(UUID learnerId);

    CategoryRatingDto getCategoryRating(UUID learnerId, UUID categoryId);

    PerformanceDto getPerformance(UUID learnerId);

    List<LeaderboardEntryDto> getOverallLeaderboard(int limit);

    List<LeaderboardEntryDto> getCategoryLeaderboard(UUID categoryId, int limit);

    RankDto getOverallRank(UUID learnerId);

    RankDto getCategoryRank(UUID learnerId, UUID categoryId);
}
