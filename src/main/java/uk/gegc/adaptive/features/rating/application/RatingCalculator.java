package uk.gegc.adaptive.features.rating.application;

import uk.gegc.adaptive.features.session.domain.model.SessionType;

public interface RatingCalculator {

    /**
     * Probability that an entity rated {@code rating} beats one rated {@code opponentRating}.
     */
    double expectedScore(int rating, int opponentRating);

    /**
     * Applies one encounter to both sides. The opponent receives the complementary outcome,
     * scaled by its own K-factor.
     */
    RatingOutcome calculate(int challengerRating, int challengerKFactor,
                            int opponentRating, int opponentKFactor,
                            boolean challengerSucceeded);

    int playerKFactor(int gamesPlayed);

    int questionKFactor(int timesRated);

    int categoryKFactor(int attempts);

    int adjustForSessionType(int kFactor, SessionType sessionType);

    double questionReliability(int timesRated);

    double playerConfidence(int gamesPlayed, double recentPerformance);

    record RatingOutcome(
            int challengerRating,
            int challengerDelta,
            int opponentRating,
            int opponentDelta,
            double expectedScore
    ) {
    }
}
